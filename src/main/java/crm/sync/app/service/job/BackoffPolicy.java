package crm.sync.app.service.job;

import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.sync.SyncResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decides what happens to a job after a run. Rate limits, provider 5xx, network errors and
 * an unresolved expired cursor are retried with exponential backoff; a revoked grant or any
 * other provider refusal fails the job at once.
 */
@Component
public class BackoffPolicy {
    static final Duration MAX_DELAY = Duration.ofMinutes(15);

    @Value("${crm.sync.jobs.backoff-base-ms:5000}")
    private long backoffBaseMs;

    @Value("${crm.sync.jobs.email-backoff-base-ms:30000}")
    private long emailBackoffBaseMs;

    public BackoffDecision decide(SyncJob job, SyncResult result) {
        return decide(job, result.getOutcome(), result.getRetryAfter());
    }

    public BackoffDecision decide(SyncJob job, ProviderOutcome outcome, Duration retryAfter) {
        switch (outcome) {
            case SUCCESS:
                return BackoffDecision.complete();
            case RETRYABLE:
            case CURSOR_EXPIRED:
                if (job.getAttempts() >= job.getMaxAttempts()) {
                    return BackoffDecision.fail();
                }
                return BackoffDecision.retry(delayFor(job, retryAfter));
            default:
                return BackoffDecision.fail();
        }
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at 15 minutes but never shorter than Retry-After.
     */
    Duration delayFor(SyncJob job, Duration retryAfter) {
        long base = job.getIntegrationType().getDomain() == SyncDomain.EMAIL ? emailBackoffBaseMs : backoffBaseMs;
        int exponent = Math.max(0, Math.min(job.getAttempts() - 1, 20));
        Duration delay = Duration.ofMillis(base * (1L << exponent));
        if (delay.compareTo(MAX_DELAY) > 0) {
            delay = MAX_DELAY;
        }
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter;
        }
        return delay;
    }
}
