package crm.sync.app.service.job;

import crm.sync.app.entity.SyncJob;
import crm.sync.app.service.NotificationService;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.sync.SyncOrchestrator;
import crm.sync.app.service.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claims due jobs and runs them on the sync executor. A job runs at most once at a time per
 * user and integration because claiming is a conditional QUEUED to ACTIVE update.
 */
@Slf4j
@Service
public class SyncJobWorker {
    private final SyncJobService syncJobService;
    private final SyncOrchestrator syncOrchestrator;
    private final BackoffPolicy backoffPolicy;
    private final NotificationService notificationService;
    private final ThreadPoolTaskExecutor syncJobExecutor;
    private final Map<String, RunningJob> running = new ConcurrentHashMap<>();

    @Value("${crm.sync.jobs.timeout-minutes:30}")
    private long timeoutMinutes;

    public SyncJobWorker(SyncJobService syncJobService,
                         SyncOrchestrator syncOrchestrator,
                         BackoffPolicy backoffPolicy,
                         NotificationService notificationService,
                         @Qualifier("syncJobExecutor") ThreadPoolTaskExecutor syncJobExecutor) {
        this.syncJobService = syncJobService;
        this.syncOrchestrator = syncOrchestrator;
        this.backoffPolicy = backoffPolicy;
        this.notificationService = notificationService;
        this.syncJobExecutor = syncJobExecutor;
    }

    @Scheduled(fixedDelayString = "${crm.sync.jobs.poll-interval-ms:5000}")
    public void poll() {
        int capacity = syncJobExecutor.getMaxPoolSize() - running.size();
        if (capacity <= 0) {
            return;
        }
        List<SyncJob> due = syncJobService.findDue(capacity);
        for (SyncJob candidate : due) {
            Optional<SyncJob> claimed = syncJobService.claim(candidate.getId());
            if (claimed.isEmpty()) {
                continue;
            }
            SyncJob job = claimed.get();
            RunningJob runningJob = new RunningJob(Instant.now());
            running.put(job.getId(), runningJob);
            try {
                runningJob.future = syncJobExecutor.submit(() -> run(job));
            } catch (RejectedExecutionException e) {
                running.remove(job.getId());
                log.warn("Executor is full, putting sync job {} back", job.getJobKey());
                syncJobService.retry(job.getId(), Duration.ZERO, "Waiting for a free worker");
            }
        }
    }

    void run(SyncJob job) {
        RunningJob runningJob = running.get(job.getId());
        // Gone or already claimed: the watchdog gave up on it before it left the executor queue
        if (runningJob == null || !runningJob.started.compareAndSet(false, true)) {
            return;
        }
        log.info("Running {} sync job {} (attempt {}/{})", job.getMode(), job.getJobKey(), job.getAttempts(), job.getMaxAttempts());
        SyncResult result;
        try {
            result = syncOrchestrator.sync(job.getUserId(), job.getIntegrationType(), job.getMode(),
                    percent -> syncJobService.updateProgress(job.getId(), percent));
        } catch (Exception e) {
            log.error("Sync job {} crashed: {}", job.getJobKey(), e.getMessage(), e);
            result = SyncResult.failure(ProviderOutcome.RETRYABLE, "Unexpected error during sync.", null);
        }

        running.remove(job.getId());
        if (runningJob.timedOut) {
            failTimedOut(job.getId());
            return;
        }
        finish(job, result);
    }

    void finish(SyncJob job, SyncResult result) {
        BackoffDecision decision = backoffPolicy.decide(job, result);
        switch (decision.getAction()) {
            case COMPLETE:
                syncJobService.complete(job.getId(), result);
                notificationService.syncCompleted(job.getUserId(), job.getIntegrationType(), result);
                break;
            case RETRY:
                syncJobService.retry(job.getId(), decision.getDelay(), result.getMessage());
                break;
            default:
                syncJobService.fail(job.getId(), result.getMessage());
                // Transient failures are picked up again by the next periodic pass
                boolean willRetry = result.getOutcome() == ProviderOutcome.RETRYABLE
                        || result.getOutcome() == ProviderOutcome.CURSOR_EXPIRED;
                notificationService.syncFailed(job.getUserId(), job.getIntegrationType(), result.getOutcome(), willRetry);
                break;
        }
    }

    /**
     * Cancels jobs that outlive the timeout. They are failed, not resumed; the next periodic
     * pass queues a fresh run. A job that already started keeps its active key until its thread
     * returns, so no second run of the same key can overlap it.
     */
    @Scheduled(fixedDelay = 60000)
    public void enforceTimeouts() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(timeoutMinutes));
        for (Map.Entry<String, RunningJob> entry : running.entrySet()) {
            RunningJob runningJob = entry.getValue();
            if (runningJob.startedAt.isAfter(cutoff) || runningJob.timedOut) {
                continue;
            }
            if (runningJob.started.compareAndSet(false, true)) {
                // Never left the executor queue, so nothing else will release it
                if (runningJob.future != null) {
                    runningJob.future.cancel(false);
                }
                running.remove(entry.getKey(), runningJob);
                failTimedOut(entry.getKey());
                continue;
            }
            runningJob.timedOut = true;
            log.warn("Sync job {} exceeded {} minutes, interrupting it", entry.getKey(), timeoutMinutes);
            if (runningJob.future != null) {
                runningJob.future.cancel(true);
            }
        }

        // Jobs claimed by a process that died without a restart of this one
        int stuck = syncJobService.failActiveStartedBefore(syncJobService.abandonedBefore(now), "Sync timed out",
                Set.copyOf(running.keySet()));
        if (stuck > 0) {
            log.warn("Failed {} sync job(s) that exceeded the timeout on another worker", stuck);
        }
    }

    private void failTimedOut(String jobId) {
        SyncJob job = syncJobService.fail(jobId, "Sync timed out after " + timeoutMinutes + " minutes");
        notificationService.syncFailed(job.getUserId(), job.getIntegrationType(), ProviderOutcome.RETRYABLE, true);
    }

    int runningCount() {
        return running.size();
    }

    private static final class RunningJob {
        private final Instant startedAt;
        private final AtomicBoolean started = new AtomicBoolean();
        private volatile boolean timedOut;
        private volatile Future<?> future;

        private RunningJob(Instant startedAt) {
            this.startedAt = startedAt;
        }
    }
}
