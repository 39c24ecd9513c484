package crm.sync.app.service.job;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.entity.SyncState;
import crm.sync.app.repository.SyncStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Periodic trigger for background syncs. Calendar jobs are spread over a random delay and
 * mail jobs are released in batches, so a pass never bursts the providers' rate limits.
 */
@Slf4j
@Service
public class SyncJobScheduler {
    static final int EMAIL_BATCH_SIZE = 10;

    private final SyncStateRepository syncStateRepository;
    private final SyncJobService syncJobService;

    @Value("${crm.sync.jobs.max-jitter-ms:60000}")
    private long maxJitterMs;

    @Value("${crm.sync.jobs.email-stagger-ms:5000}")
    private long emailStaggerMs;

    public SyncJobScheduler(SyncStateRepository syncStateRepository, SyncJobService syncJobService) {
        this.syncStateRepository = syncStateRepository;
        this.syncJobService = syncJobService;
    }

    @Scheduled(cron = "${crm.sync.jobs.cron:0 */15 * * * *}")
    public void scheduleAll() {
        log.info("Periodic sync scheduling started");
        List<SyncState> states = syncStateRepository.findSchedulable();
        int queued = 0;
        int emailIndex = 0;
        for (SyncState state : states) {
            try {
                Duration delay;
                if (state.getIntegrationType().getDomain() == SyncDomain.EMAIL) {
                    delay = Duration.ofMillis((emailIndex / EMAIL_BATCH_SIZE) * emailStaggerMs);
                    emailIndex++;
                } else {
                    delay = Duration.ofMillis(jitter());
                }
                syncJobService.enqueue(state.getUserId(), state.getIntegrationType(), SyncMode.INCREMENTAL, delay, false);
                queued++;
            } catch (Exception e) {
                log.error("Failed to schedule {} sync for user {}: {}",
                        state.getIntegrationType(), state.getUserId(), e.getMessage(), e);
                // Continue with next user
            }
        }
        log.info("Periodic sync scheduling ended: {} of {} sync(s) queued", queued, states.size());
    }

    public SyncJob scheduleFor(String userId, IntegrationType type) {
        return syncJobService.enqueue(userId, type, SyncMode.INCREMENTAL, Duration.ofMillis(jitter()), false);
    }

    /**
     * Runs a sync as soon as a worker is free, ahead of periodic jobs.
     */
    public SyncJob queueImmediate(String userId, IntegrationType type, SyncMode mode) {
        return syncJobService.enqueue(userId, type, mode, Duration.ZERO, true);
    }

    private long jitter() {
        return maxJitterMs > 0 ? ThreadLocalRandom.current().nextLong(maxJitterMs) : 0;
    }
}
