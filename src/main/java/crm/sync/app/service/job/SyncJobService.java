package crm.sync.app.service.job;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.entity.SyncJobStatus;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.repository.SyncJobRepository;
import crm.sync.app.service.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The persisted sync queue.
 *
 * <p>While a job is QUEUED or ACTIVE its {@code activeKey} holds the per-user job key, and the
 * unique constraint on that column lets only one such row exist per key. Enqueue is therefore
 * idempotent across threads and nodes without any lock.
 */
@Slf4j
@Service
public class SyncJobService {
    static final Duration COMPLETED_RETENTION = Duration.ofDays(1);
    static final Duration FAILED_RETENTION = Duration.ofDays(7);
    static final Duration TIMEOUT_GRACE = Duration.ofMinutes(5);

    private final SyncJobRepository syncJobRepository;

    @Value("${crm.sync.jobs.max-attempts:3}")
    private int maxAttempts;

    @Value("${crm.sync.jobs.stale-age-minutes:60}")
    private long staleAgeMinutes;

    @Value("${crm.sync.jobs.timeout-minutes:30}")
    private long timeoutMinutes;

    public SyncJobService(SyncJobRepository syncJobRepository) {
        this.syncJobRepository = syncJobRepository;
    }

    /**
     * Queues a sync unless one is already pending for the same user and type, in which case
     * the pending job is returned. An immediate request pulls a waiting job forward.
     */
    public SyncJob enqueue(String userId, IntegrationType type, SyncMode mode, Duration delay, boolean immediate) {
        String jobKey = SyncJob.keyFor(userId, type);
        Optional<SyncJob> pending = syncJobRepository.findByActiveKey(jobKey);
        if (pending.isPresent()) {
            return promote(pending.get(), mode, immediate);
        }

        Instant now = Instant.now();
        SyncJob job = new SyncJob();
        job.setJobKey(jobKey);
        job.setActiveKey(jobKey);
        job.setUserId(userId);
        job.setIntegrationType(type);
        job.setMode(mode);
        job.setPriority(immediate ? SyncJob.PRIORITY_HIGH : SyncJob.PRIORITY_NORMAL);
        job.setStatus(SyncJobStatus.QUEUED);
        job.setMaxAttempts(maxAttempts);
        job.setRunAt(delay != null && !immediate ? now.plus(delay) : now);
        job.setCreatedAt(now);

        try {
            SyncJob saved = syncJobRepository.saveAndFlush(job);
            log.info("Enqueued {} sync job {} to run at {}", mode, jobKey, saved.getRunAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Lost the race to another enqueue for the same key
            log.debug("Sync job {} already pending", jobKey);
            return syncJobRepository.findByActiveKey(jobKey)
                    .map(existing -> promote(existing, mode, immediate))
                    .orElseThrow(() -> new IllegalStateException("Could not enqueue sync job " + jobKey, e));
        }
    }

    private SyncJob promote(SyncJob job, SyncMode mode, boolean immediate) {
        if (!immediate || job.getStatus() != SyncJobStatus.QUEUED) {
            log.debug("Sync job {} is already {}, not enqueuing another", job.getJobKey(), job.getStatus());
            return job;
        }
        job.setPriority(SyncJob.PRIORITY_HIGH);
        job.setRunAt(Instant.now());
        if (mode == SyncMode.FULL) {
            job.setMode(SyncMode.FULL);
        }
        log.info("Pulled pending sync job {} forward", job.getJobKey());
        return syncJobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public List<SyncJob> findDue(int limit) {
        return syncJobRepository.findDue(SyncJobStatus.QUEUED, Instant.now(), PageRequest.of(0, limit));
    }

    /**
     * Moves a due job to ACTIVE. Returns empty when another worker claimed it first.
     */
    @Transactional
    public Optional<SyncJob> claim(String jobId) {
        if (syncJobRepository.transition(jobId, SyncJobStatus.QUEUED, SyncJobStatus.ACTIVE, Instant.now()) == 0) {
            return Optional.empty();
        }
        return syncJobRepository.findById(jobId);
    }

    @Transactional
    public void updateProgress(String jobId, int progress) {
        syncJobRepository.updateProgress(jobId, Math.max(0, Math.min(100, progress)), SyncJobStatus.ACTIVE);
    }

    @Transactional
    public SyncJob complete(String jobId, SyncResult result) {
        SyncJob job = load(jobId);
        job.setStatus(SyncJobStatus.COMPLETED);
        job.setActiveKey(null);
        job.setProgress(100);
        job.setFinishedAt(Instant.now());
        job.setLastError(null);
        job.setItemsSynced(result.getSynced());
        job.setItemsAdded(result.getAdded());
        job.setItemsUpdated(result.getUpdated());
        job.setItemsSkipped(result.getSkipped());
        return syncJobRepository.save(job);
    }

    /**
     * Puts the job back in the queue. It keeps its active key, so no second job can be
     * enqueued for the same user while it waits.
     */
    @Transactional
    public SyncJob retry(String jobId, Duration delay, String reason) {
        SyncJob job = load(jobId);
        job.setStatus(SyncJobStatus.QUEUED);
        job.setRunAt(Instant.now().plus(delay));
        job.setProgress(0);
        job.setLastError(truncate(reason));
        log.info("Sync job {} will retry in {}s (attempt {}/{})",
                job.getJobKey(), delay.getSeconds(), job.getAttempts(), job.getMaxAttempts());
        return syncJobRepository.save(job);
    }

    @Transactional
    public SyncJob fail(String jobId, String reason) {
        SyncJob job = load(jobId);
        job.setStatus(SyncJobStatus.FAILED);
        job.setActiveKey(null);
        job.setFinishedAt(Instant.now());
        job.setLastError(truncate(reason));
        log.warn("Sync job {} failed after {} attempt(s): {}", job.getJobKey(), job.getAttempts(), reason);
        return syncJobRepository.save(job);
    }

    /**
     * Drops waiting jobs for a user and type. A running job is left to finish.
     */
    @Transactional
    public int cancelPending(String userId, IntegrationType type) {
        List<SyncJob> pending = syncJobRepository.findByUserIdAndIntegrationTypeAndStatusIn(
                userId, type, List.of(SyncJobStatus.QUEUED));
        syncJobRepository.deleteAll(pending);
        if (!pending.isEmpty()) {
            log.info("Cancelled {} pending {} sync job(s) for user {}", pending.size(), type, userId);
        }
        return pending.size();
    }

    @Transactional(readOnly = true)
    public QueueStats queueStats() {
        Instant now = Instant.now();
        long queued = syncJobRepository.countByStatus(SyncJobStatus.QUEUED);
        long delayed = syncJobRepository.countByStatusAndRunAtAfter(SyncJobStatus.QUEUED, now);
        return new QueueStats(
                queued - delayed,
                syncJobRepository.countByStatus(SyncJobStatus.ACTIVE),
                syncJobRepository.countByStatus(SyncJobStatus.COMPLETED),
                syncJobRepository.countByStatus(SyncJobStatus.FAILED),
                delayed);
    }

    /**
     * Runs once at startup: queued jobs older than the stale age are dropped and ACTIVE jobs
     * that outlived the run timeout are failed. Younger ACTIVE jobs may still be running on
     * another node, so they keep their key until the timeout sweep reaches them.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void cleanupStaleJobs() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(staleAgeMinutes));
        int purged = syncJobRepository.deleteCreatedBefore(SyncJobStatus.QUEUED, cutoff);

        int orphaned = failActiveStartedBefore(abandonedBefore(Instant.now()), "Interrupted by a restart", Set.of());

        if (purged > 0 || orphaned > 0) {
            log.info("Startup cleanup removed {} stale queued job(s) and failed {} interrupted job(s)", purged, orphaned);
        }
    }

    /**
     * Start time before which an ACTIVE job can no longer be running anywhere: every worker
     * cancels its own jobs at the timeout, and the grace covers a slow cancellation.
     */
    public Instant abandonedBefore(Instant now) {
        return now.minus(Duration.ofMinutes(timeoutMinutes)).minus(TIMEOUT_GRACE);
    }

    /**
     * Fails ACTIVE jobs that started before {@code cutoff}, except those in {@code excludedIds}.
     * Their active key is released so the next periodic pass can queue a fresh run.
     */
    @Transactional
    public int failActiveStartedBefore(Instant cutoff, String reason, Set<String> excludedIds) {
        List<SyncJob> stuck = syncJobRepository.findByStatusAndStartedAtBefore(SyncJobStatus.ACTIVE, cutoff)
                .stream()
                .filter(job -> !excludedIds.contains(job.getId()))
                .collect(Collectors.toList());
        for (SyncJob job : stuck) {
            job.setStatus(SyncJobStatus.FAILED);
            job.setActiveKey(null);
            job.setFinishedAt(Instant.now());
            job.setLastError(reason);
        }
        syncJobRepository.saveAll(stuck);
        return stuck.size();
    }

    @Scheduled(cron = "0 30 3 * * *")
    @Transactional
    public void purgeFinishedJobs() {
        Instant now = Instant.now();
        int completed = syncJobRepository.deleteFinishedBefore(SyncJobStatus.COMPLETED, now.minus(COMPLETED_RETENTION));
        int failed = syncJobRepository.deleteFinishedBefore(SyncJobStatus.FAILED, now.minus(FAILED_RETENTION));
        log.info("Purged {} completed and {} failed sync job(s)", completed, failed);
    }

    private SyncJob load(String jobId) {
        return syncJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Sync job not found: " + jobId));
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 1000) {
            return reason;
        }
        return reason.substring(0, 1000);
    }
}
