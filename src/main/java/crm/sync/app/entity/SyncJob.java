package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A queued sync for one user and one integration type.
 * {@code activeKey} mirrors {@code jobKey} while the job is QUEUED or ACTIVE and is cleared
 * once it finishes; the unique constraint on it is what keeps one pending job per key.
 */
@Entity
@Table(name = "sync_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_sync_job_active_key", columnNames = "active_key"),
        indexes = {
                @Index(name = "idx_sync_job_status_run_at", columnList = "status, run_at"),
                @Index(name = "idx_sync_job_key", columnList = "job_key")
        })
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class SyncJob {
    public static final int PRIORITY_NORMAL = 0;
    public static final int PRIORITY_HIGH = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "job_key", nullable = false)
    private String jobKey;

    @Column(name = "active_key")
    private String activeKey;

    @Column(nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private IntegrationType integrationType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncMode mode;

    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncJobStatus status;

    private int attempts;

    private int maxAttempts;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    private Instant startedAt;

    private Instant finishedAt;

    private int progress;

    @Column(length = 1000)
    private String lastError;

    private int itemsSynced;

    private int itemsAdded;

    private int itemsUpdated;

    private int itemsSkipped;

    private Instant createdAt;

    public static String keyFor(String userId, IntegrationType type) {
        return "sync-" + type.getSlug() + "-" + userId;
    }
}
