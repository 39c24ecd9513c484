package crm.sync.app.repository;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.entity.SyncJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, String> {
    Optional<SyncJob> findByActiveKey(String activeKey);

    @Query("SELECT j FROM SyncJob j WHERE j.status = :status AND j.runAt <= :now ORDER BY j.priority DESC, j.runAt ASC")
    List<SyncJob> findDue(@Param("status") SyncJobStatus status, @Param("now") Instant now, Pageable pageable);

    /**
     * QUEUED to ACTIVE transition. Returns 0 when another worker got there first.
     */
    @Modifying
    @Query("UPDATE SyncJob j SET j.status = :to, j.startedAt = :now, j.attempts = j.attempts + 1, j.progress = 0 " +
           "WHERE j.id = :id AND j.status = :from")
    int transition(@Param("id") String id,
                   @Param("from") SyncJobStatus from,
                   @Param("to") SyncJobStatus to,
                   @Param("now") Instant now);

    @Modifying
    @Query("UPDATE SyncJob j SET j.progress = :progress WHERE j.id = :id AND j.status = :status")
    int updateProgress(@Param("id") String id, @Param("progress") int progress, @Param("status") SyncJobStatus status);

    long countByStatus(SyncJobStatus status);

    long countByStatusAndRunAtAfter(SyncJobStatus status, Instant now);

    List<SyncJob> findByStatusAndStartedAtBefore(SyncJobStatus status, Instant cutoff);

    List<SyncJob> findByUserIdAndIntegrationTypeAndStatusIn(String userId, IntegrationType type, Collection<SyncJobStatus> statuses);

    @Modifying
    @Query("DELETE FROM SyncJob j WHERE j.status = :status AND j.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("status") SyncJobStatus status, @Param("cutoff") Instant cutoff);

    @Modifying
    @Query("DELETE FROM SyncJob j WHERE j.status = :status AND j.finishedAt < :cutoff")
    int deleteFinishedBefore(@Param("status") SyncJobStatus status, @Param("cutoff") Instant cutoff);
}
