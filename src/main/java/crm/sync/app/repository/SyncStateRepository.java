package crm.sync.app.repository;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncStateRepository extends JpaRepository<SyncState, String> {
    Optional<SyncState> findByUserIdAndIntegrationType(String userId, IntegrationType integrationType);

    void deleteByUserIdAndIntegrationType(String userId, IntegrationType integrationType);

    /**
     * Enabled sync states whose integration is connected and active.
     */
    @Query("SELECT s FROM SyncState s WHERE s.syncEnabled = true AND EXISTS (" +
           "SELECT i FROM Integration i WHERE i.user.id = s.userId AND i.type = s.integrationType AND i.active = true) " +
           "ORDER BY s.userId")
    List<SyncState> findSchedulable();
}
