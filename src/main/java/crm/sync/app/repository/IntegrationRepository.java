package crm.sync.app.repository;

import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, String> {
    @Query("SELECT i FROM Integration i JOIN FETCH i.user u WHERE u.id = :userId AND i.type = :type")
    Optional<Integration> findByUserIdAndType(@Param("userId") String userId, @Param("type") IntegrationType type);

    @Query("SELECT i FROM Integration i JOIN FETCH i.user u WHERE u.id = :userId AND i.type = :type AND i.active = true")
    Optional<Integration> findActiveByUserIdAndType(@Param("userId") String userId, @Param("type") IntegrationType type);

    @Query("SELECT i FROM Integration i WHERE i.user.id = :userId")
    List<Integration> findByUserId(@Param("userId") String userId);
}
