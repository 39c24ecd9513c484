package crm.sync.app.repository;

import crm.sync.app.entity.OAuthState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface OAuthStateRepository extends JpaRepository<OAuthState, String> {
    // Row count tells the caller whether it won the race to consume the state
    @Modifying
    @Query("DELETE FROM OAuthState s WHERE s.state = :state")
    int deleteByStateValue(@Param("state") String state);

    @Modifying
    @Query("DELETE FROM OAuthState s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
