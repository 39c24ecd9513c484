package crm.sync.app.repository;

import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, String> {
    Optional<Interaction> findByUserIdAndExternalIdAndExternalSource(String userId, String externalId, String externalSource);

    Optional<Interaction> findByIdAndUserId(String id, String userId);

    long countByUserIdAndExternalSource(String userId, String externalSource);

    List<Interaction> findByUserIdAndTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
            String userId, InteractionType type, Instant from, Instant to);

    List<Interaction> findByUserIdAndTypeAndOccurredAtBetweenOrderByOccurredAtDesc(
            String userId, InteractionType type, Instant from, Instant to);
}
