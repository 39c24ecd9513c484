package crm.sync.app.repository;

import crm.sync.app.entity.InteractionParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface InteractionParticipantRepository extends JpaRepository<InteractionParticipant, String> {
    @Modifying
    @Query("UPDATE InteractionParticipant p SET p.contactId = :primaryId WHERE p.contactId IN :duplicateIds")
    int reassignContact(@Param("primaryId") String primaryId, @Param("duplicateIds") Collection<String> duplicateIds);
}
