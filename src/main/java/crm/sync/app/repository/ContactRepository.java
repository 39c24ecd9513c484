package crm.sync.app.repository;

import crm.sync.app.entity.Contact;
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
public interface ContactRepository extends JpaRepository<Contact, String> {
    /**
     * Case-insensitive "in-set" lookup; callers pass already lowercased emails.
     */
    @Query("SELECT c FROM Contact c WHERE c.userId = :userId AND LOWER(c.email) IN :emails")
    List<Contact> findByUserIdAndEmailIn(@Param("userId") String userId, @Param("emails") Collection<String> emails);

    Optional<Contact> findByIdAndUserId(String id, String userId);

    List<Contact> findByUserIdAndIdIn(String userId, Collection<String> ids);

    List<Contact> findByUserIdOrderByIdAsc(String userId, Pageable pageable);

    long countByUserId(String userId);

    /**
     * Moves lastContact forward to {@code occurredAt}; rows already at or past it are untouched.
     */
    @Modifying
    @Query("UPDATE Contact c SET c.lastContact = :occurredAt, c.updatedAt = :now " +
           "WHERE c.id IN :ids AND (c.lastContact IS NULL OR c.lastContact < :occurredAt)")
    int advanceLastContact(@Param("ids") Collection<String> ids,
                           @Param("occurredAt") Instant occurredAt,
                           @Param("now") Instant now);
}
