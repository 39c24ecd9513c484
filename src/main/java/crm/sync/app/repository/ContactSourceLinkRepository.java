package crm.sync.app.repository;

import crm.sync.app.entity.ContactSourceLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ContactSourceLinkRepository extends JpaRepository<ContactSourceLink, String> {
    boolean existsByContactIdAndExternalId(String contactId, String externalId);

    List<ContactSourceLink> findByContactIdIn(Collection<String> contactIds);
}
