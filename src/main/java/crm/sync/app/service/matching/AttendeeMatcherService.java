package crm.sync.app.service.matching;

import crm.sync.app.entity.Contact;
import crm.sync.app.entity.ContactSource;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.Participant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves participants to the user's contacts with a single batched lookup per call.
 */
@Slf4j
@Service
public class AttendeeMatcherService {
    private final ContactRepository contactRepository;

    public AttendeeMatcherService(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }

    /**
     * Matches participants to contacts, creating contacts for those not found.
     * Participants without an email are dropped.
     */
    public List<ContactMatch> match(String userId, List<Participant> participants) {
        return match(userId, participants, true, ContactSource.CALENDAR_SYNC);
    }

    /**
     * Matches participants to existing contacts only.
     */
    public List<ContactMatch> matchExisting(String userId, List<Participant> participants) {
        return match(userId, participants, false, null);
    }

    public List<ContactMatch> match(String userId, List<Participant> participants, boolean createMissing, ContactSource source) {
        Map<String, Participant> byEmail = new LinkedHashMap<>();
        for (Participant participant : participants) {
            String email = participant.normalizedEmail();
            if (email == null) {
                continue;
            }
            Participant seen = byEmail.get(email);
            // Keep the first participant that carries a display name
            if (seen == null || (isBlank(seen.getDisplayName()) && !isBlank(participant.getDisplayName()))) {
                byEmail.put(email, participant);
            }
        }
        if (byEmail.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, Contact> existing = findByEmails(userId, byEmail.keySet());

        List<ContactMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Participant> entry : byEmail.entrySet()) {
            Contact contact = existing.get(entry.getKey());
            if (contact != null) {
                matches.add(new ContactMatch(entry.getValue(), contact, false));
            } else if (createMissing) {
                Contact created = createFromParticipant(userId, entry.getValue(), source);
                matches.add(new ContactMatch(entry.getValue(), created, true));
            }
        }
        return matches;
    }

    /**
     * One query for all emails; the result is keyed by lowercase email.
     */
    public Map<String, Contact> findByEmails(String userId, Collection<String> normalizedEmails) {
        Map<String, Contact> result = new LinkedHashMap<>();
        if (normalizedEmails.isEmpty()) {
            return result;
        }
        for (Contact contact : contactRepository.findByUserIdAndEmailIn(userId, normalizedEmails)) {
            if (contact.getEmail() != null) {
                result.putIfAbsent(contact.getEmail().toLowerCase(Locale.ROOT), contact);
            }
        }
        return result;
    }

    public Contact createFromParticipant(String userId, Participant participant, ContactSource source) {
        String email = participant.normalizedEmail();
        ParsedName name = NameParser.parse(participant.getDisplayName(), email);

        Contact contact = new Contact();
        contact.setUserId(userId);
        contact.setEmail(email);
        contact.setFirstName(name.getFirstName());
        contact.setLastName(name.getLastName());
        contact.setCompany(CompanyInference.infer(email));
        contact.setSource(source != null ? source : ContactSource.CALENDAR_SYNC);
        Contact saved = contactRepository.save(contact);
        log.debug("Created contact {} for user {} from {}", saved.getId(), userId, source);
        return saved;
    }

    /**
     * Collapses material attendees across events by lowercase email. Organizers, attendees
     * that did not accept or tentatively accept, and the user's own addresses are left out.
     */
    public List<AttendeeAggregate> aggregateAttendees(List<ExternalItem> events, Set<String> selfEmails) {
        Map<String, AttendeeAggregate> byEmail = new LinkedHashMap<>();
        List<ExternalItem> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(ExternalItem::getStartsAt, Comparator.nullsLast(Comparator.naturalOrder())));

        for (ExternalItem event : ordered) {
            for (Participant participant : event.getParticipants()) {
                if (!participant.isMaterialAttendee()) {
                    continue;
                }
                String email = participant.normalizedEmail();
                if (selfEmails.contains(email)) {
                    continue;
                }
                byEmail.computeIfAbsent(email, AttendeeAggregate::new)
                        .record(participant.getDisplayName(), event.getStartsAt());
            }
        }
        return new ArrayList<>(byEmail.values());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
