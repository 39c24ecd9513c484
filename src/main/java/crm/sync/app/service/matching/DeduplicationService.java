package crm.sync.app.service.matching;

import crm.sync.app.entity.Contact;
import crm.sync.app.entity.ContactSourceLink;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.repository.ContactSourceLinkRepository;
import crm.sync.app.repository.InteractionParticipantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fuzzy duplicate detection and merging across a user's contacts.
 *
 * <p>An exact (case-insensitive) email match is always EXACT. Otherwise the score is the
 * average edit-distance similarity over the fields present on both contacts: email, phone
 * (digits only), first name, last name and company.
 */
@Slf4j
@Service
public class DeduplicationService {
    static final int BATCH_SIZE = 100;

    private final ContactRepository contactRepository;
    private final InteractionParticipantRepository participantRepository;
    private final ContactSourceLinkRepository sourceLinkRepository;

    public DeduplicationService(ContactRepository contactRepository,
                                InteractionParticipantRepository participantRepository,
                                ContactSourceLinkRepository sourceLinkRepository) {
        this.contactRepository = contactRepository;
        this.participantRepository = participantRepository;
        this.sourceLinkRepository = sourceLinkRepository;
    }

    /**
     * Scores two contacts. Returns null when they fall below the POTENTIAL threshold.
     */
    public DuplicateMatch score(Contact a, Contact b) {
        String emailA = normalizeText(a.getEmail());
        String emailB = normalizeText(b.getEmail());
        if (emailA != null && emailA.equals(emailB)) {
            return new DuplicateMatch(a.getId(), b.getId(), 1.0, MatchType.EXACT, List.of("email"));
        }

        double total = 0;
        int compared = 0;
        List<String> matchedFields = new ArrayList<>();

        String[][] fields = {
                {"email", emailA, emailB},
                {"phone", normalizePhone(a.getPhone()), normalizePhone(b.getPhone())},
                {"firstName", normalizeText(a.getFirstName()), normalizeText(b.getFirstName())},
                {"lastName", normalizeText(a.getLastName()), normalizeText(b.getLastName())},
                {"company", normalizeText(a.getCompany()), normalizeText(b.getCompany())}
        };
        for (String[] field : fields) {
            if (field[1] == null || field[2] == null) {
                continue;
            }
            double similarity = StringSimilarity.similarity(field[1], field[2]);
            total += similarity;
            compared++;
            if (similarity >= MatchType.POTENTIAL.getThreshold()) {
                matchedFields.add(field[0]);
            }
        }
        if (compared == 0) {
            return null;
        }

        double score = total / compared;
        MatchType type = MatchType.forScore(score);
        return type == null ? null : new DuplicateMatch(a.getId(), b.getId(), score, type, matchedFields);
    }

    /**
     * Duplicates of {@code candidate} among the user's contacts, best first.
     */
    public List<DuplicateMatch> findDuplicates(String userId, Contact candidate) {
        List<DuplicateMatch> matches = new ArrayList<>();
        for (Contact other : loadAll(userId)) {
            if (candidate.getId() != null && candidate.getId().equals(other.getId())) {
                continue;
            }
            DuplicateMatch match = score(candidate, other);
            if (match != null) {
                matches.add(match);
            }
        }
        matches.sort(Comparator.comparingDouble(DuplicateMatch::getScore).reversed());
        return matches;
    }

    /**
     * Every duplicate pair among the user's contacts, each pair reported once, best first.
     */
    public List<DuplicateMatch> batchFindDuplicates(String userId) {
        List<Contact> contacts = loadAll(userId);
        List<DuplicateMatch> matches = new ArrayList<>();
        for (int start = 0; start < contacts.size(); start += BATCH_SIZE) {
            int end = Math.min(start + BATCH_SIZE, contacts.size());
            for (int i = start; i < end; i++) {
                for (int j = i + 1; j < contacts.size(); j++) {
                    DuplicateMatch match = score(contacts.get(i), contacts.get(j));
                    if (match != null) {
                        matches.add(match);
                    }
                }
            }
            log.debug("Duplicate scan for user {}: {}/{} contacts compared", userId, end, contacts.size());
        }
        matches.sort(Comparator.comparingDouble(DuplicateMatch::getScore).reversed());
        log.info("Duplicate scan for user {} found {} candidate pairs", userId, matches.size());
        return matches;
    }

    /**
     * Folds the duplicates into {@code primaryId}: empty fields are filled, lastContact keeps
     * the latest value, interaction and source links move over, and the duplicates are deleted.
     */
    @Transactional
    public Contact mergeContacts(String userId, String primaryId, List<String> duplicateIds) {
        Contact primary = contactRepository.findByIdAndUserId(primaryId, userId)
                .orElseThrow(() -> new IllegalArgumentException("Contact not found: " + primaryId));

        Set<String> ids = new LinkedHashSet<>(duplicateIds);
        ids.remove(primaryId);
        if (ids.isEmpty()) {
            return primary;
        }
        List<Contact> duplicates = contactRepository.findByUserIdAndIdIn(userId, ids);
        if (duplicates.size() != ids.size()) {
            throw new IllegalArgumentException("One or more contacts to merge were not found");
        }

        for (Contact duplicate : duplicates) {
            if (isBlank(primary.getFirstName()) || "Unknown".equals(primary.getFirstName())) {
                primary.setFirstName(duplicate.getFirstName());
            }
            if (isBlank(primary.getLastName())) {
                primary.setLastName(duplicate.getLastName());
            }
            if (isBlank(primary.getEmail())) {
                primary.setEmail(duplicate.getEmail());
            }
            if (isBlank(primary.getPhone())) {
                primary.setPhone(duplicate.getPhone());
            }
            if (isBlank(primary.getCompany())) {
                primary.setCompany(duplicate.getCompany());
            }
            if (isBlank(primary.getTitle())) {
                primary.setTitle(duplicate.getTitle());
            }
            if (duplicate.getLastContact() != null
                    && (primary.getLastContact() == null || duplicate.getLastContact().isAfter(primary.getLastContact()))) {
                primary.setLastContact(duplicate.getLastContact());
            }
        }

        int moved = participantRepository.reassignContact(primaryId, ids);
        moveSourceLinks(primaryId, ids);

        contactRepository.deleteAll(duplicates);
        Contact saved = contactRepository.save(primary);
        log.info("Merged {} contacts into {} for user {} ({} interaction links moved)", ids.size(), primaryId, userId, moved);
        return saved;
    }

    private void moveSourceLinks(String primaryId, Set<String> duplicateIds) {
        Set<String> all = new LinkedHashSet<>(duplicateIds);
        all.add(primaryId);
        List<ContactSourceLink> links = sourceLinkRepository.findByContactIdIn(all);
        Set<String> primaryExternalIds = links.stream()
                .filter(link -> primaryId.equals(link.getContactId()))
                .map(ContactSourceLink::getExternalId)
                .collect(Collectors.toSet());

        for (ContactSourceLink link : links) {
            if (primaryId.equals(link.getContactId())) {
                continue;
            }
            if (primaryExternalIds.add(link.getExternalId())) {
                link.setContactId(primaryId);
                sourceLinkRepository.save(link);
            } else {
                sourceLinkRepository.delete(link);
            }
        }
    }

    private List<Contact> loadAll(String userId) {
        List<Contact> contacts = new ArrayList<>();
        int page = 0;
        List<Contact> batch;
        do {
            batch = contactRepository.findByUserIdOrderByIdAsc(userId, PageRequest.of(page++, BATCH_SIZE));
            contacts.addAll(batch);
        } while (batch.size() == BATCH_SIZE);
        return contacts;
    }

    static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String digits = phone.replaceAll("\\D", "");
        return digits.isEmpty() ? null : digits;
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
