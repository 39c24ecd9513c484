package crm.sync.app.service.sync;

import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionParticipant;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.service.matching.ContactMatch;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.Participant;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upsert by (user, externalId, externalSource) and last-contact bookkeeping shared by the
 * calendar and email handlers.
 */
abstract class AbstractItemHandler implements SyncItemHandler {
    static final int MAX_TEXT_LENGTH = 10000;
    static final int MAX_SHORT_TEXT_LENGTH = 1000;

    protected final InteractionRepository interactionRepository;
    protected final ContactRepository contactRepository;

    protected AbstractItemHandler(InteractionRepository interactionRepository, ContactRepository contactRepository) {
        this.interactionRepository = interactionRepository;
        this.contactRepository = contactRepository;
    }

    /**
     * Loads the stored interaction for the item, or a new unsaved one carrying the natural key.
     */
    protected Interaction loadOrCreate(SyncContext context, ExternalItem item) {
        String externalSource = context.getType().getExternalSource();
        return interactionRepository
                .findByUserIdAndExternalIdAndExternalSource(context.getUserId(), item.getExternalId(), externalSource)
                .orElseGet(() -> {
                    Interaction created = new Interaction();
                    created.setUserId(context.getUserId());
                    created.setExternalId(item.getExternalId());
                    created.setExternalSource(externalSource);
                    created.setCreatedAt(context.getNow());
                    return created;
                });
    }

    protected List<InteractionParticipant> participantLinks(List<Participant> participants, List<ContactMatch> matches) {
        Map<String, String> contactIdByEmail = new HashMap<>();
        for (ContactMatch match : matches) {
            contactIdByEmail.put(match.getParticipant().normalizedEmail(), match.getContact().getId());
        }

        List<InteractionParticipant> links = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Participant participant : participants) {
            String email = participant.normalizedEmail();
            if (email == null || !seen.add(email + "|" + participant.getRole())) {
                continue;
            }
            InteractionParticipant link = new InteractionParticipant();
            link.setEmail(email);
            link.setDisplayName(truncate(participant.getDisplayName(), 255));
            link.setRole(participant.getRole());
            link.setResponseStatus(participant.getResponseStatus());
            link.setContactId(contactIdByEmail.get(email));
            links.add(link);
        }
        return links;
    }

    /**
     * Moves lastContact forward for past items only. Future items never touch it.
     */
    protected void advanceLastContact(SyncContext context, Instant occurredAt, Collection<ContactMatch> matches) {
        if (occurredAt == null || !occurredAt.isBefore(context.getNow()) || matches.isEmpty()) {
            return;
        }
        Set<String> contactIds = new LinkedHashSet<>();
        for (ContactMatch match : matches) {
            contactIds.add(match.getContact().getId());
        }
        contactRepository.advanceLastContact(contactIds, occurredAt, context.getNow());
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
