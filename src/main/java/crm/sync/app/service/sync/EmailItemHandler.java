package crm.sync.app.service.sync;

import crm.sync.app.entity.EmailDirection;
import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.ParticipantRole;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncState;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.service.matching.AttendeeMatcherService;
import crm.sync.app.service.matching.ContactMatch;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.Participant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stores mail messages as EMAIL interactions, but only for messages exchanged with people who
 * are already contacts. Mail never creates contacts.
 */
@Slf4j
@Component
public class EmailItemHandler extends AbstractItemHandler {
    private final AttendeeMatcherService attendeeMatcherService;

    public EmailItemHandler(InteractionRepository interactionRepository,
                            ContactRepository contactRepository,
                            AttendeeMatcherService attendeeMatcherService) {
        super(interactionRepository, contactRepository);
        this.attendeeMatcherService = attendeeMatcherService;
    }

    @Override
    public SyncDomain getDomain() {
        return SyncDomain.EMAIL;
    }

    @Override
    @Transactional
    public ItemOutcome handle(SyncContext context, ExternalItem item) {
        if (item.getExternalId() == null || item.getStartsAt() == null) {
            return ItemOutcome.SKIPPED;
        }

        SyncState state = context.getState();
        boolean outbound = false;
        List<Participant> counterparts = new ArrayList<>();
        for (Participant participant : item.getParticipants()) {
            String email = participant.normalizedEmail();
            if (email == null) {
                continue;
            }
            if (context.isSelf(email)) {
                if (participant.getRole() == ParticipantRole.FROM) {
                    outbound = true;
                }
                continue;
            }
            if (!isExcluded(state, email)) {
                counterparts.add(participant);
            }
        }
        if (counterparts.isEmpty()) {
            return ItemOutcome.SKIPPED;
        }

        List<ContactMatch> matches = attendeeMatcherService.matchExisting(context.getUserId(), counterparts);
        if (matches.isEmpty()) {
            return ItemOutcome.SKIPPED;
        }

        Interaction interaction = loadOrCreate(context, item);
        boolean created = interaction.getId() == null;

        interaction.setType(InteractionType.EMAIL);
        interaction.setSourceId(item.getSourceId());
        interaction.setSubject(truncate(item.getSubject(), MAX_SHORT_TEXT_LENGTH));
        interaction.setSnippet(truncate(item.getSnippet(), MAX_SHORT_TEXT_LENGTH));
        interaction.setBody(state != null && state.isPrivacyMode() ? null : truncate(item.getBody(), MAX_TEXT_LENGTH));
        interaction.setThreadId(item.getThreadId());
        interaction.setDirection(outbound ? EmailDirection.OUTBOUND : EmailDirection.INBOUND);
        interaction.setOccurredAt(item.getStartsAt());
        interaction.setUpdatedAt(context.getNow());
        interaction.replaceParticipants(participantLinks(counterparts, matches));
        interactionRepository.save(interaction);

        advanceLastContact(context, item.getStartsAt(), matches);
        return created ? ItemOutcome.ADDED : ItemOutcome.UPDATED;
    }

    static boolean isExcluded(SyncState state, String email) {
        if (state == null) {
            return false;
        }
        if (state.getExcludedEmails().contains(email)) {
            return true;
        }
        int at = email.lastIndexOf('@');
        String domain = at >= 0 ? email.substring(at + 1).toLowerCase(Locale.ROOT) : "";
        for (String excluded : state.getExcludedDomains()) {
            // Subdomains of an excluded domain are excluded too
            if (domain.equals(excluded) || domain.endsWith("." + excluded)) {
                return true;
            }
        }
        return false;
    }
}
