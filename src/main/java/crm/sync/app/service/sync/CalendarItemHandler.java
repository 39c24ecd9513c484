package crm.sync.app.service.sync;

import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.SyncDomain;
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

/**
 * Stores calendar events as MEETING interactions. Accepted and tentative attendees of past
 * meetings other than the organizer and the user become contacts. Upcoming meetings are linked
 * to existing contacts only. Declined and unanswered invitations are linked to the meeting but
 * never create or touch a contact.
 */
@Slf4j
@Component
public class CalendarItemHandler extends AbstractItemHandler {
    private final AttendeeMatcherService attendeeMatcherService;

    public CalendarItemHandler(InteractionRepository interactionRepository,
                               ContactRepository contactRepository,
                               AttendeeMatcherService attendeeMatcherService) {
        super(interactionRepository, contactRepository);
        this.attendeeMatcherService = attendeeMatcherService;
    }

    @Override
    public SyncDomain getDomain() {
        return SyncDomain.CALENDAR;
    }

    @Override
    @Transactional
    public ItemOutcome handle(SyncContext context, ExternalItem item) {
        if (item.getExternalId() == null || item.getStartsAt() == null) {
            log.warn("Skipping calendar item without id or start time for user {}", context.getUserId());
            return ItemOutcome.SKIPPED;
        }

        List<Participant> material = new ArrayList<>();
        for (Participant participant : item.getParticipants()) {
            if (participant.isMaterialAttendee() && !context.isSelf(participant.getEmail())) {
                material.add(participant);
            }
        }
        // Upcoming meetings only link people who are already contacts
        List<ContactMatch> matches = item.isPast(context.getNow())
                ? attendeeMatcherService.match(context.getUserId(), material)
                : attendeeMatcherService.matchExisting(context.getUserId(), material);

        Interaction interaction = loadOrCreate(context, item);
        boolean created = interaction.getId() == null;

        interaction.setType(InteractionType.MEETING);
        interaction.setSourceId(item.getSourceId());
        interaction.setSubject(truncate(item.getSubject(), MAX_SHORT_TEXT_LENGTH));
        interaction.setBody(truncate(item.getBody(), MAX_TEXT_LENGTH));
        interaction.setLocation(truncate(item.getLocation(), MAX_SHORT_TEXT_LENGTH));
        interaction.setMeetingUrl(truncate(item.getMeetingUrl(), MAX_SHORT_TEXT_LENGTH));
        interaction.setOccurredAt(item.getStartsAt());
        interaction.setEndsAt(item.getEndsAt());
        interaction.setAllDay(item.isAllDay());
        interaction.setUpdatedAt(context.getNow());
        interaction.replaceParticipants(participantLinks(item.getParticipants(), matches));
        interactionRepository.save(interaction);

        advanceLastContact(context, item.getStartsAt(), matches);
        return created ? ItemOutcome.ADDED : ItemOutcome.UPDATED;
    }
}
