package crm.sync.app.service;

import crm.sync.app.dto.MeetingView;
import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncJob;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.exception.InteractionNotFoundException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.service.job.SyncJobScheduler;
import crm.sync.app.service.provider.CalendarInfo;
import crm.sync.app.service.provider.ProviderRegistry;
import crm.sync.app.service.sync.ProviderCallTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Calendar-facing operations on top of the sync engine. Event lists are read from stored
 * meetings, not from the provider.
 */
@Slf4j
@Service
public class CalendarSyncService {
    static final int MAX_NOTES_LENGTH = 10000;
    static final int MAX_RANGE_DAYS = 365;

    private final InteractionRepository interactionRepository;
    private final IntegrationRepository integrationRepository;
    private final ProviderRegistry providerRegistry;
    private final ProviderCallTemplate providerCallTemplate;
    private final SyncJobScheduler syncJobScheduler;

    public CalendarSyncService(InteractionRepository interactionRepository,
                               IntegrationRepository integrationRepository,
                               ProviderRegistry providerRegistry,
                               ProviderCallTemplate providerCallTemplate,
                               SyncJobScheduler syncJobScheduler) {
        this.interactionRepository = interactionRepository;
        this.integrationRepository = integrationRepository;
        this.providerRegistry = providerRegistry;
        this.providerCallTemplate = providerCallTemplate;
        this.syncJobScheduler = syncJobScheduler;
    }

    @Transactional(readOnly = true)
    public List<MeetingView> fetchEvents(String userId, EventRange range, int days) {
        if (days < 1 || days > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_RANGE_DAYS);
        }
        Instant now = Instant.now();
        List<Interaction> meetings;
        if (range == EventRange.UPCOMING) {
            meetings = interactionRepository.findByUserIdAndTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
                    userId, InteractionType.MEETING, now, now.plus(Duration.ofDays(days)));
        } else {
            meetings = interactionRepository.findByUserIdAndTypeAndOccurredAtBetweenOrderByOccurredAtDesc(
                    userId, InteractionType.MEETING, now.minus(Duration.ofDays(days)), now);
        }
        return meetings.stream().map(MeetingView::from).collect(Collectors.toList());
    }

    @Transactional
    public MeetingView addMeetingNotes(String userId, String interactionId, String notes, boolean append) {
        Interaction interaction = interactionRepository.findByIdAndUserId(interactionId, userId)
                .orElseThrow(() -> new InteractionNotFoundException("Meeting not found: " + interactionId));
        if (interaction.getType() != InteractionType.MEETING) {
            throw new IllegalArgumentException("Notes can only be added to meetings");
        }

        String updated;
        if (append && interaction.getNotes() != null && !interaction.getNotes().isEmpty()) {
            updated = notes == null || notes.isEmpty() ? interaction.getNotes() : interaction.getNotes() + "\n\n" + notes;
        } else {
            updated = notes;
        }
        if (updated != null && updated.length() > MAX_NOTES_LENGTH) {
            throw new IllegalArgumentException("Notes cannot exceed " + MAX_NOTES_LENGTH + " characters");
        }
        interaction.setNotes(updated);
        interaction.setUpdatedAt(Instant.now());
        return MeetingView.from(interactionRepository.save(interaction));
    }

    public List<CalendarInfo> listCalendars(String userId, IntegrationType type) {
        Integration integration = activeCalendar(userId, type);
        return providerCallTemplate.executeOrThrow(integration,
                token -> providerRegistry.getCalendar(type).listCalendars(token));
    }

    public SyncJob triggerSync(String userId, IntegrationType type, boolean full) {
        activeCalendar(userId, type);
        return syncJobScheduler.queueImmediate(userId, type, full ? SyncMode.FULL : SyncMode.INCREMENTAL);
    }

    private Integration activeCalendar(String userId, IntegrationType type) {
        if (type.getDomain() != SyncDomain.CALENDAR) {
            throw new IllegalArgumentException(type.getSlug() + " is not a calendar integration");
        }
        return integrationRepository.findActiveByUserIdAndType(userId, type)
                .orElseThrow(() -> new IntegrationNotFoundException("No active " + type.getSlug() + " integration"));
    }
}
