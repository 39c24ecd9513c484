package crm.sync.app.service;

import crm.sync.app.dto.MeetingView;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.exception.InteractionNotFoundException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.service.job.SyncJobScheduler;
import crm.sync.app.service.provider.ProviderRegistry;
import crm.sync.app.service.sync.ProviderCallTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CalendarSyncServiceTest {

    private static final String USER_ID = "user123";

    @Mock
    private InteractionRepository interactionRepository;

    @Mock
    private IntegrationRepository integrationRepository;

    @Mock
    private ProviderRegistry providerRegistry;

    @Mock
    private ProviderCallTemplate providerCallTemplate;

    @Mock
    private SyncJobScheduler syncJobScheduler;

    @InjectMocks
    private CalendarSyncService calendarSyncService;

    private static Interaction meeting(String notes) {
        Interaction interaction = new Interaction();
        interaction.setId("m-1");
        interaction.setUserId(USER_ID);
        interaction.setType(InteractionType.MEETING);
        interaction.setSubject("Quarterly review");
        interaction.setOccurredAt(Instant.parse("2024-03-01T10:00:00Z"));
        interaction.setNotes(notes);
        return interaction;
    }

    @Test
    void addMeetingNotes_WithAppend_ShouldKeepExistingNotes() {
        // Given
        Interaction interaction = meeting("Agenda agreed");
        when(interactionRepository.findByIdAndUserId("m-1", USER_ID)).thenReturn(Optional.of(interaction));
        when(interactionRepository.save(interaction)).thenReturn(interaction);

        // When
        MeetingView view = calendarSyncService.addMeetingNotes(USER_ID, "m-1", "Follow up on pricing", true);

        // Then
        assertEquals("Agenda agreed\n\nFollow up on pricing", view.getNotes());
        assertNotNull(interaction.getUpdatedAt());
    }

    @Test
    void addMeetingNotes_WithoutAppend_ShouldReplaceNotes() {
        // Given
        Interaction interaction = meeting("Old");
        when(interactionRepository.findByIdAndUserId("m-1", USER_ID)).thenReturn(Optional.of(interaction));
        when(interactionRepository.save(interaction)).thenReturn(interaction);

        // When
        MeetingView view = calendarSyncService.addMeetingNotes(USER_ID, "m-1", "New", false);

        // Then
        assertEquals("New", view.getNotes());
    }

    @Test
    void addMeetingNotes_WithTooLongNotes_ShouldThrow() {
        // Given
        when(interactionRepository.findByIdAndUserId("m-1", USER_ID)).thenReturn(Optional.of(meeting(null)));

        // When & Then
        assertThrows(IllegalArgumentException.class,
                () -> calendarSyncService.addMeetingNotes(USER_ID, "m-1", "x".repeat(10001), false));
        verify(interactionRepository, never()).save(any());
    }

    @Test
    void addMeetingNotes_OnOtherUsersMeeting_ShouldThrowNotFound() {
        // Given
        when(interactionRepository.findByIdAndUserId("m-1", "intruder")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(InteractionNotFoundException.class,
                () -> calendarSyncService.addMeetingNotes("intruder", "m-1", "notes", false));
    }

    @Test
    void fetchEvents_Upcoming_ShouldReadStoredMeetingsAhead() {
        // Given
        when(interactionRepository.findByUserIdAndTypeAndOccurredAtBetweenOrderByOccurredAtAsc(
                eq(USER_ID), eq(InteractionType.MEETING), any(Instant.class), any(Instant.class)))
                .thenReturn(List.of(meeting(null)));

        // When
        List<MeetingView> events = calendarSyncService.fetchEvents(USER_ID, EventRange.UPCOMING, 7);

        // Then
        assertEquals(1, events.size());
        assertEquals("Quarterly review", events.get(0).getTitle());
        verifyNoInteractions(providerCallTemplate);
    }

    @Test
    void fetchEvents_WithOutOfRangeDays_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> calendarSyncService.fetchEvents(USER_ID, EventRange.PAST, 0));
        assertThrows(IllegalArgumentException.class, () -> calendarSyncService.fetchEvents(USER_ID, EventRange.PAST, 366));
    }

    @Test
    void triggerSync_WithoutConnectedCalendar_ShouldThrow() {
        // Given
        when(integrationRepository.findActiveByUserIdAndType(USER_ID, IntegrationType.OUTLOOK_CALENDAR)).thenReturn(Optional.empty());

        // When & Then
        assertThrows(IntegrationNotFoundException.class,
                () -> calendarSyncService.triggerSync(USER_ID, IntegrationType.OUTLOOK_CALENDAR, true));
        verifyNoInteractions(syncJobScheduler);
    }

    @Test
    void triggerSync_WithMailType_ShouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> calendarSyncService.triggerSync(USER_ID, IntegrationType.GMAIL, false));
    }
}
