package crm.sync.app.service.sync;

import crm.sync.app.entity.Contact;
import crm.sync.app.entity.EmailDirection;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.ParticipantRole;
import crm.sync.app.entity.SyncState;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.repository.InteractionRepository;
import crm.sync.app.service.matching.AttendeeMatcherService;
import crm.sync.app.service.matching.ContactMatch;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.Participant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailItemHandlerTest {

    private static final String USER_ID = "user123";

    @Mock
    private InteractionRepository interactionRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private AttendeeMatcherService attendeeMatcherService;

    @InjectMocks
    private EmailItemHandler emailItemHandler;

    private SyncState state;
    private SyncContext context;
    private Instant now;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2024-05-01T12:00:00Z");
        state = new SyncState();
        state.setIntegrationType(IntegrationType.GMAIL);
        context = new SyncContext(USER_ID, IntegrationType.GMAIL, Set.of("me@example.com"), state, now);
    }

    private static Participant person(String email, ParticipantRole role) {
        return Participant.builder().email(email).role(role).build();
    }

    private ExternalItem message(Participant... participants) {
        return ExternalItem.builder()
                .externalId("m1")
                .threadId("t1")
                .subject("Proposal")
                .snippet("Here is the proposal")
                .body("Full proposal text")
                .startsAt(now.minus(Duration.ofHours(3)))
                .participants(List.of(participants))
                .build();
    }

    private static ContactMatch match(String email, String contactId) {
        Contact contact = new Contact();
        contact.setId(contactId);
        contact.setEmail(email);
        return new ContactMatch(Participant.builder().email(email).build(), contact, false);
    }

    @Test
    void handle_OutboundMailToContact_ShouldStoreWithoutBodyInPrivacyMode() {
        // Given
        ExternalItem item = message(person("me@example.com", ParticipantRole.FROM), person("jane@co.com", ParticipantRole.TO));
        when(attendeeMatcherService.matchExisting(eq(USER_ID), anyList())).thenReturn(List.of(match("jane@co.com", "c-jane")));
        when(interactionRepository.findByUserIdAndExternalIdAndExternalSource(USER_ID, "m1", "gmail"))
                .thenReturn(Optional.empty());

        // When
        ItemOutcome outcome = emailItemHandler.handle(context, item);

        // Then
        assertEquals(ItemOutcome.ADDED, outcome);
        ArgumentCaptor<Interaction> saved = ArgumentCaptor.forClass(Interaction.class);
        verify(interactionRepository).save(saved.capture());
        assertEquals(EmailDirection.OUTBOUND, saved.getValue().getDirection());
        assertNull(saved.getValue().getBody());
        assertEquals("Here is the proposal", saved.getValue().getSnippet());
        assertEquals(1, saved.getValue().getParticipants().size());
        verify(contactRepository).advanceLastContact(anyCollection(), eq(item.getStartsAt()), eq(now));
    }

    @Test
    void handle_InboundMailWithPrivacyModeOff_ShouldKeepBody() {
        // Given
        state.setPrivacyMode(false);
        ExternalItem item = message(person("jane@co.com", ParticipantRole.FROM), person("me@example.com", ParticipantRole.TO));
        when(attendeeMatcherService.matchExisting(eq(USER_ID), anyList())).thenReturn(List.of(match("jane@co.com", "c-jane")));
        when(interactionRepository.findByUserIdAndExternalIdAndExternalSource(USER_ID, "m1", "gmail"))
                .thenReturn(Optional.empty());

        // When
        emailItemHandler.handle(context, item);

        // Then
        ArgumentCaptor<Interaction> saved = ArgumentCaptor.forClass(Interaction.class);
        verify(interactionRepository).save(saved.capture());
        assertEquals(EmailDirection.INBOUND, saved.getValue().getDirection());
        assertEquals("Full proposal text", saved.getValue().getBody());
    }

    @Test
    void handle_MailFromUnknownSender_ShouldSkipWithoutCreatingContacts() {
        // Given
        ExternalItem item = message(person("stranger@spam.com", ParticipantRole.FROM), person("me@example.com", ParticipantRole.TO));
        when(attendeeMatcherService.matchExisting(eq(USER_ID), anyList())).thenReturn(List.of());

        // When
        ItemOutcome outcome = emailItemHandler.handle(context, item);

        // Then
        assertEquals(ItemOutcome.SKIPPED, outcome);
        verify(interactionRepository, never()).save(any());
        verify(attendeeMatcherService, never()).match(anyString(), anyList());
    }

    @Test
    void handle_MailFromExcludedDomain_ShouldSkipWithoutLookup() {
        // Given
        state.getExcludedDomains().add("co.com");
        ExternalItem item = message(person("jane@mail.co.com", ParticipantRole.FROM), person("me@example.com", ParticipantRole.TO));

        // When
        ItemOutcome outcome = emailItemHandler.handle(context, item);

        // Then
        assertEquals(ItemOutcome.SKIPPED, outcome);
        verifyNoInteractions(attendeeMatcherService);
    }

    @Test
    void isExcluded_ShouldMatchAddressesAndDomains() {
        // Given
        state.getExcludedEmails().add("noreply@shop.com");
        state.getExcludedDomains().add("newsletter.io");

        // Then
        assertTrue(EmailItemHandler.isExcluded(state, "noreply@shop.com"));
        assertFalse(EmailItemHandler.isExcluded(state, "sales@shop.com"));
        assertTrue(EmailItemHandler.isExcluded(state, "x@newsletter.io"));
        assertTrue(EmailItemHandler.isExcluded(state, "x@eu.newsletter.io"));
        assertFalse(EmailItemHandler.isExcluded(state, "x@notnewsletter.io"));
    }
}
