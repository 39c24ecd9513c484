package crm.sync.app.service.matching;

import crm.sync.app.entity.Contact;
import crm.sync.app.entity.ContactSource;
import crm.sync.app.entity.ContactSourceLink;
import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.repository.ContactRepository;
import crm.sync.app.repository.ContactSourceLinkRepository;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.SyncStateRepository;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.FetchWindow;
import crm.sync.app.service.provider.ProviderClient;
import crm.sync.app.service.provider.ProviderPage;
import crm.sync.app.service.provider.ProviderRegistry;
import crm.sync.app.service.sync.ProviderCallTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds contacts from the people a user has met: previews aggregated attendees of past
 * calendar events and imports the selected ones.
 */
@Slf4j
@Service
public class CalendarContactImporterService {
    static final String LINK_PREFIX = "calendar-attendee-";
    static final int MAX_DAYS = 365;

    private final IntegrationRepository integrationRepository;
    private final SyncStateRepository syncStateRepository;
    private final ContactRepository contactRepository;
    private final ContactSourceLinkRepository sourceLinkRepository;
    private final ProviderRegistry providerRegistry;
    private final ProviderCallTemplate providerCallTemplate;
    private final AttendeeMatcherService attendeeMatcherService;

    public CalendarContactImporterService(IntegrationRepository integrationRepository,
                                          SyncStateRepository syncStateRepository,
                                          ContactRepository contactRepository,
                                          ContactSourceLinkRepository sourceLinkRepository,
                                          ProviderRegistry providerRegistry,
                                          ProviderCallTemplate providerCallTemplate,
                                          AttendeeMatcherService attendeeMatcherService) {
        this.integrationRepository = integrationRepository;
        this.syncStateRepository = syncStateRepository;
        this.contactRepository = contactRepository;
        this.sourceLinkRepository = sourceLinkRepository;
        this.providerRegistry = providerRegistry;
        this.providerCallTemplate = providerCallTemplate;
        this.attendeeMatcherService = attendeeMatcherService;
    }

    /**
     * Attendees of the user's past events in the last {@code days}, most met first.
     * Attendees that already exist as contacts carry their contact id.
     */
    public List<AttendeeAggregate> previewImport(String userId, IntegrationType type, int days) {
        if (type.getDomain() != SyncDomain.CALENDAR) {
            throw new IllegalArgumentException(type + " is not a calendar integration");
        }
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS);
        }
        Integration integration = integrationRepository.findActiveByUserIdAndType(userId, type)
                .orElseThrow(() -> new IntegrationNotFoundException("No active " + type.getSlug() + " integration"));

        Instant now = Instant.now();
        List<ExternalItem> pastEvents = fetchPastEvents(integration, FetchWindow.pastDays(now, days), now);
        List<AttendeeAggregate> attendees = attendeeMatcherService.aggregateAttendees(pastEvents, selfEmails(integration));

        Map<String, Contact> existing = attendeeMatcherService.findByEmails(userId,
                attendees.stream().map(AttendeeAggregate::getEmail).collect(Collectors.toList()));
        for (AttendeeAggregate attendee : attendees) {
            Contact contact = existing.get(attendee.getEmail());
            if (contact != null) {
                attendee.setExistingContactId(contact.getId());
            }
        }

        attendees.sort(Comparator.comparingInt(AttendeeAggregate::getMeetingCount).reversed()
                .thenComparing(AttendeeAggregate::getLastMeetingDate, Comparator.nullsLast(Comparator.reverseOrder())));
        log.info("Import preview for user {}: {} past events, {} attendees", userId, pastEvents.size(), attendees.size());
        return attendees;
    }

    public ImportResult importContacts(String userId, IntegrationType type, ImportOptions options) {
        List<AttendeeAggregate> attendees = previewImport(userId, type, options.getDays());

        if (options.getSelectedEmails() != null && !options.getSelectedEmails().isEmpty()) {
            Set<String> selected = options.getSelectedEmails().stream()
                    .map(e -> e.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            attendees.removeIf(a -> !selected.contains(a.getEmail()));
        }

        ImportResult result = new ImportResult();
        for (AttendeeAggregate attendee : attendees) {
            try {
                if (attendee.isExistingContact()) {
                    if (options.isUpdateExisting()) {
                        updateExisting(userId, type, attendee);
                        result.setUpdated(result.getUpdated() + 1);
                        result.getContactIds().add(attendee.getExistingContactId());
                    } else {
                        result.setSkipped(result.getSkipped() + 1);
                    }
                    continue;
                }
                Contact created = createContact(userId, type, attendee);
                result.setImported(result.getImported() + 1);
                result.getContactIds().add(created.getId());
            } catch (Exception e) {
                log.error("Failed to import attendee for user {}: {}", userId, e.getMessage(), e);
                result.setFailed(result.getFailed() + 1);
                result.getErrors().add("Failed to import " + attendee.getEmail());
                // Continue with next attendee
            }
        }
        log.info("Calendar import for user {}: {} imported, {} updated, {} skipped, {} failed",
                userId, result.getImported(), result.getUpdated(), result.getSkipped(), result.getFailed());
        return result;
    }

    private Contact createContact(String userId, IntegrationType type, AttendeeAggregate attendee) {
        ParsedName name = NameParser.parse(attendee.getDisplayName(), attendee.getEmail());
        Contact contact = new Contact();
        contact.setUserId(userId);
        contact.setEmail(attendee.getEmail());
        contact.setFirstName(name.getFirstName());
        contact.setLastName(name.getLastName());
        contact.setCompany(CompanyInference.infer(attendee.getEmail()));
        contact.setSource(ContactSource.CALENDAR_IMPORT);
        contact.setLastContact(attendee.getLastMeetingDate());
        Contact saved = contactRepository.save(contact);
        link(userId, type, saved.getId(), attendee.getEmail());
        return saved;
    }

    private void updateExisting(String userId, IntegrationType type, AttendeeAggregate attendee) {
        Contact contact = contactRepository.findByIdAndUserId(attendee.getExistingContactId(), userId)
                .orElseThrow(() -> new IllegalStateException("Contact disappeared during import"));
        if (contact.getCompany() == null) {
            contact.setCompany(CompanyInference.infer(attendee.getEmail()));
        }
        if (attendee.getLastMeetingDate() != null
                && (contact.getLastContact() == null || attendee.getLastMeetingDate().isAfter(contact.getLastContact()))) {
            contact.setLastContact(attendee.getLastMeetingDate());
        }
        contactRepository.save(contact);
        link(userId, type, contact.getId(), attendee.getEmail());
    }

    private void link(String userId, IntegrationType type, String contactId, String email) {
        String externalId = LINK_PREFIX + email;
        if (sourceLinkRepository.existsByContactIdAndExternalId(contactId, externalId)) {
            return;
        }
        ContactSourceLink link = new ContactSourceLink();
        link.setContactId(contactId);
        link.setUserId(userId);
        link.setIntegrationType(type);
        link.setExternalId(externalId);
        link.setCreatedAt(Instant.now());
        sourceLinkRepository.save(link);
    }

    private List<ExternalItem> fetchPastEvents(Integration integration, FetchWindow window, Instant now) {
        ProviderClient client = providerRegistry.get(integration.getType());
        List<String> sources = syncStateRepository.findByUserIdAndIntegrationType(integration.getUserId(), integration.getType())
                .map(state -> state.sourcesOrDefault(client.defaultSourceId()))
                .orElse(List.of(client.defaultSourceId()));

        List<ExternalItem> events = new ArrayList<>();
        for (String sourceId : sources) {
            String pageToken = null;
            ProviderPage page;
            do {
                String currentPage = pageToken;
                page = providerCallTemplate.executeOrThrow(integration,
                        token -> client.fetchFull(token, sourceId, window, currentPage));
                for (ExternalItem item : page.getItems()) {
                    if (item.isPast(now)) {
                        events.add(item);
                    }
                }
                pageToken = page.getNextPageToken();
            } while (page.hasMore());
        }
        return events;
    }

    private static Set<String> selfEmails(Integration integration) {
        Set<String> self = new HashSet<>();
        if (integration.getAccountEmail() != null) {
            self.add(integration.getAccountEmail().toLowerCase(Locale.ROOT));
        }
        if (integration.getUser() != null && integration.getUser().getEmail() != null) {
            self.add(integration.getUser().getEmail().toLowerCase(Locale.ROOT));
        }
        return self;
    }
}
