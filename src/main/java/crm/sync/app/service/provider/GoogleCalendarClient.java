package crm.sync.app.service.provider;

import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.CalendarList;
import com.google.api.services.calendar.model.CalendarListEntry;
import com.google.api.services.calendar.model.EntryPoint;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.ParticipantRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Google Calendar v3 events. Recurring events are expanded into single instances.
 */
@Slf4j
@Service
public class GoogleCalendarClient implements CalendarProviderClient {
    static final String PRIMARY = "primary";
    static final int PAGE_SIZE = 250;

    private static final Set<String> READABLE_ROLES = Set.of("owner", "writer", "reader");

    private final GoogleServiceFactory googleServiceFactory;

    public GoogleCalendarClient(GoogleServiceFactory googleServiceFactory) {
        this.googleServiceFactory = googleServiceFactory;
    }

    @Override
    public IntegrationType getType() {
        return IntegrationType.GOOGLE_CALENDAR;
    }

    @Override
    public String defaultSourceId() {
        return PRIMARY;
    }

    @Override
    public ProviderResult<ProviderPage> fetchFull(String accessToken, String sourceId, FetchWindow window, String pageToken) {
        try {
            Calendar.Events.List request = googleServiceFactory.calendar(accessToken).events().list(sourceId)
                    .setSingleEvents(true)
                    .setOrderBy("startTime")
                    .setMaxResults(PAGE_SIZE)
                    .setTimeMin(new DateTime(window.getTimeMin().toEpochMilli()))
                    .setTimeMax(new DateTime(window.getTimeMax().toEpochMilli()));
            if (pageToken != null) {
                request.setPageToken(pageToken);
            }
            return ProviderResult.success(toPage(request.execute(), sourceId));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Google Calendar list");
        }
    }

    @Override
    public ProviderResult<ProviderPage> fetchIncremental(String accessToken, String sourceId, String cursor, String pageToken) {
        try {
            // syncToken cannot be combined with timeMin/timeMax/orderBy
            Calendar.Events.List request = googleServiceFactory.calendar(accessToken).events().list(sourceId)
                    .setSingleEvents(true)
                    .setMaxResults(PAGE_SIZE)
                    .setSyncToken(cursor);
            if (pageToken != null) {
                request.setPageToken(pageToken);
            }
            return ProviderResult.success(toPage(request.execute(), sourceId));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Google Calendar incremental list");
        }
    }

    @Override
    public ProviderResult<ExternalItem> fetchById(String accessToken, String sourceId, String itemId) {
        try {
            Event event = googleServiceFactory.calendar(accessToken).events().get(sourceId, itemId).execute();
            if ("cancelled".equals(event.getStatus())) {
                return ProviderResult.failure(ProviderOutcome.TERMINAL, 404, "Event was cancelled");
            }
            return ProviderResult.success(toItem(event, sourceId));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Google Calendar get");
        }
    }

    @Override
    public ProviderResult<List<CalendarInfo>> listCalendars(String accessToken) {
        try {
            List<CalendarInfo> calendars = new ArrayList<>();
            String pageToken = null;
            do {
                Calendar.CalendarList.List request = googleServiceFactory.calendar(accessToken).calendarList().list();
                if (pageToken != null) {
                    request.setPageToken(pageToken);
                }
                CalendarList response = request.execute();
                if (response.getItems() != null) {
                    for (CalendarListEntry entry : response.getItems()) {
                        if (entry.getAccessRole() != null && READABLE_ROLES.contains(entry.getAccessRole())) {
                            calendars.add(new CalendarInfo(entry.getId(), entry.getSummary(),
                                    Boolean.TRUE.equals(entry.getPrimary()), entry.getAccessRole(), entry.getTimeZone()));
                        }
                    }
                }
                pageToken = response.getNextPageToken();
            } while (pageToken != null);

            calendars.sort(Comparator.comparing((CalendarInfo c) -> !c.isPrimary())
                    .thenComparing(c -> c.getName() == null ? "" : c.getName(), String.CASE_INSENSITIVE_ORDER));
            return ProviderResult.success(calendars);
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Google calendar list");
        }
    }

    private ProviderPage toPage(Events events, String sourceId) {
        List<ExternalItem> items = new ArrayList<>();
        if (events.getItems() != null) {
            for (Event event : events.getItems()) {
                if ("cancelled".equals(event.getStatus())) {
                    continue;
                }
                ExternalItem item = toItem(event, sourceId);
                if (item.getStartsAt() == null) {
                    log.debug("Skipping event {} without a start time", event.getId());
                    continue;
                }
                items.add(item);
            }
        }
        String nextPageToken = events.getNextPageToken();
        return new ProviderPage(items, nextPageToken, nextPageToken == null ? events.getNextSyncToken() : null);
    }

    ExternalItem toItem(Event event, String sourceId) {
        String organizerEmail = event.getOrganizer() != null ? event.getOrganizer().getEmail() : null;
        List<Participant> participants = new ArrayList<>();
        if (event.getAttendees() != null) {
            for (EventAttendee attendee : event.getAttendees()) {
                boolean organizer = Boolean.TRUE.equals(attendee.getOrganizer())
                        || (organizerEmail != null && organizerEmail.equalsIgnoreCase(attendee.getEmail()));
                participants.add(Participant.builder()
                        .email(attendee.getEmail())
                        .displayName(attendee.getDisplayName())
                        .organizer(organizer)
                        .responseStatus(attendee.getResponseStatus() != null ? attendee.getResponseStatus() : Participant.NEEDS_ACTION)
                        .role(organizer ? ParticipantRole.ORGANIZER : ParticipantRole.ATTENDEE)
                        .build());
            }
        }

        return ExternalItem.builder()
                .externalId(event.getId())
                .sourceId(sourceId)
                .type(InteractionType.MEETING)
                .subject(event.getSummary() != null ? event.getSummary() : "(No title)")
                .body(event.getDescription())
                .startsAt(toInstant(event.getStart()))
                .endsAt(toInstant(event.getEnd()))
                .allDay(event.getStart() != null && event.getStart().getDate() != null)
                .location(event.getLocation())
                .meetingUrl(meetingUrl(event))
                .organizerEmail(organizerEmail)
                .participants(participants)
                .build();
    }

    private static String meetingUrl(Event event) {
        if (event.getHangoutLink() != null) {
            return event.getHangoutLink();
        }
        if (event.getConferenceData() != null && event.getConferenceData().getEntryPoints() != null) {
            for (EntryPoint entryPoint : event.getConferenceData().getEntryPoints()) {
                if ("video".equals(entryPoint.getEntryPointType())) {
                    return entryPoint.getUri();
                }
            }
        }
        return null;
    }

    private static Instant toInstant(EventDateTime eventDateTime) {
        if (eventDateTime == null) {
            return null;
        }
        // All-day events only carry a date
        DateTime value = eventDateTime.getDateTime() != null ? eventDateTime.getDateTime() : eventDateTime.getDate();
        return value != null ? Instant.ofEpochMilli(value.getValue()) : null;
    }
}
