package crm.sync.app.service.provider;

import com.google.api.client.json.gson.GsonFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoogleCalendarClientTest {

    private static final String EVENTS = "/calendars/primary/events";

    private GoogleCalendarClient clientFor(RoutingHttpTransport transport) {
        return new GoogleCalendarClient(new GoogleServiceFactory(transport, GsonFactory.getDefaultInstance()));
    }

    private static FetchWindow window() {
        return FetchWindow.around(Instant.parse("2024-03-01T00:00:00Z"), 30, 90);
    }

    @Test
    void fetchFull_ShouldMapEventsSkipCancelledAndReturnSyncToken() {
        // Given
        String body = "{\"items\":["
                + "{\"id\":\"ev1\",\"status\":\"confirmed\",\"summary\":\"Design review\","
                + "\"start\":{\"dateTime\":\"2024-02-20T15:00:00Z\"},\"end\":{\"dateTime\":\"2024-02-20T16:00:00Z\"},"
                + "\"hangoutLink\":\"https://meet.google.com/abc\","
                + "\"organizer\":{\"email\":\"me@example.com\"},"
                + "\"attendees\":["
                + "{\"email\":\"me@example.com\",\"organizer\":true,\"responseStatus\":\"accepted\"},"
                + "{\"email\":\"jane@co.com\",\"displayName\":\"Jane Doe\",\"responseStatus\":\"accepted\"},"
                + "{\"email\":\"bob@co.com\",\"responseStatus\":\"declined\"}]},"
                + "{\"id\":\"ev2\",\"status\":\"cancelled\"},"
                + "{\"id\":\"ev3\",\"status\":\"confirmed\",\"start\":{\"date\":\"2024-02-21\"},\"end\":{\"date\":\"2024-02-22\"}}"
                + "],\"nextSyncToken\":\"sync-1\"}";
        RoutingHttpTransport transport = new RoutingHttpTransport().respond(EVENTS, 200, body);

        // When
        ProviderResult<ProviderPage> result = clientFor(transport).fetchFull("token", "primary", window(), null);

        // Then
        assertTrue(result.isSuccess());
        ProviderPage page = result.getValue();
        assertEquals("sync-1", page.getNextCursor());
        assertFalse(page.hasMore());
        assertEquals(2, page.getItems().size());

        ExternalItem meeting = page.getItems().get(0);
        assertEquals("ev1", meeting.getExternalId());
        assertEquals(Instant.parse("2024-02-20T15:00:00Z"), meeting.getStartsAt());
        assertEquals("https://meet.google.com/abc", meeting.getMeetingUrl());
        List<Participant> participants = meeting.getParticipants();
        assertTrue(participants.get(0).isOrganizer());
        assertTrue(participants.get(1).isMaterialAttendee());
        assertFalse(participants.get(2).isMaterialAttendee());

        ExternalItem allDay = page.getItems().get(1);
        assertTrue(allDay.isAllDay());
        assertEquals("(No title)", allDay.getSubject());

        String url = transport.getRequestedUrls().get(0);
        assertTrue(url.contains("singleEvents=true"));
        assertTrue(url.contains("timeMin="));
    }

    @Test
    void fetchFull_WithMorePages_ShouldReturnPageTokenAndNoCursor() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 200, "{\"items\":[],\"nextPageToken\":\"page-2\"}");

        // When
        ProviderPage page = clientFor(transport).fetchFull("token", "primary", window(), null).getValue();

        // Then
        assertTrue(page.hasMore());
        assertEquals("page-2", page.getNextPageToken());
        assertNull(page.getNextCursor());
    }

    @Test
    void fetchIncremental_ShouldSendSyncTokenWithoutTimeBounds() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 200, "{\"items\":[],\"nextSyncToken\":\"sync-2\"}");

        // When
        ProviderPage page = clientFor(transport).fetchIncremental("token", "primary", "sync-1", null).getValue();

        // Then
        assertEquals("sync-2", page.getNextCursor());
        String url = transport.getRequestedUrls().get(0);
        assertTrue(url.contains("syncToken=sync-1"));
        assertFalse(url.contains("timeMin"));
        assertFalse(url.contains("orderBy"));
    }

    @Test
    void fetchIncremental_With410_ShouldReportCursorExpired() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 410, RoutingHttpTransport.error(410, "fullSyncRequired"));

        // When
        ProviderResult<ProviderPage> result = clientFor(transport).fetchIncremental("token", "primary", "old", null);

        // Then
        assertEquals(ProviderOutcome.CURSOR_EXPIRED, result.getOutcome());
        assertFalse(result.getMessage().contains("provider detail"));
    }

    @Test
    void fetchFull_With429_ShouldBeRetryableWithRetryAfter() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 429, RoutingHttpTransport.error(429, "rateLimitExceeded"), "30");

        // When
        ProviderResult<ProviderPage> result = clientFor(transport).fetchFull("token", "primary", window(), null);

        // Then
        assertEquals(ProviderOutcome.RETRYABLE, result.getOutcome());
        assertEquals(Duration.ofSeconds(30), result.getRetryAfter());
    }

    @Test
    void fetchFull_With403RateLimit_ShouldBeRetryable() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 403, RoutingHttpTransport.error(403, "userRateLimitExceeded"));

        // When
        ProviderResult<ProviderPage> result = clientFor(transport).fetchFull("token", "primary", window(), null);

        // Then
        assertEquals(ProviderOutcome.RETRYABLE, result.getOutcome());
    }

    @Test
    void fetchFull_With403Forbidden_ShouldBeTerminal() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond(EVENTS, 403, RoutingHttpTransport.error(403, "forbidden"));

        // When
        ProviderResult<ProviderPage> result = clientFor(transport).fetchFull("token", "primary", window(), null);

        // Then
        assertEquals(ProviderOutcome.TERMINAL, result.getOutcome());
    }

    @Test
    void listCalendars_ShouldKeepReadableCalendarsPrimaryFirst() {
        // Given
        RoutingHttpTransport transport = new RoutingHttpTransport()
                .respond("/users/me/calendarList", 200, "{\"items\":["
                        + "{\"id\":\"team@group.calendar.google.com\",\"summary\":\"Team\",\"accessRole\":\"reader\"},"
                        + "{\"id\":\"busy@group.calendar.google.com\",\"summary\":\"Busy\",\"accessRole\":\"freeBusyReader\"},"
                        + "{\"id\":\"me@example.com\",\"summary\":\"Me\",\"accessRole\":\"owner\",\"primary\":true}]}");

        // When
        List<CalendarInfo> calendars = clientFor(transport).listCalendars("token").getValue();

        // Then
        assertEquals(2, calendars.size());
        assertEquals("me@example.com", calendars.get(0).getId());
        assertTrue(calendars.get(0).isPrimary());
    }
}
