package crm.sync.app.service.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OutlookCalendarClientTest {

    private static final String DELTA = GraphApiClientTestSupport.BASE_URL + "/me/calendarView/delta";

    private OutlookCalendarClient outlookCalendarClient;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        GraphApiClient graphApiClient = new GraphApiClient();
        server = GraphApiClientTestSupport.bind(graphApiClient);
        outlookCalendarClient = new OutlookCalendarClient(graphApiClient);
    }

    @Test
    void fetchFull_ShouldFollowNextLinkAndReturnDeltaTokenOnLastPage() {
        // Given
        String nextLink = DELTA + "?$skiptoken=page2";
        server.expect(requestTo(startsWith(DELTA + "?startDateTime=")))
                .andRespond(withSuccess("{\"value\":[" + event("e1", "2024-01-15T10:00:00.0000000") + "],"
                        + "\"@odata.nextLink\":\"" + nextLink + "\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(nextLink))
                .andRespond(withSuccess("{\"value\":[" + event("e2", "2024-01-16T10:00:00.0000000") + "],"
                        + "\"@odata.deltaLink\":\"" + DELTA + "?$deltatoken=delta-xyz\"}", MediaType.APPLICATION_JSON));
        FetchWindow window = FetchWindow.around(Instant.parse("2024-01-20T00:00:00Z"), 30, 90);

        // When
        ProviderResult<ProviderPage> first = outlookCalendarClient.fetchFull("token", "primary", window, null);
        ProviderResult<ProviderPage> second = outlookCalendarClient.fetchFull("token", "primary", window,
                first.getValue().getNextPageToken());

        // Then
        assertTrue(first.getValue().hasMore());
        assertNull(first.getValue().getNextCursor());
        assertFalse(second.getValue().hasMore());
        assertEquals("delta-xyz", second.getValue().getNextCursor());
        assertEquals("e2", second.getValue().getItems().get(0).getExternalId());
        server.verify();
    }

    @Test
    void fetchIncremental_ShouldMapEventFieldsAndSkipRemovedAndCancelled() {
        // Given
        String body = "{\"value\":["
                + event("e1", "2024-01-15T10:00:00.0000000") + ","
                + "{\"id\":\"gone\",\"@removed\":{\"reason\":\"deleted\"}},"
                + "{\"id\":\"cancelled\",\"isCancelled\":true,\"start\":{\"dateTime\":\"2024-01-15T10:00:00\",\"timeZone\":\"UTC\"}}"
                + "],\"@odata.deltaLink\":\"" + DELTA + "?$deltatoken=next-token\"}";
        server.expect(requestTo(DELTA + "?$deltatoken=old-token"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // When
        ProviderResult<ProviderPage> result = outlookCalendarClient.fetchIncremental("token", "primary", "old-token", null);

        // Then
        List<ExternalItem> items = result.getValue().getItems();
        assertEquals(1, items.size());
        ExternalItem item = items.get(0);
        assertEquals("Quarterly review", item.getSubject());
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), item.getStartsAt());
        assertEquals("organizer@contoso.com", item.getOrganizerEmail());
        assertEquals("https://teams.microsoft.com/l/meetup", item.getMeetingUrl());
        assertEquals(2, item.getParticipants().size());

        Participant organizer = item.getParticipants().get(0);
        assertTrue(organizer.isOrganizer());
        assertFalse(organizer.isMaterialAttendee());
        Participant guest = item.getParticipants().get(1);
        assertEquals(Participant.TENTATIVE, guest.getResponseStatus());
        assertTrue(guest.isMaterialAttendee());
        assertEquals("next-token", result.getValue().getNextCursor());
    }

    @Test
    void fetchIncremental_WithExpiredDeltaToken_ShouldReportCursorExpired() {
        // Given
        server.expect(requestTo(containsString("$deltatoken=stale")))
                .andRespond(withStatus(HttpStatus.GONE));

        // When
        ProviderResult<ProviderPage> result = outlookCalendarClient.fetchIncremental("token", "primary", "stale", null);

        // Then
        assertEquals(ProviderOutcome.CURSOR_EXPIRED, result.getOutcome());
    }

    @Test
    void fetchFull_ForSecondaryCalendar_ShouldUseCalendarPath() {
        // Given
        server.expect(requestTo(startsWith(GraphApiClientTestSupport.BASE_URL + "/me/calendars/cal-2/calendarView/delta")))
                .andRespond(withSuccess("{\"value\":[],\"@odata.deltaLink\":\"" + DELTA + "?$deltatoken=t\"}",
                        MediaType.APPLICATION_JSON));

        // When
        ProviderResult<ProviderPage> result = outlookCalendarClient.fetchFull("token", "cal-2",
                FetchWindow.pastDays(Instant.now(), 7), null);

        // Then
        assertTrue(result.isSuccess());
        server.verify();
    }

    @Test
    void listCalendars_ShouldPutDefaultCalendarFirstAsPrimary() {
        // Given
        server.expect(requestTo(GraphApiClientTestSupport.BASE_URL + "/me/calendars"))
                .andRespond(withSuccess("{\"value\":["
                        + "{\"id\":\"c-team\",\"name\":\"Team\",\"isDefaultCalendar\":false,\"canEdit\":false},"
                        + "{\"id\":\"c-main\",\"name\":\"Calendar\",\"isDefaultCalendar\":true,\"canEdit\":true}"
                        + "]}", MediaType.APPLICATION_JSON));

        // When
        List<CalendarInfo> calendars = outlookCalendarClient.listCalendars("token").getValue();

        // Then
        assertEquals(2, calendars.size());
        assertEquals("primary", calendars.get(0).getId());
        assertTrue(calendars.get(0).isPrimary());
        assertEquals("c-team", calendars.get(1).getId());
    }

    @Test
    void mapResponse_ShouldTranslateGraphStatuses() {
        assertEquals(Participant.ACCEPTED, OutlookCalendarClient.mapResponse("accepted"));
        assertEquals(Participant.TENTATIVE, OutlookCalendarClient.mapResponse("tentativelyAccepted"));
        assertEquals(Participant.DECLINED, OutlookCalendarClient.mapResponse("declined"));
        assertEquals(Participant.NEEDS_ACTION, OutlookCalendarClient.mapResponse("none"));
        assertEquals(Participant.NEEDS_ACTION, OutlookCalendarClient.mapResponse(null));
    }

    private static String event(String id, String start) {
        return "{\"id\":\"" + id + "\",\"subject\":\"Quarterly review\","
                + "\"start\":{\"dateTime\":\"" + start + "\",\"timeZone\":\"UTC\"},"
                + "\"end\":{\"dateTime\":\"" + start + "\",\"timeZone\":\"UTC\"},"
                + "\"organizer\":{\"emailAddress\":{\"address\":\"organizer@contoso.com\",\"name\":\"Org\"}},"
                + "\"onlineMeeting\":{\"joinUrl\":\"https://teams.microsoft.com/l/meetup\"},"
                + "\"attendees\":["
                + "{\"emailAddress\":{\"address\":\"organizer@contoso.com\",\"name\":\"Org\"},\"status\":{\"response\":\"organizer\"}},"
                + "{\"emailAddress\":{\"address\":\"guest@fabrikam.com\",\"name\":\"Guest Person\"},\"status\":{\"response\":\"tentativelyAccepted\"}}"
                + "]}";
    }
}
