package crm.sync.app.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.ParticipantRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outlook calendar through Microsoft Graph calendarView delta queries.
 * Page tokens are the full {@code @odata.nextLink}; cursors are the {@code $deltatoken} value.
 */
@Slf4j
@Service
public class OutlookCalendarClient implements CalendarProviderClient {
    static final String PRIMARY = "primary";

    private final GraphApiClient graphApiClient;

    public OutlookCalendarClient(GraphApiClient graphApiClient) {
        this.graphApiClient = graphApiClient;
    }

    @Override
    public IntegrationType getType() {
        return IntegrationType.OUTLOOK_CALENDAR;
    }

    @Override
    public String defaultSourceId() {
        return PRIMARY;
    }

    @Override
    public ProviderResult<ProviderPage> fetchFull(String accessToken, String sourceId, FetchWindow window, String pageToken) {
        String url = pageToken != null ? pageToken : UriComponentsBuilder.fromHttpUrl(deltaPath(sourceId))
                .queryParam("startDateTime", window.getTimeMin().toString())
                .queryParam("endDateTime", window.getTimeMax().toString())
                .encode()
                .build()
                .toUriString();
        return graphApiClient.get(accessToken, url, "Outlook calendar delta").map(json -> toPage(json, sourceId));
    }

    @Override
    public ProviderResult<ProviderPage> fetchIncremental(String accessToken, String sourceId, String cursor, String pageToken) {
        String url = pageToken != null ? pageToken : deltaPath(sourceId) + "?$deltatoken=" + cursor;
        return graphApiClient.get(accessToken, url, "Outlook calendar delta").map(json -> toPage(json, sourceId));
    }

    @Override
    public ProviderResult<ExternalItem> fetchById(String accessToken, String sourceId, String itemId) {
        String url = graphApiClient.getBaseUrl() + "/me/events/" + itemId;
        return graphApiClient.get(accessToken, url, "Outlook event get").map(json -> toItem(json, sourceId));
    }

    @Override
    public ProviderResult<List<CalendarInfo>> listCalendars(String accessToken) {
        List<CalendarInfo> calendars = new ArrayList<>();
        String url = graphApiClient.getBaseUrl() + "/me/calendars";
        while (url != null) {
            ProviderResult<JsonNode> result = graphApiClient.get(accessToken, url, "Outlook calendar list");
            if (!result.isSuccess()) {
                return result.propagate();
            }
            JsonNode json = result.getValue();
            for (JsonNode calendar : json.path("value")) {
                boolean primary = calendar.path("isDefaultCalendar").asBoolean(false);
                String role = calendar.path("canEdit").asBoolean(false) ? "writer" : "reader";
                calendars.add(new CalendarInfo(primary ? PRIMARY : GraphApiClient.text(calendar, "id"),
                        GraphApiClient.text(calendar, "name"), primary, role, null));
            }
            url = GraphApiClient.text(json, GraphApiClient.NEXT_LINK);
        }
        calendars.sort(Comparator.comparing((CalendarInfo c) -> !c.isPrimary())
                .thenComparing(c -> c.getName() == null ? "" : c.getName(), String.CASE_INSENSITIVE_ORDER));
        return ProviderResult.success(calendars);
    }

    private String deltaPath(String sourceId) {
        if (sourceId == null || PRIMARY.equals(sourceId)) {
            return graphApiClient.getBaseUrl() + "/me/calendarView/delta";
        }
        return graphApiClient.getBaseUrl() + "/me/calendars/" + sourceId + "/calendarView/delta";
    }

    private ProviderPage toPage(JsonNode json, String sourceId) {
        List<ExternalItem> items = new ArrayList<>();
        for (JsonNode event : json.path("value")) {
            // Deleted items come back as @removed stubs
            if (event.has("@removed") || event.path("isCancelled").asBoolean(false)) {
                continue;
            }
            ExternalItem item = toItem(event, sourceId);
            if (item.getStartsAt() != null) {
                items.add(item);
            }
        }
        String nextLink = GraphApiClient.text(json, GraphApiClient.NEXT_LINK);
        String cursor = nextLink == null ? GraphApiClient.extractDeltaToken(GraphApiClient.text(json, GraphApiClient.DELTA_LINK)) : null;
        return new ProviderPage(items, nextLink, cursor);
    }

    ExternalItem toItem(JsonNode event, String sourceId) {
        String organizerEmail = GraphApiClient.text(event.path("organizer").path("emailAddress"), "address");
        List<Participant> participants = new ArrayList<>();
        for (JsonNode attendee : event.path("attendees")) {
            String email = GraphApiClient.text(attendee.path("emailAddress"), "address");
            boolean organizer = organizerEmail != null && organizerEmail.equalsIgnoreCase(email);
            participants.add(Participant.builder()
                    .email(email)
                    .displayName(GraphApiClient.text(attendee.path("emailAddress"), "name"))
                    .organizer(organizer)
                    .responseStatus(mapResponse(GraphApiClient.text(attendee.path("status"), "response")))
                    .role(organizer ? ParticipantRole.ORGANIZER : ParticipantRole.ATTENDEE)
                    .build());
        }

        String body = GraphApiClient.text(event.path("body"), "content");
        if ("html".equalsIgnoreCase(GraphApiClient.text(event.path("body"), "contentType"))) {
            body = HtmlText.strip(body);
        }

        return ExternalItem.builder()
                .externalId(GraphApiClient.text(event, "id"))
                .sourceId(sourceId)
                .type(InteractionType.MEETING)
                .subject(event.hasNonNull("subject") ? event.get("subject").asText() : "(No title)")
                .body(body)
                .snippet(GraphApiClient.text(event, "bodyPreview"))
                .startsAt(parseDateTime(event.path("start")))
                .endsAt(parseDateTime(event.path("end")))
                .allDay(event.path("isAllDay").asBoolean(false))
                .location(GraphApiClient.text(event.path("location"), "displayName"))
                .meetingUrl(GraphApiClient.text(event.path("onlineMeeting"), "joinUrl"))
                .organizerEmail(organizerEmail)
                .participants(participants)
                .build();
    }

    static String mapResponse(String response) {
        if (response == null) {
            return Participant.NEEDS_ACTION;
        }
        switch (response) {
            case "accepted":
            case "organizer":
                return Participant.ACCEPTED;
            case "tentativelyAccepted":
                return Participant.TENTATIVE;
            case "declined":
                return Participant.DECLINED;
            default:
                return Participant.NEEDS_ACTION;
        }
    }

    static Instant parseDateTime(JsonNode node) {
        String value = GraphApiClient.text(node, "dateTime");
        if (value == null) {
            return null;
        }
        ZoneId zone = ZoneOffset.UTC;
        String timeZone = GraphApiClient.text(node, "timeZone");
        if (timeZone != null) {
            try {
                zone = ZoneId.of(timeZone);
            } catch (DateTimeException e) {
                // Windows zone names; requests ask for UTC so this is rare
                log.debug("Unknown time zone {}, assuming UTC", timeZone);
            }
        }
        try {
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            log.debug("Unparseable Graph dateTime: {}", value);
            return null;
        }
    }
}
