package crm.sync.app.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.ParticipantRole;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Outlook mail through Microsoft Graph message delta queries on a mail folder.
 */
@Service
public class OutlookMailClient implements ProviderClient {
    static final String INBOX = "inbox";
    static final String SELECT = "id,conversationId,from,toRecipients,ccRecipients,subject,bodyPreview,body,receivedDateTime";

    private final GraphApiClient graphApiClient;

    public OutlookMailClient(GraphApiClient graphApiClient) {
        this.graphApiClient = graphApiClient;
    }

    @Override
    public IntegrationType getType() {
        return IntegrationType.OUTLOOK_MAIL;
    }

    @Override
    public String defaultSourceId() {
        return INBOX;
    }

    @Override
    public ProviderResult<ProviderPage> fetchFull(String accessToken, String sourceId, FetchWindow window, String pageToken) {
        // Message delta only supports a lower bound on receivedDateTime
        String url = pageToken != null ? pageToken : UriComponentsBuilder.fromHttpUrl(deltaPath(sourceId))
                .queryParam("$select", SELECT)
                .queryParam("$filter", "receivedDateTime ge " + window.getTimeMin().toString())
                .encode()
                .build()
                .toUriString();
        return graphApiClient.get(accessToken, url, "Outlook mail delta").map(json -> toPage(json, sourceId));
    }

    @Override
    public ProviderResult<ProviderPage> fetchIncremental(String accessToken, String sourceId, String cursor, String pageToken) {
        String url = pageToken != null ? pageToken : deltaPath(sourceId) + "?$deltatoken=" + cursor;
        return graphApiClient.get(accessToken, url, "Outlook mail delta").map(json -> toPage(json, sourceId));
    }

    @Override
    public ProviderResult<ExternalItem> fetchById(String accessToken, String sourceId, String itemId) {
        String url = graphApiClient.getBaseUrl() + "/me/messages/" + itemId + "?$select=" + SELECT;
        return graphApiClient.get(accessToken, url, "Outlook message get").map(json -> toItem(json, sourceId));
    }

    private String deltaPath(String sourceId) {
        String folder = sourceId == null ? INBOX : sourceId;
        return graphApiClient.getBaseUrl() + "/me/mailFolders/" + folder + "/messages/delta";
    }

    private ProviderPage toPage(JsonNode json, String sourceId) {
        List<ExternalItem> items = new ArrayList<>();
        for (JsonNode message : json.path("value")) {
            if (message.has("@removed")) {
                continue;
            }
            ExternalItem item = toItem(message, sourceId);
            if (item.getStartsAt() != null) {
                items.add(item);
            }
        }
        String nextLink = GraphApiClient.text(json, GraphApiClient.NEXT_LINK);
        String cursor = nextLink == null ? GraphApiClient.extractDeltaToken(GraphApiClient.text(json, GraphApiClient.DELTA_LINK)) : null;
        return new ProviderPage(items, nextLink, cursor);
    }

    ExternalItem toItem(JsonNode message, String sourceId) {
        List<Participant> participants = new ArrayList<>();
        Participant sender = toParticipant(message.path("from"), ParticipantRole.FROM);
        if (sender != null) {
            participants.add(sender);
        }
        for (JsonNode recipient : message.path("toRecipients")) {
            Participant participant = toParticipant(recipient, ParticipantRole.TO);
            if (participant != null) {
                participants.add(participant);
            }
        }
        for (JsonNode recipient : message.path("ccRecipients")) {
            Participant participant = toParticipant(recipient, ParticipantRole.CC);
            if (participant != null) {
                participants.add(participant);
            }
        }

        String body = GraphApiClient.text(message.path("body"), "content");
        if ("html".equalsIgnoreCase(GraphApiClient.text(message.path("body"), "contentType"))) {
            body = HtmlText.strip(body);
        }

        return ExternalItem.builder()
                .externalId(GraphApiClient.text(message, "id"))
                .sourceId(sourceId)
                .type(InteractionType.EMAIL)
                .threadId(GraphApiClient.text(message, "conversationId"))
                .subject(message.hasNonNull("subject") ? message.get("subject").asText() : "")
                .snippet(GraphApiClient.text(message, "bodyPreview"))
                .body(body)
                .startsAt(parseInstant(GraphApiClient.text(message, "receivedDateTime")))
                .organizerEmail(sender != null ? sender.getEmail() : null)
                .participants(participants)
                .build();
    }

    private static Participant toParticipant(JsonNode recipient, ParticipantRole role) {
        JsonNode address = recipient.path("emailAddress");
        String email = GraphApiClient.text(address, "address");
        if (email == null || !email.contains("@")) {
            return null;
        }
        return Participant.builder()
                .email(email.toLowerCase(Locale.ROOT))
                .displayName(GraphApiClient.text(address, "name"))
                .role(role)
                .build();
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
