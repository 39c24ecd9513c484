package crm.sync.app.service.provider;

import com.google.api.client.http.HttpResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.InteractionType;
import crm.sync.app.entity.ParticipantRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Gmail messages. Full sync lists by date query, incremental sync walks the History API
 * from the stored historyId.
 */
@Slf4j
@Service
public class GmailClient implements ProviderClient {
    static final String ME = "me";
    static final String MAILBOX = "mailbox";
    static final long PAGE_SIZE = 500L;

    private final GoogleServiceFactory googleServiceFactory;

    public GmailClient(GoogleServiceFactory googleServiceFactory) {
        this.googleServiceFactory = googleServiceFactory;
    }

    @Override
    public IntegrationType getType() {
        return IntegrationType.GMAIL;
    }

    @Override
    public String defaultSourceId() {
        return MAILBOX;
    }

    @Override
    public ProviderResult<ProviderPage> fetchFull(String accessToken, String sourceId, FetchWindow window, String pageToken) {
        Gmail gmail = googleServiceFactory.gmail(accessToken);
        try {
            String query = "after:" + window.getTimeMin().getEpochSecond() + " before:" + window.getTimeMax().getEpochSecond();
            Gmail.Users.Messages.List request = gmail.users().messages().list(ME)
                    .setQ(query)
                    .setMaxResults(PAGE_SIZE);
            if (pageToken != null) {
                request.setPageToken(pageToken);
            }
            ListMessagesResponse response = request.execute();

            List<ExternalItem> items = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message ref : response.getMessages()) {
                    Message message = getMessage(gmail, ref.getId());
                    if (message != null) {
                        items.add(toItem(message, sourceId));
                    }
                }
            }

            String nextPageToken = response.getNextPageToken();
            String cursor = null;
            if (nextPageToken == null) {
                BigInteger historyId = gmail.users().getProfile(ME).execute().getHistoryId();
                cursor = historyId != null ? historyId.toString() : null;
            }
            return ProviderResult.success(new ProviderPage(items, nextPageToken, cursor));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Gmail message list");
        }
    }

    @Override
    public ProviderResult<ProviderPage> fetchIncremental(String accessToken, String sourceId, String cursor, String pageToken) {
        Gmail gmail = googleServiceFactory.gmail(accessToken);
        ListHistoryResponse response;
        try {
            Gmail.Users.History.List request = gmail.users().history().list(ME)
                    .setStartHistoryId(new BigInteger(cursor))
                    .setHistoryTypes(List.of("messageAdded"))
                    .setMaxResults(PAGE_SIZE);
            if (pageToken != null) {
                request.setPageToken(pageToken);
            }
            response = request.execute();
        } catch (NumberFormatException e) {
            return ProviderResult.failure(ProviderOutcome.CURSOR_EXPIRED, 400, "Stored Gmail historyId is not numeric");
        } catch (HttpResponseException e) {
            // Gmail answers 404 when the historyId is too old
            if (e.getStatusCode() == 404) {
                return ProviderResult.failure(ProviderOutcome.CURSOR_EXPIRED, 404, "Gmail historyId is no longer valid");
            }
            return GoogleServiceFactory.toResult(e, "Gmail history list");
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Gmail history list");
        }

        try {
            Set<String> messageIds = new LinkedHashSet<>();
            if (response.getHistory() != null) {
                for (History history : response.getHistory()) {
                    if (history.getMessagesAdded() == null) {
                        continue;
                    }
                    for (HistoryMessageAdded added : history.getMessagesAdded()) {
                        if (added.getMessage() != null) {
                            messageIds.add(added.getMessage().getId());
                        }
                    }
                }
            }

            List<ExternalItem> items = new ArrayList<>();
            for (String messageId : messageIds) {
                Message message = getMessage(gmail, messageId);
                if (message != null) {
                    items.add(toItem(message, sourceId));
                }
            }

            String nextPageToken = response.getNextPageToken();
            String nextCursor = nextPageToken == null && response.getHistoryId() != null
                    ? response.getHistoryId().toString()
                    : null;
            return ProviderResult.success(new ProviderPage(items, nextPageToken, nextCursor));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Gmail message get");
        }
    }

    @Override
    public ProviderResult<ExternalItem> fetchById(String accessToken, String sourceId, String itemId) {
        try {
            Message message = googleServiceFactory.gmail(accessToken).users().messages().get(ME, itemId)
                    .setFormat("full")
                    .execute();
            return ProviderResult.success(toItem(message, sourceId));
        } catch (IOException e) {
            return GoogleServiceFactory.toResult(e, "Gmail message get");
        }
    }

    // Messages deleted between listing and fetching come back as 404 and are skipped
    private Message getMessage(Gmail gmail, String messageId) throws IOException {
        try {
            return gmail.users().messages().get(ME, messageId).setFormat("full").execute();
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 404) {
                log.debug("Gmail message {} disappeared before it could be fetched", messageId);
                return null;
            }
            throw e;
        }
    }

    ExternalItem toItem(Message message, String sourceId) {
        String subject = null;
        String from = null;
        String to = null;
        String cc = null;
        String date = null;

        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                String name = header.getName() == null ? "" : header.getName().toLowerCase(Locale.ROOT);
                switch (name) {
                    case "subject":
                        subject = header.getValue();
                        break;
                    case "from":
                        from = header.getValue();
                        break;
                    case "to":
                        to = header.getValue();
                        break;
                    case "cc":
                        cc = header.getValue();
                        break;
                    case "date":
                        date = header.getValue();
                        break;
                    default:
                        break;
                }
            }
        }

        List<Participant> participants = new ArrayList<>();
        Participant sender = EmailAddresses.parse(from, ParticipantRole.FROM);
        if (sender != null) {
            participants.add(sender);
        }
        participants.addAll(EmailAddresses.parseList(to, ParticipantRole.TO));
        participants.addAll(EmailAddresses.parseList(cc, ParticipantRole.CC));

        Instant receivedAt = message.getInternalDate() != null
                ? Instant.ofEpochMilli(message.getInternalDate())
                : parseDateHeader(date);

        return ExternalItem.builder()
                .externalId(message.getId())
                .sourceId(sourceId)
                .type(InteractionType.EMAIL)
                .threadId(message.getThreadId())
                .subject(subject != null ? subject : "")
                .snippet(message.getSnippet())
                .body(extractBody(payload))
                .startsAt(receivedAt)
                .organizerEmail(sender != null ? sender.getEmail() : null)
                .participants(participants)
                .build();
    }

    private static String extractBody(MessagePart payload) {
        if (payload == null) {
            return null;
        }
        String plain = findPart(payload, "text/plain");
        if (plain != null) {
            return plain;
        }
        String html = findPart(payload, "text/html");
        return html != null ? HtmlText.strip(html) : null;
    }

    private static String findPart(MessagePart part, String mimeType) {
        if (mimeType.equals(part.getMimeType()) && part.getBody() != null && part.getBody().getData() != null) {
            return new String(part.getBody().decodeData(), StandardCharsets.UTF_8);
        }
        if (part.getParts() != null) {
            for (MessagePart child : part.getParts()) {
                String found = findPart(child, mimeType);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static Instant parseDateHeader(String date) {
        if (date == null) {
            return null;
        }
        try {
            return ZonedDateTime.parse(date.replaceAll("\\s*\\(.*\\)$", "").trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Date header: {}", date);
            return null;
        }
    }
}
