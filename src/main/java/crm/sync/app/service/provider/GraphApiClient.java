package crm.sync.app.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thin Microsoft Graph GET helper shared by the Outlook clients.
 */
@Slf4j
@Component
public class GraphApiClient {
    static final String NEXT_LINK = "@odata.nextLink";
    static final String DELTA_LINK = "@odata.deltaLink";

    private static final Pattern DELTA_TOKEN = Pattern.compile("\\$deltatoken=([^&]+)");
    private static final int MAX_PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${crm.graph.base-url:https://graph.microsoft.com/v1.0}")
    private String baseUrl;

    public GraphApiClient() {
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * GETs an absolute Graph URL (including nextLink/deltaLink values) as JSON.
     */
    public ProviderResult<JsonNode> get(String accessToken, String url, String operation) {
        if (!url.startsWith(baseUrl)) {
            return ProviderResult.failure(ProviderOutcome.TERMINAL, 0, operation + " refused a link outside Microsoft Graph");
        }
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(accessToken);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            headers.add("Prefer", "odata.maxpagesize=" + MAX_PAGE_SIZE);
            headers.add("Prefer", "outlook.timezone=\"UTC\"");
            headers.add("Prefer", "outlook.body-content-type=\"text\"");

            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.GET, new HttpEntity<Void>(headers), String.class);
            if (response.getBody() == null) {
                return ProviderResult.fromStatus(response.getStatusCode().value(), operation + " returned an empty body", null);
            }
            return ProviderResult.success(objectMapper.readTree(response.getBody()));
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String retryAfter = e.getResponseHeaders() != null ? e.getResponseHeaders().getFirst("Retry-After") : null;
            log.warn("{} failed with status {}", operation, status);
            return ProviderResult.fromStatus(status, operation + " failed with status " + status, ProviderResult.parseRetryAfter(retryAfter));
        } catch (ResourceAccessException e) {
            return ProviderResult.networkError(operation + " failed: " + e.getClass().getSimpleName());
        } catch (Exception e) {
            log.error("{} failed: {}", operation, e.getMessage());
            return ProviderResult.failure(ProviderOutcome.TERMINAL, 0, operation + " returned an unreadable response");
        }
    }

    /**
     * Extracts the {@code $deltatoken} value from a deltaLink, or null.
     */
    public static String extractDeltaToken(String deltaLink) {
        if (deltaLink == null) {
            return null;
        }
        Matcher matcher = DELTA_TOKEN.matcher(deltaLink);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
