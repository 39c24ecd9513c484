package crm.sync.app.service.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.gmail.Gmail;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

/**
 * Builds per-call Google API clients authorized with a bearer access token,
 * and translates their exceptions into {@link ProviderResult}s.
 */
@Component
public class GoogleServiceFactory {
    static final String APPLICATION_NAME = "CRM Sync";

    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded", "quotaExceeded");

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;

    public GoogleServiceFactory(HttpTransport httpTransport, JsonFactory jsonFactory) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
    }

    public Calendar calendar(String accessToken) {
        return new Calendar.Builder(httpTransport, jsonFactory, credential(accessToken))
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    public Gmail gmail(String accessToken) {
        return new Gmail.Builder(httpTransport, jsonFactory, credential(accessToken))
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    private Credential credential(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(jsonFactory)
                .build();
        credential.setAccessToken(accessToken);
        return credential;
    }

    static <T> ProviderResult<T> toResult(IOException e, String operation) {
        if (e instanceof HttpResponseException) {
            HttpResponseException http = (HttpResponseException) e;
            int status = http.getStatusCode();
            Duration retryAfter = http.getHeaders() != null
                    ? ProviderResult.parseRetryAfter(http.getHeaders().getFirstHeaderStringValue("Retry-After"))
                    : null;
            // Google reports per-user rate limiting as 403 with a reason
            if (status == 403 && isRateLimited(e)) {
                return ProviderResult.failure(ProviderOutcome.RETRYABLE, status, operation + " was rate limited", retryAfter);
            }
            return ProviderResult.fromStatus(status, operation + " failed with status " + status, retryAfter);
        }
        return ProviderResult.networkError(operation + " failed: " + e.getClass().getSimpleName());
    }

    private static boolean isRateLimited(IOException e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors().stream()
                .anyMatch(info -> info.getReason() != null && RATE_LIMIT_REASONS.contains(info.getReason()));
    }
}
