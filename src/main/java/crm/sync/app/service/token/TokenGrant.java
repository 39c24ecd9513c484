package crm.sync.app.service.token;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Parsed token endpoint response. Plaintext; never persisted or logged as is.
 */
@Getter
@AllArgsConstructor
public class TokenGrant {
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;
    private final String scope;

    public static TokenGrant fromJson(JsonNode json, Instant now) {
        if (json == null || !json.hasNonNull("access_token")) {
            throw new IllegalStateException("Token response missing access_token");
        }
        long expiresIn = json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : DEFAULT_EXPIRES_IN_SECONDS;
        String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
        String scope = json.hasNonNull("scope") ? json.get("scope").asText() : null;
        return new TokenGrant(json.get("access_token").asText(), refreshToken, now.plusSeconds(expiresIn), scope);
    }
}
