package crm.sync.app.service.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import crm.sync.app.entity.Integration;
import crm.sync.app.entity.OAuthProvider;
import crm.sync.app.entity.OAuthToken;
import crm.sync.app.entity.SyncStatus;
import crm.sync.app.exception.OAuthClientRejectedException;
import crm.sync.app.exception.ReconnectRequiredException;
import crm.sync.app.exception.TokenVaultException;
import crm.sync.app.repository.IntegrationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * Hands out plaintext access tokens for an integration, refreshing them through the
 * provider token endpoint when they are expired or about to expire.
 */
@Slf4j
@Service
public class TokenRefreshService {
    static final long REFRESH_MARGIN_SECONDS = 300;

    private final IntegrationRepository integrationRepository;
    private final TokenEncryptionService tokenEncryptionService;
    private final OAuthClientRegistry oauthClientRegistry;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public TokenRefreshService(IntegrationRepository integrationRepository,
                               TokenEncryptionService tokenEncryptionService,
                               OAuthClientRegistry oauthClientRegistry) {
        this.integrationRepository = integrationRepository;
        this.tokenEncryptionService = tokenEncryptionService;
        this.oauthClientRegistry = oauthClientRegistry;
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Returns a valid plaintext access token, refreshing first if the stored one expires
     * within the next 5 minutes.
     */
    public String ensureValidAccessToken(Integration integration) {
        OAuthToken token = integration.getToken();
        if (token == null || token.getAccessToken() == null) {
            throw new ReconnectRequiredException(integration.getType(),
                    "No access token stored for " + integration.getType().getSlug() + ". Please reconnect.");
        }

        // Null expiry is treated as expired
        Instant now = Instant.now();
        boolean needsRefresh = token.getExpiry() == null || token.getExpiry().isBefore(now.plusSeconds(REFRESH_MARGIN_SECONDS));
        if (!needsRefresh) {
            return tokenEncryptionService.decrypt(token.getAccessToken());
        }

        if (token.getRefreshToken() == null || token.getRefreshToken().isEmpty()) {
            markReconnectRequired(integration);
            throw new ReconnectRequiredException(integration.getType(),
                    "Access token expired and no refresh token available for " + integration.getType().getSlug() + ". Please reconnect.");
        }

        log.info("Refreshing access token for integration {} ({})", integration.getId(), integration.getType());
        return refreshAccessToken(integration);
    }

    /**
     * Forces a refresh after the provider rejected the current access token with a 401.
     */
    public String refreshTokenOn401(Integration integration) {
        OAuthToken token = integration.getToken();
        if (token == null || token.getRefreshToken() == null || token.getRefreshToken().isEmpty()) {
            markReconnectRequired(integration);
            throw new ReconnectRequiredException(integration.getType(),
                    "Received 401 Unauthorized and no refresh token available for " + integration.getType().getSlug() + ". Please reconnect.");
        }
        log.info("Received 401, refreshing access token for integration {}", integration.getId());
        return refreshAccessToken(integration);
    }

    /**
     * Exchanges the stored refresh token for a new access token and persists it encrypted.
     * A rejected grant deactivates the integration. Rejected client credentials leave it
     * active, since only the server configuration is at fault. Any other failure is left retryable.
     */
    public String refreshAccessToken(Integration integration) {
        OAuthProvider provider = integration.getType().getProvider();
        OAuthClientCredentials credentials = oauthClientRegistry.credentialsFor(provider);
        OAuthToken token = integration.getToken();
        String refreshToken = tokenEncryptionService.decrypt(token.getRefreshToken());

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

            MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
            body.add("client_id", credentials.getClientId());
            body.add("client_secret", credentials.getClientSecret());
            body.add("refresh_token", refreshToken);
            body.add("grant_type", "refresh_token");

            HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = restTemplate.postForEntity(provider.getTokenUri(), request, String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Token endpoint returned status " + response.getStatusCode().value());
            }

            JsonNode json = objectMapper.readTree(response.getBody());
            TokenGrant grant = TokenGrant.fromJson(json, Instant.now());

            token.setAccessToken(tokenEncryptionService.encrypt(grant.getAccessToken()));
            token.setExpiry(grant.getExpiresAt());
            // Microsoft rotates refresh tokens, Google usually does not
            if (grant.getRefreshToken() != null) {
                token.setRefreshToken(tokenEncryptionService.encrypt(grant.getRefreshToken()));
            }
            integration.setToken(token);
            integration.setSyncStatus(SyncStatus.ACTIVE);
            integration.setUpdatedAt(Instant.now());
            integrationRepository.save(integration);

            log.info("Token refreshed for integration {}, expires at: {}", integration.getId(), grant.getExpiresAt());
            return grant.getAccessToken();
        } catch (HttpClientErrorException e) {
            if (isRevokedGrant(e)) {
                markReconnectRequired(integration);
                throw new ReconnectRequiredException(integration.getType(),
                        "The " + provider.getKey() + " grant was revoked or has expired. Please reconnect.");
            }
            if (isRejectedClient(e)) {
                markError(integration);
                log.error("Token endpoint for {} rejected the configured client credentials (status {})",
                        provider.getKey(), e.getStatusCode().value());
                throw new OAuthClientRejectedException(provider);
            }
            markError(integration);
            log.error("Failed to refresh access token for integration {}: status {}", integration.getId(), e.getStatusCode().value());
            throw new IllegalStateException("Failed to refresh access token: token endpoint returned " + e.getStatusCode().value());
        } catch (TokenVaultException e) {
            throw e;
        } catch (Exception e) {
            markError(integration);
            log.error("Failed to refresh access token for integration {}: {}", integration.getId(), e.getClass().getSimpleName());
            throw new IllegalStateException("Failed to refresh access token for " + integration.getType().getSlug());
        }
    }

    private boolean isRevokedGrant(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        return e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value() && body != null && body.contains("invalid_grant");
    }

    // RFC 6749 5.2 answers a failed client authentication with invalid_client, often as a 401
    private boolean isRejectedClient(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        return e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value() || (body != null && body.contains("invalid_client"));
    }

    private void markReconnectRequired(Integration integration) {
        integration.setSyncStatus(SyncStatus.EXPIRED);
        integration.setActive(false);
        integration.setUpdatedAt(Instant.now());
        integrationRepository.save(integration);
    }

    private void markError(Integration integration) {
        integration.setSyncStatus(SyncStatus.ERROR);
        integration.setUpdatedAt(Instant.now());
        integrationRepository.save(integration);
    }
}
