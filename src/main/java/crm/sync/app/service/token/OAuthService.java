package crm.sync.app.service.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.OAuthProvider;
import crm.sync.app.entity.OAuthState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Base64;

/**
 * Authorization-code flow against Google and Microsoft: building the consent URL,
 * exchanging the returned code and revoking tokens on disconnect.
 */
@Slf4j
@Service
public class OAuthService {
    private final OAuthStateService oauthStateService;
    private final OAuthClientRegistry oauthClientRegistry;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OAuthService(OAuthStateService oauthStateService, OAuthClientRegistry oauthClientRegistry) {
        this.oauthStateService = oauthStateService;
        this.oauthClientRegistry = oauthClientRegistry;
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    public String buildAuthorizationUrl(String userId, IntegrationType type, String redirectAfter) {
        OAuthProvider provider = type.getProvider();
        OAuthClientCredentials credentials = oauthClientRegistry.credentialsFor(provider);
        OAuthState state = oauthStateService.create(userId, type, redirectAfter);

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(provider.getAuthorizationUri())
                .queryParam("client_id", credentials.getClientId())
                .queryParam("redirect_uri", credentials.getRedirectUri())
                .queryParam("response_type", "code")
                .queryParam("scope", type.getScopes())
                .queryParam("state", state.getState())
                .queryParam("code_challenge", codeChallenge(state.getCodeVerifier()))
                .queryParam("code_challenge_method", "S256");

        if (provider == OAuthProvider.GOOGLE) {
            // Both are needed for Google to hand out a refresh token every time
            builder.queryParam("access_type", "offline")
                    .queryParam("prompt", "consent");
        } else {
            builder.queryParam("response_mode", "query");
        }
        return builder.encode().build().toUriString();
    }

    public TokenGrant exchangeCode(IntegrationType type, String code, String codeVerifier) {
        OAuthProvider provider = type.getProvider();
        OAuthClientCredentials credentials = oauthClientRegistry.credentialsFor(provider);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", credentials.getClientId());
        body.add("client_secret", credentials.getClientSecret());
        body.add("code", code);
        body.add("redirect_uri", credentials.getRedirectUri());
        body.add("grant_type", "authorization_code");
        if (codeVerifier != null) {
            body.add("code_verifier", codeVerifier);
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    provider.getTokenUri(), new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Token endpoint returned status " + response.getStatusCode().value());
            }
            return TokenGrant.fromJson(objectMapper.readTree(response.getBody()), Instant.now());
        } catch (RestClientResponseException e) {
            log.error("Authorization code exchange with {} failed: status {}", provider.getKey(), e.getStatusCode().value());
            throw new IllegalStateException("Authorization code exchange failed with status " + e.getStatusCode().value());
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Authorization code exchange with {} failed: {}", provider.getKey(), e.getMessage());
            throw new IllegalStateException("Authorization code exchange failed", e);
        }
    }

    /**
     * Best-effort revocation. Returns false when the provider has no revocation endpoint
     * or the call fails; never throws.
     */
    public boolean revoke(OAuthProvider provider, String token) {
        if (!provider.supportsRevocation() || token == null || token.isEmpty()) {
            return false;
        }
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
            body.add("token", token);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    provider.getRevocationUri(), new HttpEntity<>(body, headers), String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (Exception e) {
            log.warn("Token revocation with {} failed: {}", provider.getKey(), e.getClass().getSimpleName());
            return false;
        }
    }

    static String codeChallenge(String codeVerifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
