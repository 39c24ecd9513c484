package crm.sync.app.service.token;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.OAuthProvider;
import crm.sync.app.entity.OAuthState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class OAuthServiceTest {

    @Mock
    private OAuthStateService oauthStateService;

    @Mock
    private OAuthClientRegistry oauthClientRegistry;

    private OAuthService oauthService;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        oauthService = new OAuthService(oauthStateService, oauthClientRegistry);
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ReflectionTestUtils.setField(oauthService, "restTemplate", restTemplate);
    }

    private void stubCredentials() {
        when(oauthClientRegistry.credentialsFor(any(OAuthProvider.class)))
                .thenReturn(new OAuthClientCredentials("client-1", "secret-1", "http://localhost/api/integrations/callback"));
    }

    private OAuthState pendingState(IntegrationType type) {
        OAuthState state = new OAuthState();
        state.setState("state-xyz");
        state.setUserId("user123");
        state.setIntegrationType(type);
        state.setCodeVerifier("verifier-123");
        state.setExpiresAt(Instant.now().plusSeconds(600));
        return state;
    }

    @Test
    void buildAuthorizationUrl_ForGoogle_ShouldRequestOfflineAccessWithPkce() {
        // Given
        stubCredentials();
        when(oauthStateService.create("user123", IntegrationType.GMAIL, "/home")).thenReturn(pendingState(IntegrationType.GMAIL));

        // When
        String url = oauthService.buildAuthorizationUrl("user123", IntegrationType.GMAIL, "/home");

        // Then
        Map<String, List<String>> params = UriComponentsBuilder.fromUriString(url).build().getQueryParams();
        assertTrue(url.startsWith(OAuthProvider.GOOGLE.getAuthorizationUri()));
        assertEquals("state-xyz", params.get("state").get(0));
        assertEquals("offline", params.get("access_type").get(0));
        assertEquals("consent", params.get("prompt").get(0));
        assertEquals("S256", params.get("code_challenge_method").get(0));
        assertEquals(OAuthService.codeChallenge("verifier-123"), params.get("code_challenge").get(0));
        assertFalse(url.contains("secret-1"));
    }

    @Test
    void buildAuthorizationUrl_ForMicrosoft_ShouldUseQueryResponseMode() {
        // Given
        stubCredentials();
        when(oauthStateService.create("user123", IntegrationType.OUTLOOK_CALENDAR, null))
                .thenReturn(pendingState(IntegrationType.OUTLOOK_CALENDAR));

        // When
        String url = oauthService.buildAuthorizationUrl("user123", IntegrationType.OUTLOOK_CALENDAR, null);

        // Then
        assertTrue(url.startsWith(OAuthProvider.MICROSOFT.getAuthorizationUri()));
        assertTrue(url.contains("response_mode=query"));
        assertFalse(url.contains("access_type"));
    }

    @Test
    void codeChallenge_ShouldMatchRfc7636Example() {
        assertEquals("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM",
                OAuthService.codeChallenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"));
    }

    @Test
    void exchangeCode_ShouldPostCodeAndVerifierAndParseGrant() {
        // Given
        stubCredentials();
        server.expect(requestTo(OAuthProvider.GOOGLE.getTokenUri()))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "code", "auth-code",
                        "code_verifier", "verifier-123",
                        "grant_type", "authorization_code")))
                .andRespond(withSuccess("{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3600,\"scope\":\"openid email\"}",
                        MediaType.APPLICATION_JSON));

        // When
        TokenGrant grant = oauthService.exchangeCode(IntegrationType.GOOGLE_CALENDAR, "auth-code", "verifier-123");

        // Then
        assertEquals("at", grant.getAccessToken());
        assertEquals("rt", grant.getRefreshToken());
        assertEquals("openid email", grant.getScope());
        assertTrue(grant.getExpiresAt().isAfter(Instant.now().plusSeconds(3500)));
        server.verify();
    }

    @Test
    void exchangeCode_WithRejectedCode_ShouldThrowWithoutProviderBody() {
        // Given
        stubCredentials();
        server.expect(requestTo(OAuthProvider.MICROSOFT.getTokenUri()))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\",\"error_description\":\"AADSTS70008 code expired\"}"));

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> oauthService.exchangeCode(IntegrationType.OUTLOOK_MAIL, "stale", "verifier"));
        assertTrue(exception.getMessage().contains("400"));
        assertFalse(exception.getMessage().contains("AADSTS70008"));
    }

    @Test
    void revoke_ForGoogle_ShouldPostToken() {
        // Given
        server.expect(requestTo(OAuthProvider.GOOGLE.getRevocationUri()))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of("token", "rt")))
                .andRespond(withSuccess());

        // When
        boolean revoked = oauthService.revoke(OAuthProvider.GOOGLE, "rt");

        // Then
        assertTrue(revoked);
        server.verify();
    }

    @Test
    void revoke_WhenProviderFails_ShouldReturnFalse() {
        // Given
        server.expect(requestTo(OAuthProvider.GOOGLE.getRevocationUri()))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        // When & Then
        assertFalse(oauthService.revoke(OAuthProvider.GOOGLE, "rt"));
    }

    @Test
    void revoke_ForMicrosoft_ShouldNotCallProvider() {
        // When
        boolean revoked = oauthService.revoke(OAuthProvider.MICROSOFT, "rt");

        // Then
        assertFalse(revoked);
        server.verify();
    }
}
