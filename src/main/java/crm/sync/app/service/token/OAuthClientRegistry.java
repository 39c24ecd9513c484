package crm.sync.app.service.token;

import crm.sync.app.entity.OAuthProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * OAuth client credentials per provider. Google reuses the login registration.
 */
@Component
public class OAuthClientRegistry {

    @Value("${spring.security.oauth2.client.registration.google.client-id:}")
    private String googleClientId;

    @Value("${spring.security.oauth2.client.registration.google.client-secret:}")
    private String googleClientSecret;

    @Value("${crm.oauth.google.redirect-uri:}")
    private String googleRedirectUri;

    @Value("${crm.oauth.microsoft.client-id:}")
    private String microsoftClientId;

    @Value("${crm.oauth.microsoft.client-secret:}")
    private String microsoftClientSecret;

    @Value("${crm.oauth.microsoft.redirect-uri:}")
    private String microsoftRedirectUri;

    /**
     * Returns the credentials for the provider, failing if any of them is missing.
     */
    public OAuthClientCredentials credentialsFor(OAuthProvider provider) {
        OAuthClientCredentials credentials = provider == OAuthProvider.GOOGLE
                ? new OAuthClientCredentials(googleClientId, googleClientSecret, googleRedirectUri)
                : new OAuthClientCredentials(microsoftClientId, microsoftClientSecret, microsoftRedirectUri);
        requireConfigured(credentials.getClientId(), provider, "client-id");
        requireConfigured(credentials.getClientSecret(), provider, "client-secret");
        requireConfigured(credentials.getRedirectUri(), provider, "redirect-uri");
        return credentials;
    }

    private static void requireConfigured(String value, OAuthProvider provider, String name) {
        if (value == null || value.isEmpty() || value.startsWith("${")) {
            throw new IllegalStateException(provider.getKey() + " OAuth " + name + " is not configured");
        }
    }
}
