package crm.sync.app.entity;

import lombok.Getter;

/**
 * OAuth endpoints per identity provider. Microsoft exposes no token revocation endpoint.
 */
@Getter
public enum OAuthProvider {
    GOOGLE("google",
            "https://accounts.google.com/o/oauth2/v2/auth",
            "https://oauth2.googleapis.com/token",
            "https://oauth2.googleapis.com/revoke"),
    MICROSOFT("microsoft",
            "https://login.microsoftonline.com/common/oauth2/v2.0/authorize",
            "https://login.microsoftonline.com/common/oauth2/v2.0/token",
            null);

    private final String key;
    private final String authorizationUri;
    private final String tokenUri;
    private final String revocationUri;

    OAuthProvider(String key, String authorizationUri, String tokenUri, String revocationUri) {
        this.key = key;
        this.authorizationUri = authorizationUri;
        this.tokenUri = tokenUri;
        this.revocationUri = revocationUri;
    }

    public boolean supportsRevocation() {
        return revocationUri != null;
    }
}
