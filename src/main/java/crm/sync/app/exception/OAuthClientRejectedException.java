package crm.sync.app.exception;

import crm.sync.app.entity.OAuthProvider;
import lombok.Getter;

/**
 * The provider token endpoint rejected this application's client id or secret. The user's
 * grant may be fine, so reconnecting does not help; the client configuration has to be fixed.
 */
@Getter
public class OAuthClientRejectedException extends RuntimeException {
    private final OAuthProvider provider;

    public OAuthClientRejectedException(OAuthProvider provider) {
        super("The " + provider.getKey() + " OAuth client credentials were rejected by the token endpoint");
        this.provider = provider;
    }
}
