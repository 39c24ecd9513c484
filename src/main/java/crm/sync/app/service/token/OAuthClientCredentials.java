package crm.sync.app.service.token;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OAuthClientCredentials {
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
}
