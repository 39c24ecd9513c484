package crm.sync.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Instant;

/**
 * Provider credentials as stored at rest. Both token columns hold
 * ciphertext produced by the token vault, never plaintext.
 */
@Embeddable
@Data
public class OAuthToken {
    @Column(length = 4000)
    private String accessToken;

    @Column(length = 4000)
    private String refreshToken;

    private Instant expiry;

    @Column(length = 1000)
    private String scopes;
}
