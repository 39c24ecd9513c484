package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Server-side record of a pending OAuth authorization. Deleted on first use.
 */
@Entity
@Table(name = "oauth_states", indexes = @Index(name = "idx_oauth_state_expires", columnList = "expires_at"))
@Getter
@Setter
@ToString(exclude = "codeVerifier")
@EqualsAndHashCode(of = "state")
public class OAuthState {
    @Id
    @Column(length = 128)
    private String state;

    @Column(nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private IntegrationType integrationType;

    @Column(length = 128)
    private String codeVerifier;

    @Column(length = 1000)
    private String redirectAfter;

    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
