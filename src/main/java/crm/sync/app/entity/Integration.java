package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "integrations",
        uniqueConstraints = @UniqueConstraint(name = "uk_integration_user_type", columnNames = {"user_id", "type"}))
@Getter
@Setter
@ToString(exclude = {"user", "token"})
@EqualsAndHashCode(exclude = "user")
public class Integration {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private IntegrationType type;

    // Mailbox or calendar owner address reported at connect time
    private String accountEmail;

    @Embedded
    private OAuthToken token;

    private boolean active;

    @Enumerated(EnumType.STRING)
    private SyncStatus syncStatus;

    private Instant connectedAt;

    private Instant updatedAt;

    public String getUserId() {
        return user != null ? user.getId() : null;
    }
}
