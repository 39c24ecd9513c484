package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A meeting or email synced from a provider. The natural key is
 * (userId, externalId, externalSource); records outlive the integration that produced them.
 */
@Entity
@Table(name = "interactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_interaction_external",
                columnNames = {"user_id", "external_id", "external_source"}),
        indexes = @Index(name = "idx_interaction_user_occurred", columnList = "user_id, occurred_at"))
@Getter
@Setter
@ToString(exclude = "participants")
@EqualsAndHashCode(of = "id")
public class Interaction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InteractionType type;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(name = "external_source", nullable = false, length = 32)
    private String externalSource;

    // Calendar id or mailbox folder the item was read from
    private String sourceId;

    @Column(length = 1000)
    private String subject;

    @Column(length = 10000)
    private String body;

    @Column(length = 1000)
    private String snippet;

    @Column(length = 1000)
    private String location;

    @Column(length = 1000)
    private String meetingUrl;

    private String threadId;

    @Enumerated(EnumType.STRING)
    private EmailDirection direction;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    private Instant endsAt;

    private boolean allDay;

    @Column(length = 10000)
    private String notes;

    @OneToMany(mappedBy = "interaction", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<InteractionParticipant> participants = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    public void replaceParticipants(List<InteractionParticipant> updated) {
        participants.clear();
        for (InteractionParticipant participant : updated) {
            participant.setInteraction(this);
            participants.add(participant);
        }
    }
}
