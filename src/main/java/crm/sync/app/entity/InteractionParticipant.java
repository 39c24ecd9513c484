package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "interaction_participants", indexes = @Index(name = "idx_participant_contact", columnList = "contact_id"))
@Getter
@Setter
@ToString(exclude = "interaction")
@EqualsAndHashCode(of = "id")
public class InteractionParticipant {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "interaction_id", nullable = false)
    private Interaction interaction;

    @Column(name = "contact_id")
    private String contactId;

    private String email;

    private String displayName;

    @Enumerated(EnumType.STRING)
    private ParticipantRole role;

    private String responseStatus;
}
