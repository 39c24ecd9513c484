package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Records where a contact came from, e.g. {@code calendar-attendee-jane@co.com}.
 */
@Entity
@Table(name = "contact_source_links",
        uniqueConstraints = @UniqueConstraint(name = "uk_contact_source_link", columnNames = {"contact_id", "external_id"}))
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class ContactSourceLink {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "contact_id", nullable = false)
    private String contactId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private IntegrationType integrationType;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    private Instant createdAt;
}
