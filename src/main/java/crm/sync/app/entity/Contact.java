package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "contacts", indexes = @Index(name = "idx_contact_user_email", columnList = "user_id, email"))
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class Contact {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String firstName;

    private String lastName;

    private String email;

    private String phone;

    private String company;

    private String title;

    @Enumerated(EnumType.STRING)
    private ContactSource source;

    // Only ever advanced, see ContactRepository#advanceLastContact
    private Instant lastContact;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
