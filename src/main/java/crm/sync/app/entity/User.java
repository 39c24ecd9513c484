package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = "integrations")
@EqualsAndHashCode(exclude = "integrations")
public class User {
    @Id
    private String id; // OAuth subject / internal UUID

    private String email;

    private String name;

    @OneToMany(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Integration> integrations = new ArrayList<>();
}
