package crm.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-user, per-provider sync configuration and incremental cursors.
 * Cursors are kept per source (calendar id, mailbox folder) because providers issue them per source.
 */
@Entity
@Table(name = "sync_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_sync_state_user_type", columnNames = {"user_id", "integration_type"}))
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class SyncState {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "integration_type", nullable = false, length = 32)
    private IntegrationType integrationType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sync_state_cursors", joinColumns = @JoinColumn(name = "sync_state_id"))
    @MapKeyColumn(name = "source_id")
    @Column(name = "cursor_value", length = 2048)
    private Map<String, String> cursors = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sync_state_sources", joinColumns = @JoinColumn(name = "sync_state_id"))
    @Column(name = "source_id")
    private Set<String> selectedSourceIds = new LinkedHashSet<>();

    private Instant lastSyncAt;

    private boolean syncEnabled = true;

    private int lookbackDays;

    // Email only: drop message bodies
    private boolean privacyMode = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sync_state_excluded_emails", joinColumns = @JoinColumn(name = "sync_state_id"))
    @Column(name = "email")
    private Set<String> excludedEmails = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sync_state_excluded_domains", joinColumns = @JoinColumn(name = "sync_state_id"))
    @Column(name = "domain")
    private Set<String> excludedDomains = new LinkedHashSet<>();

    private Instant updatedAt;

    @Version
    private long version;

    public String getCursor(String sourceId) {
        return cursors.get(sourceId);
    }

    public void putCursor(String sourceId, String cursor) {
        if (cursor == null || cursor.isEmpty()) {
            cursors.remove(sourceId);
        } else {
            cursors.put(sourceId, cursor);
        }
    }

    public void clearCursors() {
        cursors.clear();
    }

    public SyncPhase getPhase() {
        if (!syncEnabled) {
            return SyncPhase.DISABLED;
        }
        return cursors.isEmpty() ? SyncPhase.FIRST_SYNC : SyncPhase.INCREMENTAL;
    }

    public List<String> sourcesOrDefault(String defaultSourceId) {
        if (selectedSourceIds == null || selectedSourceIds.isEmpty()) {
            return List.of(defaultSourceId);
        }
        return new ArrayList<>(selectedSourceIds);
    }
}
