package crm.sync.app.dto;

import crm.sync.app.entity.SyncPhase;
import crm.sync.app.entity.SyncState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Sync settings without the provider cursors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncSettingsView {
    private boolean enabled;
    private SyncPhase phase;
    private int lookbackDays;
    private Set<String> selectedSourceIds;
    private boolean privacyMode;
    private Set<String> excludedEmails;
    private Set<String> excludedDomains;
    private Instant lastSyncAt;

    public static SyncSettingsView from(SyncState state) {
        return SyncSettingsView.builder()
                .enabled(state.isSyncEnabled())
                .phase(state.getPhase())
                .lookbackDays(state.getLookbackDays())
                .selectedSourceIds(new LinkedHashSet<>(state.getSelectedSourceIds()))
                .privacyMode(state.isPrivacyMode())
                .excludedEmails(new LinkedHashSet<>(state.getExcludedEmails()))
                .excludedDomains(new LinkedHashSet<>(state.getExcludedDomains()))
                .lastSyncAt(state.getLastSyncAt())
                .build();
    }
}
