package crm.sync.app.dto;

import lombok.Data;

import java.util.Set;

/**
 * Partial update of a sync state; null fields are left as they are.
 */
@Data
public class SyncSettingsRequest {
    private Boolean enabled;
    private Integer lookbackDays;
    private Set<String> selectedSourceIds;
    private Boolean privacyMode;
    private Set<String> excludedEmails;
    private Set<String> excludedDomains;
}
