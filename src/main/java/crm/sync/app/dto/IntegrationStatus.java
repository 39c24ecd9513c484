package crm.sync.app.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrationStatus {
    private boolean connected;
    private String provider;
    private String accountEmail;
    private String syncStatus;
    private long totalItems;
    private Instant lastSyncAt;
    private boolean syncEnabled;
}
