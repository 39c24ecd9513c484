package crm.sync.app.dto;

import crm.sync.app.entity.SyncJob;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTriggerResponse {
    private String jobId;
    private String jobKey;
    private String status;
    private String mode;
    private int progress;

    public static SyncTriggerResponse from(SyncJob job) {
        return new SyncTriggerResponse(job.getId(), job.getJobKey(), job.getStatus().name(), job.getMode().name(), job.getProgress());
    }
}
