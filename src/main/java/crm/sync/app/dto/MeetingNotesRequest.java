package crm.sync.app.dto;

import lombok.Data;

@Data
public class MeetingNotesRequest {
    private String notes;
    private boolean append;
}
