package crm.sync.app.service.provider;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalendarInfo {
    private String id;
    private String name;
    private boolean primary;
    private String accessRole;
    private String timeZone;
}
