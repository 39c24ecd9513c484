package crm.sync.app.service.matching;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ImportOptions {
    private int days = 90;
    private boolean skipDuplicates = true;
    private boolean updateExisting = false;
    // Empty means every previewed attendee
    private List<String> selectedEmails = new ArrayList<>();
}
