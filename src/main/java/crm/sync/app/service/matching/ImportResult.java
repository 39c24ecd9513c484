package crm.sync.app.service.matching;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ImportResult {
    private int imported;
    private int updated;
    private int skipped;
    private int failed;
    private List<String> errors = new ArrayList<>();
    private List<String> contactIds = new ArrayList<>();
}
