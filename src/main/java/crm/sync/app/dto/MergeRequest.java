package crm.sync.app.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MergeRequest {
    private List<String> duplicateIds = new ArrayList<>();
}
