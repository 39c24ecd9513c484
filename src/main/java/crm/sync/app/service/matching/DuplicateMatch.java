package crm.sync.app.service.matching;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class DuplicateMatch {
    private final String contactId;
    private final String duplicateContactId;
    private final double score;
    private final MatchType matchType;
    private final List<String> matchedFields;
}
