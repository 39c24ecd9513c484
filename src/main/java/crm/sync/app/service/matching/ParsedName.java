package crm.sync.app.service.matching;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ParsedName {
    private final String firstName;
    private final String lastName;
}
