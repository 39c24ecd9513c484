package crm.sync.app.service.matching;

import crm.sync.app.entity.Contact;
import crm.sync.app.service.provider.Participant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A participant resolved to a contact, either existing or created during the match.
 */
@Getter
@ToString
@AllArgsConstructor
public class ContactMatch {
    private final Participant participant;
    private final Contact contact;
    private final boolean created;
}
