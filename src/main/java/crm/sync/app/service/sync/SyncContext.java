package crm.sync.app.service.sync;

import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncState;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * What an item handler needs to know about the sync run it is part of.
 */
@Getter
@AllArgsConstructor
public class SyncContext {
    private final String userId;
    private final IntegrationType type;
    // Lowercase addresses that belong to the user
    private final Set<String> selfEmails;
    private final SyncState state;
    private final Instant now;

    public boolean isSelf(String email) {
        return email != null && selfEmails.contains(email.toLowerCase(Locale.ROOT));
    }
}
