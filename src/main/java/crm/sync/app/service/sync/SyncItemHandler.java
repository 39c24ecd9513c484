package crm.sync.app.service.sync;

import crm.sync.app.entity.SyncDomain;
import crm.sync.app.service.provider.ExternalItem;

/**
 * Turns one fetched item into stored records. Implementations run each item in its own
 * transaction so a failing item never rolls back the ones before it.
 */
public interface SyncItemHandler {
    SyncDomain getDomain();

    ItemOutcome handle(SyncContext context, ExternalItem item);
}
