package crm.sync.app.service.provider;

import crm.sync.app.entity.IntegrationType;

/**
 * Uniform fetch contract implemented once per external system.
 * Implementations never throw for provider failures; they return a {@link ProviderResult}.
 */
public interface ProviderClient {

    IntegrationType getType();

    /**
     * Source used when the user has not selected any (the primary calendar, the inbox).
     */
    String defaultSourceId();

    /**
     * Lists items in a time window. The last page carries a cursor for later incremental calls,
     * when the provider issues one.
     * @param pageToken continuation token from the previous page, or null for the first page
     */
    ProviderResult<ProviderPage> fetchFull(String accessToken, String sourceId, FetchWindow window, String pageToken);

    /**
     * Lists items changed since {@code cursor}. A stale cursor yields {@link ProviderOutcome#CURSOR_EXPIRED}.
     */
    ProviderResult<ProviderPage> fetchIncremental(String accessToken, String sourceId, String cursor, String pageToken);

    ProviderResult<ExternalItem> fetchById(String accessToken, String sourceId, String itemId);
}
