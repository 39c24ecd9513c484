package crm.sync.app.service.sync;

import crm.sync.app.entity.Integration;
import crm.sync.app.entity.IntegrationType;
import crm.sync.app.entity.SyncDomain;
import crm.sync.app.entity.SyncMode;
import crm.sync.app.entity.SyncPhase;
import crm.sync.app.entity.SyncState;
import crm.sync.app.exception.OAuthClientRejectedException;
import crm.sync.app.exception.ReconnectRequiredException;
import crm.sync.app.exception.TokenVaultException;
import crm.sync.app.repository.IntegrationRepository;
import crm.sync.app.repository.SyncStateRepository;
import crm.sync.app.service.provider.ExternalItem;
import crm.sync.app.service.provider.FetchWindow;
import crm.sync.app.service.provider.ProviderClient;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.provider.ProviderPage;
import crm.sync.app.service.provider.ProviderRegistry;
import crm.sync.app.service.provider.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drives fetch, transform and persist for one user and one integration.
 *
 * <p>Incremental runs hand the stored cursor of each source to the provider. When the provider
 * reports the cursor as expired, the cursor is dropped and the source falls back to a full sync
 * over the look-back window; the cursor returned by the last page of that full sync is stored.
 * Failed items are counted as skipped and never abort the run.
 *
 * <p>The state read at the start is never written back as a whole. Only cursors and
 * {@code lastSyncAt} are applied to a fresh copy at the end, and only if the user did not
 * change the settings while the run was in flight.
 */
@Slf4j
@Service
public class SyncOrchestrator {
    static final int PROCESS_BATCH_SIZE = 100;
    static final int FETCH_PROGRESS_SHARE = 25;
    private static final int PROGRESS_PER_PAGE = 5;

    private final IntegrationRepository integrationRepository;
    private final SyncStateRepository syncStateRepository;
    private final ProviderRegistry providerRegistry;
    private final ProviderCallTemplate providerCallTemplate;
    private final Map<SyncDomain, SyncItemHandler> handlers = new EnumMap<>(SyncDomain.class);

    @Value("${crm.sync.calendar.default-lookback-days:30}")
    private int calendarLookbackDays;

    @Value("${crm.sync.calendar.future-days:90}")
    private int calendarFutureDays;

    @Value("${crm.sync.email.default-lookback-days:30}")
    private int emailLookbackDays;

    public SyncOrchestrator(IntegrationRepository integrationRepository,
                            SyncStateRepository syncStateRepository,
                            ProviderRegistry providerRegistry,
                            ProviderCallTemplate providerCallTemplate,
                            List<SyncItemHandler> itemHandlers) {
        this.integrationRepository = integrationRepository;
        this.syncStateRepository = syncStateRepository;
        this.providerRegistry = providerRegistry;
        this.providerCallTemplate = providerCallTemplate;
        for (SyncItemHandler handler : itemHandlers) {
            handlers.put(handler.getDomain(), handler);
        }
    }

    public SyncResult sync(String userId, IntegrationType type, SyncMode mode, ProgressListener progressListener) {
        ProgressListener listener = progressListener != null ? progressListener : ProgressListener.NONE;
        Integration integration = integrationRepository.findActiveByUserIdAndType(userId, type).orElse(null);
        if (integration == null) {
            log.info("Skipping {} sync for user {}: integration is not connected", type, userId);
            return SyncResult.failure(ProviderOutcome.TERMINAL, "The " + type.getSlug() + " integration is not connected.", null);
        }

        SyncState state = syncStateRepository.findByUserIdAndIntegrationType(userId, type)
                .orElseGet(() -> newState(userId, type));
        if (!state.isSyncEnabled()) {
            log.info("Skipping {} sync for user {}: sync is disabled", type, userId);
            SyncResult disabled = new SyncResult();
            disabled.setMessage("Sync is disabled.");
            return disabled;
        }

        ProviderClient client = providerRegistry.get(type);
        SyncItemHandler handler = handlers.get(type.getDomain());
        if (handler == null) {
            throw new IllegalStateException("No item handler registered for " + type.getDomain());
        }

        Instant now = Instant.now();
        SettingsSnapshot snapshot = SettingsSnapshot.of(state);
        Map<String, String> cursorUpdates = new HashMap<>();
        SyncContext context = new SyncContext(userId, type, selfEmails(integration), state, now);
        FetchWindow window = windowFor(type, state, now);
        List<String> sources = state.sourcesOrDefault(client.defaultSourceId());

        log.info("Starting {} {} sync for user {} over {} source(s)", mode, type, userId, sources.size());
        SyncResult result = new SyncResult();
        try {
            for (int i = 0; i < sources.size(); i++) {
                String sourceId = sources.get(i);
                SourceProgress progress = new SourceProgress(listener, i, sources.size());

                ProviderResult<FetchedItems> fetched = fetchSource(integration, client, state, sourceId, mode, window,
                        progress, cursorUpdates);
                if (!fetched.isSuccess()) {
                    result.fail(fetched.getOutcome(), fetched.getMessage(), fetched.getRetryAfter());
                    break;
                }

                processItems(context, handler, fetched.getValue().items, result, progress);
                cursorUpdates.put(sourceId, fetched.getValue().cursor);
                if (fetched.getValue().cursor != null) {
                    result.getCursors().put(sourceId, fetched.getValue().cursor);
                }
            }
        } catch (ReconnectRequiredException e) {
            log.warn("{} sync for user {} needs the account to be reconnected", type, userId);
            result.fail(ProviderOutcome.AUTH_FAILED, "Please reconnect your " + type.getSlug() + " account.", null);
        } catch (OAuthClientRejectedException e) {
            log.error("{} sync for user {} stopped: {}", type, userId, e.getMessage());
            result.fail(ProviderOutcome.TERMINAL, "Sync with " + type.getSlug() + " is unavailable right now.", null);
        } catch (TokenVaultException e) {
            log.error("{} sync for user {} could not read stored credentials: {}", type, userId, e.getMessage());
            result.fail(ProviderOutcome.TERMINAL, "Stored credentials could not be read. Please reconnect your account.", null);
        } catch (IllegalStateException e) {
            // Token endpoint trouble other than a revoked grant
            log.error("{} sync for user {} failed: {}", type, userId, e.getMessage());
            result.fail(ProviderOutcome.RETRYABLE, "Could not refresh access to your account.", null);
        }

        if (result.isSuccess()) {
            result.setSyncedAt(now);
            listener.onProgress(100);
        }
        storeRunState(state, snapshot, cursorUpdates, result.isSuccess() ? now : null);

        if (result.isSuccess()) {
            log.info("{} sync for user {} completed: {} synced ({} added, {} updated), {} skipped",
                    type, userId, result.getSynced(), result.getAdded(), result.getUpdated(), result.getSkipped());
        } else {
            log.warn("{} sync for user {} ended with {}: {}", type, userId, result.getOutcome(), result.getMessage());
        }
        return result;
    }

    private ProviderResult<FetchedItems> fetchSource(Integration integration, ProviderClient client, SyncState state,
                                                     String sourceId, SyncMode mode, FetchWindow window,
                                                     SourceProgress progress, Map<String, String> cursorUpdates) {
        String cursor = mode == SyncMode.FULL ? null : state.getCursor(sourceId);
        if (cursor != null) {
            ProviderResult<FetchedItems> incremental = fetchAllPages(integration, progress,
                    (token, pageToken) -> client.fetchIncremental(token, sourceId, cursor, pageToken));
            if (incremental.getOutcome() != ProviderOutcome.CURSOR_EXPIRED) {
                return incremental;
            }
            log.warn("Cursor for {} source {} of user {} expired, entering {}",
                    integration.getType(), sourceId, integration.getUserId(), SyncPhase.FULL_SYNC_FALLBACK);
            cursorUpdates.put(sourceId, null);
        }
        return fetchAllPages(integration, progress,
                (token, pageToken) -> client.fetchFull(token, sourceId, window, pageToken));
    }

    private ProviderResult<FetchedItems> fetchAllPages(Integration integration, SourceProgress progress, PageFetcher fetcher) {
        List<ExternalItem> items = new ArrayList<>();
        String pageToken = null;
        String cursor = null;
        int pages = 0;
        do {
            String currentPage = pageToken;
            ProviderResult<ProviderPage> result = providerCallTemplate.execute(integration,
                    token -> fetcher.fetch(token, currentPage));
            if (!result.isSuccess()) {
                return result.propagate();
            }
            ProviderPage page = result.getValue();
            items.addAll(page.getItems());
            if (page.getNextCursor() != null) {
                cursor = page.getNextCursor();
            }
            pageToken = page.hasMore() ? page.getNextPageToken() : null;
            pages++;
            progress.report(Math.min(FETCH_PROGRESS_SHARE - 1, pages * PROGRESS_PER_PAGE));
        } while (pageToken != null);
        progress.report(FETCH_PROGRESS_SHARE);
        return ProviderResult.success(new FetchedItems(items, cursor));
    }

    private void processItems(SyncContext context, SyncItemHandler handler, List<ExternalItem> items,
                              SyncResult result, SourceProgress progress) {
        for (int start = 0; start < items.size(); start += PROCESS_BATCH_SIZE) {
            int end = Math.min(start + PROCESS_BATCH_SIZE, items.size());
            for (ExternalItem item : items.subList(start, end)) {
                try {
                    result.record(handler.handle(context, item));
                } catch (Exception e) {
                    log.error("Failed to store {} item for user {}: {}", context.getType(), context.getUserId(), e.getMessage(), e);
                    result.record(ItemOutcome.SKIPPED);
                    // Continue with next item
                }
            }
            progress.report(FETCH_PROGRESS_SHARE + (100 - FETCH_PROGRESS_SHARE) * end / items.size());
        }
    }

    /**
     * Applies the run's cursors and {@code lastSyncAt} to the stored row. A settings change made
     * during the run (disabled, other sources, another window, cleared cursors) wins and the
     * run's cursors are dropped, so the next run starts from what the user configured.
     */
    void storeRunState(SyncState started, SettingsSnapshot snapshot, Map<String, String> cursorUpdates, Instant syncedAt) {
        SyncState current = syncStateRepository
                .findByUserIdAndIntegrationType(started.getUserId(), started.getIntegrationType())
                .orElse(null);
        if (current == null) {
            if (started.getId() != null) {
                log.info("{} sync state for user {} was removed during the run, not storing cursors",
                        started.getIntegrationType(), started.getUserId());
                return;
            }
            current = started;
        } else if (!snapshot.matches(current)) {
            log.info("{} sync settings for user {} changed during the run, discarding its cursors",
                    started.getIntegrationType(), started.getUserId());
            return;
        }

        for (Map.Entry<String, String> update : cursorUpdates.entrySet()) {
            current.putCursor(update.getKey(), update.getValue());
        }
        if (syncedAt != null) {
            current.setLastSyncAt(syncedAt);
        }
        current.setUpdatedAt(Instant.now());
        try {
            syncStateRepository.save(current);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("{} sync settings for user {} changed while storing cursors, discarding them",
                    started.getIntegrationType(), started.getUserId());
        }
    }

    FetchWindow windowFor(IntegrationType type, SyncState state, Instant now) {
        if (type.getDomain() == SyncDomain.CALENDAR) {
            int lookback = state.getLookbackDays() > 0 ? state.getLookbackDays() : calendarLookbackDays;
            return FetchWindow.around(now, lookback, calendarFutureDays);
        }
        int lookback = state.getLookbackDays() > 0 ? state.getLookbackDays() : emailLookbackDays;
        return FetchWindow.pastDays(now, lookback);
    }

    private SyncState newState(String userId, IntegrationType type) {
        SyncState state = new SyncState();
        state.setUserId(userId);
        state.setIntegrationType(type);
        state.setLookbackDays(type.getDomain() == SyncDomain.CALENDAR ? calendarLookbackDays : emailLookbackDays);
        return state;
    }

    private static Set<String> selfEmails(Integration integration) {
        Set<String> self = new HashSet<>();
        if (integration.getAccountEmail() != null) {
            self.add(integration.getAccountEmail().toLowerCase(Locale.ROOT));
        }
        if (integration.getUser() != null && integration.getUser().getEmail() != null) {
            self.add(integration.getUser().getEmail().toLowerCase(Locale.ROOT));
        }
        return self;
    }

    // The settings a run's cursors depend on
    static final class SettingsSnapshot {
        private final boolean enabled;
        private final int lookbackDays;
        private final Set<String> sources;
        private final Map<String, String> cursors;

        private SettingsSnapshot(SyncState state) {
            this.enabled = state.isSyncEnabled();
            this.lookbackDays = state.getLookbackDays();
            this.sources = new LinkedHashSet<>(state.getSelectedSourceIds());
            this.cursors = new HashMap<>(state.getCursors());
        }

        static SettingsSnapshot of(SyncState state) {
            return new SettingsSnapshot(state);
        }

        boolean matches(SyncState state) {
            return state.isSyncEnabled() == enabled
                    && state.getLookbackDays() == lookbackDays
                    && sources.equals(state.getSelectedSourceIds())
                    && cursors.equals(state.getCursors());
        }
    }

    @FunctionalInterface
    private interface PageFetcher {
        ProviderResult<ProviderPage> fetch(String accessToken, String pageToken);
    }

    private static final class FetchedItems {
        private final List<ExternalItem> items;
        private final String cursor;

        private FetchedItems(List<ExternalItem> items, String cursor) {
            this.items = items;
            this.cursor = cursor;
        }
    }

    // Spreads per-source percentages evenly over the whole run
    private static final class SourceProgress {
        private final ProgressListener listener;
        private final int index;
        private final int count;

        private SourceProgress(ProgressListener listener, int index, int count) {
            this.listener = listener;
            this.index = index;
            this.count = count;
        }

        void report(int percentOfSource) {
            listener.onProgress((index * 100 + percentOfSource) / count);
        }
    }
}
