package crm.sync.app.entity;

/**
 * Lifecycle of a sync state. FULL_SYNC_FALLBACK only lasts for the run that found its cursor stale.
 */
public enum SyncPhase {
    DISABLED,
    FIRST_SYNC,
    INCREMENTAL,
    FULL_SYNC_FALLBACK
}
