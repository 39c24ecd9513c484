package crm.sync.app.service.sync;

public enum ItemOutcome {
    ADDED,
    UPDATED,
    SKIPPED
}
