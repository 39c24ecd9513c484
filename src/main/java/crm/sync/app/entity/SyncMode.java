package crm.sync.app.entity;

public enum SyncMode {
    INCREMENTAL,
    FULL
}
