package crm.sync.app.entity;

public enum SyncStatus {
    ACTIVE,
    EXPIRED,
    ERROR
}
