package crm.sync.app.entity;

public enum SyncDomain {
    CALENDAR,
    EMAIL
}
