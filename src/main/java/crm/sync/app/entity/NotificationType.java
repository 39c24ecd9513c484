package crm.sync.app.entity;

public enum NotificationType {
    SYNC_COMPLETE,
    SYNC_FAILED
}
