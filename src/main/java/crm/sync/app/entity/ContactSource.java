package crm.sync.app.entity;

public enum ContactSource {
    MANUAL,
    CALENDAR_SYNC,
    CALENDAR_IMPORT,
    EMAIL_SYNC
}
