package crm.sync.app.entity;

public enum SyncJobStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED
}
