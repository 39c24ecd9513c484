package crm.sync.app.service;

public enum EventRange {
    UPCOMING,
    PAST
}
