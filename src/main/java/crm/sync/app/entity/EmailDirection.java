package crm.sync.app.entity;

public enum EmailDirection {
    INBOUND,
    OUTBOUND
}
