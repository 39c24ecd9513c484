package crm.sync.app.entity;

public enum InteractionType {
    MEETING,
    EMAIL
}
