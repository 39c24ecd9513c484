package crm.sync.app.entity;

public enum ParticipantRole {
    ORGANIZER,
    ATTENDEE,
    FROM,
    TO,
    CC
}
