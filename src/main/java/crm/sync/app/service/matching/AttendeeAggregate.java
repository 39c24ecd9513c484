package crm.sync.app.service.matching;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * One attendee collapsed across many events, keyed by lowercase email.
 */
@Getter
@Setter
@ToString
public class AttendeeAggregate {
    private final String email;
    private String displayName;
    private int meetingCount;
    private Instant firstMeetingDate;
    private Instant lastMeetingDate;
    private String existingContactId;

    public AttendeeAggregate(String email) {
        this.email = email;
    }

    void record(String name, Instant meetingDate) {
        meetingCount++;
        if ((displayName == null || displayName.isBlank()) && name != null && !name.isBlank()) {
            displayName = name.trim();
        }
        if (meetingDate != null) {
            if (firstMeetingDate == null || meetingDate.isBefore(firstMeetingDate)) {
                firstMeetingDate = meetingDate;
            }
            if (lastMeetingDate == null || meetingDate.isAfter(lastMeetingDate)) {
                lastMeetingDate = meetingDate;
            }
        }
    }

    public boolean isExistingContact() {
        return existingContactId != null;
    }
}
