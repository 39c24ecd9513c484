package crm.sync.app.dto;

import crm.sync.app.entity.Interaction;
import crm.sync.app.entity.InteractionParticipant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored meeting as returned to the request layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingView {
    private String id;
    private String externalId;
    private String externalSource;
    private String title;
    private String description;
    private String location;
    private String meetingUrl;
    private Instant startTime;
    private Instant endTime;
    private boolean allDay;
    private String notes;
    private List<Attendee> attendees;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attendee {
        private String email;
        private String name;
        private String role;
        private String responseStatus;
        private String contactId;
    }

    public static MeetingView from(Interaction interaction) {
        List<Attendee> attendees = new ArrayList<>();
        for (InteractionParticipant participant : interaction.getParticipants()) {
            attendees.add(new Attendee(participant.getEmail(), participant.getDisplayName(),
                    participant.getRole() != null ? participant.getRole().name() : null,
                    participant.getResponseStatus(), participant.getContactId()));
        }
        return MeetingView.builder()
                .id(interaction.getId())
                .externalId(interaction.getExternalId())
                .externalSource(interaction.getExternalSource())
                .title(interaction.getSubject())
                .description(interaction.getBody())
                .location(interaction.getLocation())
                .meetingUrl(interaction.getMeetingUrl())
                .startTime(interaction.getOccurredAt())
                .endTime(interaction.getEndsAt())
                .allDay(interaction.isAllDay())
                .notes(interaction.getNotes())
                .attendees(attendees)
                .build();
    }
}
