package crm.sync.app.service.provider;

import crm.sync.app.entity.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A calendar event or mail message in provider-neutral shape. Transient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalItem {
    private String externalId;
    private String sourceId;
    private InteractionType type;
    private String subject;
    private String body;
    private String snippet;
    private Instant startsAt;
    private Instant endsAt;
    private boolean allDay;
    private String location;
    private String meetingUrl;
    private String threadId;
    private String organizerEmail;

    @Builder.Default
    private List<Participant> participants = new ArrayList<>();

    public boolean isPast(Instant now) {
        return startsAt != null && startsAt.isBefore(now);
    }
}
