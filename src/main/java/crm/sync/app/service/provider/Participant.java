package crm.sync.app.service.provider;

import crm.sync.app.entity.ParticipantRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Set;

/**
 * An attendee, sender or recipient as reported by the provider, before contact resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Participant {
    public static final String ACCEPTED = "accepted";
    public static final String TENTATIVE = "tentative";
    public static final String DECLINED = "declined";
    public static final String NEEDS_ACTION = "needsAction";

    private static final Set<String> MATERIAL_STATUSES = Set.of(ACCEPTED, TENTATIVE);

    private String email;
    private String displayName;
    private boolean organizer;
    // Calendar attendees only; null for mail participants
    private String responseStatus;
    private ParticipantRole role;

    public String normalizedEmail() {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    public boolean hasEmail() {
        return normalizedEmail() != null;
    }

    /**
     * A calendar attendee counts for contact matching and import only when it is not the
     * organizer and has accepted or tentatively accepted. A missing status does not count.
     */
    public boolean isMaterialAttendee() {
        return !organizer && hasEmail() && responseStatus != null && MATERIAL_STATUSES.contains(responseStatus);
    }
}
