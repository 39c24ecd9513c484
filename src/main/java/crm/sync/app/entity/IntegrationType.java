package crm.sync.app.entity;

import lombok.Getter;

import java.util.Arrays;

/**
 * The external systems a user can connect. Each type belongs to one sync domain
 * and one OAuth provider, and tags the interactions it produces with its external source.
 */
@Getter
public enum IntegrationType {
    GOOGLE_CALENDAR("calendar-google", "google_calendar", SyncDomain.CALENDAR, OAuthProvider.GOOGLE,
            "https://www.googleapis.com/auth/calendar.readonly openid email"),
    OUTLOOK_CALENDAR("calendar-outlook", "outlook_calendar", SyncDomain.CALENDAR, OAuthProvider.MICROSOFT,
            "offline_access Calendars.Read User.Read"),
    GMAIL("mail-gmail", "gmail", SyncDomain.EMAIL, OAuthProvider.GOOGLE,
            "https://www.googleapis.com/auth/gmail.readonly openid email"),
    OUTLOOK_MAIL("mail-outlook", "outlook_mail", SyncDomain.EMAIL, OAuthProvider.MICROSOFT,
            "offline_access Mail.Read User.Read");

    private final String slug;
    private final String externalSource;
    private final SyncDomain domain;
    private final OAuthProvider provider;
    private final String scopes;

    IntegrationType(String slug, String externalSource, SyncDomain domain, OAuthProvider provider, String scopes) {
        this.slug = slug;
        this.externalSource = externalSource;
        this.domain = domain;
        this.provider = provider;
        this.scopes = scopes;
    }

    /**
     * Resolves a path or query value such as {@code calendar-google} or {@code GOOGLE_CALENDAR}.
     */
    public static IntegrationType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.slug.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown integration type: " + value));
    }
}
