package crm.sync.app.service.provider;

import java.util.List;

public interface CalendarProviderClient extends ProviderClient {
    /**
     * Calendars the user can read, primary first, then by name.
     */
    ProviderResult<List<CalendarInfo>> listCalendars(String accessToken);
}
