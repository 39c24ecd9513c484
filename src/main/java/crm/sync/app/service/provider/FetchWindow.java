package crm.sync.app.service.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

@Getter
@ToString
@AllArgsConstructor
public class FetchWindow {
    private final Instant timeMin;
    private final Instant timeMax;

    public static FetchWindow around(Instant now, int pastDays, int futureDays) {
        return new FetchWindow(now.minus(Duration.ofDays(pastDays)), now.plus(Duration.ofDays(futureDays)));
    }

    public static FetchWindow pastDays(Instant now, int days) {
        return new FetchWindow(now.minus(Duration.ofDays(days)), now);
    }
}
