package crm.sync.app.service.sync;

import crm.sync.app.service.provider.ProviderOutcome;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts and cursors of one sync run. {@code message} is safe to show to the user.
 */
@Getter
@Setter
@ToString
public class SyncResult {
    private int synced;
    private int added;
    private int updated;
    private int skipped;
    private Map<String, String> cursors = new LinkedHashMap<>();
    private Instant syncedAt;
    private ProviderOutcome outcome = ProviderOutcome.SUCCESS;
    private String message;
    private Duration retryAfter;

    public static SyncResult failure(ProviderOutcome outcome, String message, Duration retryAfter) {
        SyncResult result = new SyncResult();
        result.setOutcome(outcome);
        result.setMessage(message);
        result.setRetryAfter(retryAfter);
        return result;
    }

    public boolean isSuccess() {
        return outcome == ProviderOutcome.SUCCESS;
    }

    void record(ItemOutcome itemOutcome) {
        switch (itemOutcome) {
            case ADDED:
                added++;
                synced++;
                break;
            case UPDATED:
                updated++;
                synced++;
                break;
            default:
                skipped++;
                break;
        }
    }

    void fail(ProviderOutcome failureOutcome, String failureMessage, Duration failureRetryAfter) {
        this.outcome = failureOutcome;
        this.message = failureMessage;
        this.retryAfter = failureRetryAfter;
    }
}
