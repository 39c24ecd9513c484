package crm.sync.app.exception;

import crm.sync.app.service.provider.ProviderOutcome;
import lombok.Getter;

/**
 * A provider call made on behalf of an interactive request (preview, calendar list) failed.
 * Background sync never throws this; it carries the typed result instead.
 */
@Getter
public class ProviderRequestException extends RuntimeException {
    private final ProviderOutcome outcome;
    private final int statusCode;

    public ProviderRequestException(ProviderOutcome outcome, int statusCode, String message) {
        super(message);
        this.outcome = outcome;
        this.statusCode = statusCode;
    }
}
