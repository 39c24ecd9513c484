package crm.sync.app.exception;

import crm.sync.app.entity.IntegrationType;
import lombok.Getter;

/**
 * The stored grant can no longer produce an access token; the user has to connect again.
 */
@Getter
public class ReconnectRequiredException extends RuntimeException {
    private final IntegrationType integrationType;

    public ReconnectRequiredException(IntegrationType integrationType, String message) {
        super(message);
        this.integrationType = integrationType;
    }
}
