package crm.sync.app.service.sync;

import crm.sync.app.entity.Integration;
import crm.sync.app.exception.ProviderRequestException;
import crm.sync.app.service.provider.ProviderOutcome;
import crm.sync.app.service.provider.ProviderResult;
import crm.sync.app.service.token.TokenRefreshService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Runs a provider call with a valid access token. A 401 triggers one forced refresh and
 * one retry of the same call; the second result is returned as is.
 */
@Slf4j
@Component
public class ProviderCallTemplate {
    private final TokenRefreshService tokenRefreshService;

    public ProviderCallTemplate(TokenRefreshService tokenRefreshService) {
        this.tokenRefreshService = tokenRefreshService;
    }

    public <T> ProviderResult<T> execute(Integration integration, Function<String, ProviderResult<T>> call) {
        String accessToken = tokenRefreshService.ensureValidAccessToken(integration);
        ProviderResult<T> result = call.apply(accessToken);
        if (result.getOutcome() != ProviderOutcome.AUTH_FAILED) {
            return result;
        }
        log.info("Provider rejected the access token for integration {}, refreshing and retrying once", integration.getId());
        String refreshed = tokenRefreshService.refreshTokenOn401(integration);
        return call.apply(refreshed);
    }

    /**
     * Same as {@link #execute} but unwraps the value, throwing for any failure.
     */
    public <T> T executeOrThrow(Integration integration, Function<String, ProviderResult<T>> call) {
        ProviderResult<T> result = execute(integration, call);
        if (!result.isSuccess()) {
            throw new ProviderRequestException(result.getOutcome(), result.getStatusCode(), result.getMessage());
        }
        return result.getValue();
    }
}
