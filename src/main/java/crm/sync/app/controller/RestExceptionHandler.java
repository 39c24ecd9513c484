package crm.sync.app.controller;

import crm.sync.app.dto.ErrorResponse;
import crm.sync.app.exception.IntegrationNotFoundException;
import crm.sync.app.exception.InteractionNotFoundException;
import crm.sync.app.exception.InvalidOAuthStateException;
import crm.sync.app.exception.OAuthClientRejectedException;
import crm.sync.app.exception.ProviderRequestException;
import crm.sync.app.exception.ReconnectRequiredException;
import crm.sync.app.exception.TokenVaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses. Messages of these exceptions are written to be
 * shown to users; vault and unexpected failures get a generic message instead.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(ReconnectRequiredException.class)
    public ResponseEntity<ErrorResponse> handleReconnectRequired(ReconnectRequiredException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("reconnect_required", e.getMessage()));
    }

    @ExceptionHandler(InvalidOAuthStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidOAuthStateException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("invalid_state", e.getMessage()));
    }

    @ExceptionHandler({IntegrationNotFoundException.class, InteractionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("not_found", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", e.getMessage()));
    }

    @ExceptionHandler(ProviderRequestException.class)
    public ResponseEntity<ErrorResponse> handleProviderFailure(ProviderRequestException e) {
        log.warn("Provider request failed with {} ({})", e.getOutcome(), e.getStatusCode());
        switch (e.getOutcome()) {
            case AUTH_FAILED:
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("reconnect_required", e.getMessage()));
            case RETRYABLE:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse("provider_unavailable", e.getMessage()));
            default:
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse("provider_error", e.getMessage()));
        }
    }

    @ExceptionHandler(TokenVaultException.class)
    public ResponseEntity<ErrorResponse> handleVault(TokenVaultException e) {
        log.error("Token vault failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("server_error", "The server is not configured to store credentials."));
    }

    @ExceptionHandler(OAuthClientRejectedException.class)
    public ResponseEntity<ErrorResponse> handleClientRejected(OAuthClientRejectedException e) {
        log.error("OAuth client misconfigured: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("provider_unavailable", "Access to " + e.getProvider().getKey() + " is unavailable right now."));
    }
}
