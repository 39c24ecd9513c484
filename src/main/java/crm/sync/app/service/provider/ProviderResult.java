package crm.sync.app.service.provider;

import lombok.Getter;

import java.time.Duration;
import java.util.function.Function;

/**
 * Typed result of a provider call. Failures carry the HTTP status and a short message
 * that is safe to show to users; provider response bodies are never included.
 */
@Getter
public final class ProviderResult<T> {
    private final ProviderOutcome outcome;
    private final T value;
    private final int statusCode;
    private final String message;
    private final Duration retryAfter;

    private ProviderResult(ProviderOutcome outcome, T value, int statusCode, String message, Duration retryAfter) {
        this.outcome = outcome;
        this.value = value;
        this.statusCode = statusCode;
        this.message = message;
        this.retryAfter = retryAfter;
    }

    public static <T> ProviderResult<T> success(T value) {
        return new ProviderResult<>(ProviderOutcome.SUCCESS, value, 200, null, null);
    }

    public static <T> ProviderResult<T> failure(ProviderOutcome outcome, int statusCode, String message) {
        return failure(outcome, statusCode, message, null);
    }

    public static <T> ProviderResult<T> failure(ProviderOutcome outcome, int statusCode, String message, Duration retryAfter) {
        if (outcome == ProviderOutcome.SUCCESS) {
            throw new IllegalArgumentException("Use success() for successful results");
        }
        return new ProviderResult<>(outcome, null, statusCode, message, retryAfter);
    }

    /**
     * Maps an HTTP status to an outcome the same way for every provider.
     */
    public static <T> ProviderResult<T> fromStatus(int statusCode, String message, Duration retryAfter) {
        ProviderOutcome outcome;
        if (statusCode == 401) {
            outcome = ProviderOutcome.AUTH_FAILED;
        } else if (statusCode == 410) {
            outcome = ProviderOutcome.CURSOR_EXPIRED;
        } else if (statusCode == 429 || statusCode == 408 || statusCode >= 500) {
            outcome = ProviderOutcome.RETRYABLE;
        } else {
            outcome = ProviderOutcome.TERMINAL;
        }
        return failure(outcome, statusCode, message, retryAfter);
    }

    public static <T> ProviderResult<T> networkError(String message) {
        return failure(ProviderOutcome.RETRYABLE, 0, message);
    }

    /**
     * Parses a Retry-After header given in seconds. HTTP-date values are ignored.
     */
    public static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isSuccess() {
        return outcome == ProviderOutcome.SUCCESS;
    }

    /**
     * Re-types a failed result; calling this on a success is a programming error.
     */
    public <R> ProviderResult<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new ProviderResult<>(outcome, null, statusCode, message, retryAfter);
    }

    public <R> ProviderResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : propagate();
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProviderResult[SUCCESS]" : "ProviderResult[" + outcome + ", status=" + statusCode + ", " + message + "]";
    }
}
