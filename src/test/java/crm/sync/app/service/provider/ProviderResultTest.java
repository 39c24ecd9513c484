package crm.sync.app.service.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderResultTest {

    @Test
    void fromStatus_ShouldClassifyStatusesTheSameForEveryProvider() {
        assertEquals(ProviderOutcome.AUTH_FAILED, ProviderResult.fromStatus(401, "x", null).getOutcome());
        assertEquals(ProviderOutcome.CURSOR_EXPIRED, ProviderResult.fromStatus(410, "x", null).getOutcome());
        assertEquals(ProviderOutcome.RETRYABLE, ProviderResult.fromStatus(429, "x", null).getOutcome());
        assertEquals(ProviderOutcome.RETRYABLE, ProviderResult.fromStatus(408, "x", null).getOutcome());
        assertEquals(ProviderOutcome.RETRYABLE, ProviderResult.fromStatus(502, "x", null).getOutcome());
        assertEquals(ProviderOutcome.TERMINAL, ProviderResult.fromStatus(400, "x", null).getOutcome());
        assertEquals(ProviderOutcome.TERMINAL, ProviderResult.fromStatus(404, "x", null).getOutcome());
    }

    @Test
    void parseRetryAfter_ShouldAcceptSecondsOnly() {
        assertEquals(Duration.ofSeconds(60), ProviderResult.parseRetryAfter(" 60 "));
        assertNull(ProviderResult.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(ProviderResult.parseRetryAfter("0"));
        assertNull(ProviderResult.parseRetryAfter(null));
    }

    @Test
    void map_OnFailure_ShouldKeepOutcomeAndStatus() {
        // Given
        ProviderResult<String> failed = ProviderResult.fromStatus(503, "Busy", Duration.ofSeconds(5));

        // When
        ProviderResult<Integer> mapped = failed.map(String::length);

        // Then
        assertFalse(mapped.isSuccess());
        assertEquals(503, mapped.getStatusCode());
        assertEquals(Duration.ofSeconds(5), mapped.getRetryAfter());
    }

    @Test
    void failure_WithSuccessOutcome_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ProviderResult.failure(ProviderOutcome.SUCCESS, 200, "ok"));
    }
}
