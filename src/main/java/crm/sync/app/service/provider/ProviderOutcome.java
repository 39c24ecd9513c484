package crm.sync.app.service.provider;

/**
 * How a provider call ended. Drives fallback in the orchestrator and retry in the job layer.
 */
public enum ProviderOutcome {
    SUCCESS,
    /** 429, 5xx, timeouts and I/O failures. */
    RETRYABLE,
    /** The incremental cursor is stale; a full sync is needed. */
    CURSOR_EXPIRED,
    /** The access token was rejected. */
    AUTH_FAILED,
    /** Anything that will not succeed by retrying. */
    TERMINAL
}
