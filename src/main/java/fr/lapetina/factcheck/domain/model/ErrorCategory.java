package fr.lapetina.factcheck.domain.model;

/**
 * Closed set of failure categories used to pick a recovery strategy.
 * Declaration order is the classification priority.
 */
public enum ErrorCategory {
    /** HTTP 429 or quota / rate-limit phrasing */
    RATE_LIMIT,

    /** HTTP 401/403 or invalid-key phrasing */
    AUTH_ERROR,

    /** HTTP 5xx, network or timeout failure */
    TEMPORARY,

    /** Provider refused the content */
    CONTENT_POLICY,

    /** Prompt exceeded the model context or token limit */
    CONTEXT_LENGTH,

    /** Anything else */
    UNKNOWN
}
