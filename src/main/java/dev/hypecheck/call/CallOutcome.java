package dev.hypecheck.call;

/**
 * Final outcome of a {@link RetryingCallClient#call} invocation.
 */
public enum CallOutcome {
    SUCCESS,
    /**
     * Non-retryable failure: 4xx other than 429, or a malformed response.
     */
    TERMINAL_ERROR,
    /**
     * Every attempt failed with a retryable error.
     */
    RETRIES_EXHAUSTED,
    /**
     * Call refused by the external-call rate limiter; nothing was sent.
     */
    RATE_LIMITED,
    /**
     * No scoring provider configured.
     */
    DISABLED
}
