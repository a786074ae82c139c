package dev.hypecheck.call;

import dev.hypecheck.ai.ScoringResponse;

import java.time.Duration;

/**
 * Result of a scoring call after retries. Failures are values, not exceptions.
 */
public record CallResult(
        CallOutcome outcome,
        ScoringResponse response,
        int attempts,
        String error,
        Duration elapsed) {

    public static CallResult success(ScoringResponse response, int attempts, Duration elapsed) {
        return new CallResult(CallOutcome.SUCCESS, response, attempts, null, elapsed);
    }

    public static CallResult failure(CallOutcome outcome, int attempts, String error, Duration elapsed) {
        return new CallResult(outcome, null, attempts, error, elapsed);
    }

    public static CallResult rateLimited(String scope) {
        return new CallResult(CallOutcome.RATE_LIMITED, null, 0,
                "Rate limit exceeded for scope " + scope, Duration.ZERO);
    }

    public static CallResult disabled() {
        return new CallResult(CallOutcome.DISABLED, null, 0, "Scoring provider not configured", Duration.ZERO);
    }

    public boolean isSuccess() {
        return outcome == CallOutcome.SUCCESS && response != null;
    }
}
