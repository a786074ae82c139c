package dev.hypecheck.report;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * One external scoring attempt, successful or not.
 */
@Builder
public record CallReport(
        String operation,
        String scope,
        String contentId,
        String model,
        int attemptIndex,
        Duration duration,
        int inputTokens,
        int outputTokens,
        BigDecimal estimatedCostUsd,
        Outcome outcome,
        String error) {

    public CallReport {
        duration = duration == null ? Duration.ZERO : duration;
        estimatedCostUsd = estimatedCostUsd == null ? BigDecimal.ZERO : estimatedCostUsd;
    }

    public enum Outcome {
        SUCCESS,
        RETRYABLE_FAILURE,
        TERMINAL_FAILURE,
        RATE_LIMITED
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
