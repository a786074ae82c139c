package dev.hypecheck.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of an enhancement job. Every state transition produces a new
 * instance; the queue swaps snapshots atomically in its job map.
 */
@Builder(toBuilder = true)
public record EnhancementJob(
        String jobId,
        String contentId,
        int priority,
        Instant enqueuedAt,
        Instant availableAt,
        int attempt,
        JobState state,
        Instant startedAt,
        Instant finishedAt,
        ScoreResult result,
        String error) {

    private static final String JOB_ID_PREFIX = "enhance:";

    /**
     * Deterministic job id for a content item. Two submissions for the same
     * content always collide on this key.
     */
    public static String jobIdFor(String contentId) {
        return JOB_ID_PREFIX + contentId;
    }

    public boolean isOutstanding() {
        return state == JobState.QUEUED || state == JobState.ACTIVE;
    }

    public boolean isDelayed(Instant now) {
        return state == JobState.QUEUED && availableAt != null && availableAt.isAfter(now);
    }

    public Duration processingTime() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
