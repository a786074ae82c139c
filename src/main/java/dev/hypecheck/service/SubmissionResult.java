package dev.hypecheck.service;

import dev.hypecheck.model.JobHandle;
import dev.hypecheck.model.ScoreResult;

/**
 * What the submitter gets back immediately: the heuristic baseline, always,
 * and the enhancement job when one was queued.
 */
public record SubmissionResult(String contentId, ScoreResult baseline, JobHandle job, Status status) {

    public enum Status {
        /**
         * A new enhancement job was queued.
         */
        QUEUED,
        /**
         * An enhancement job for this story was already queued or running.
         */
        ALREADY_QUEUED,
        /**
         * Submission rate limit reached; no job created.
         */
        RATE_LIMITED,
        /**
         * Queue is shutting down; no job created.
         */
        QUEUE_UNAVAILABLE
    }

    public boolean isEnhancementPending() {
        return status == Status.QUEUED || status == Status.ALREADY_QUEUED;
    }
}
