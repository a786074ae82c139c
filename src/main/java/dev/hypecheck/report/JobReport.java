package dev.hypecheck.report;

import dev.hypecheck.model.EnhancementJob;
import dev.hypecheck.model.JobState;

import java.time.Duration;

/**
 * A job reaching a terminal state.
 */
public record JobReport(
        String jobId,
        String contentId,
        JobState state,
        boolean enhanced,
        int attempt,
        Duration processingTime,
        String error) {

    public static JobReport of(EnhancementJob job) {
        boolean enhanced = job.result() != null && job.result().enhanced();
        return new JobReport(job.jobId(), job.contentId(), job.state(), enhanced,
                job.attempt(), job.processingTime(), job.error());
    }
}
