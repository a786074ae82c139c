package dev.hypecheck.model;

/**
 * Returned by enqueue. {@code duplicate} is true when the call collapsed onto a
 * job that was already queued or running.
 */
public record JobHandle(String jobId, String contentId, JobState state, boolean duplicate) {

    public static JobHandle created(EnhancementJob job) {
        return new JobHandle(job.jobId(), job.contentId(), job.state(), false);
    }

    public static JobHandle existing(EnhancementJob job) {
        return new JobHandle(job.jobId(), job.contentId(), job.state(), true);
    }
}
