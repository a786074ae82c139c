package dev.hypecheck.queue;

import dev.hypecheck.model.EnhancementJob;
import dev.hypecheck.model.JobHandle;
import dev.hypecheck.model.QueueStats;

import java.time.Duration;
import java.util.Optional;

/**
 * The surface the rest of the application uses to request and observe
 * enhancement work.
 */
public interface EnhancementApi {

    default JobHandle enqueue(String contentId) {
        return enqueue(contentId, 0, Duration.ZERO);
    }

    /**
     * Request enhancement of a story. Idempotent while a job for the same
     * story is queued or active: the existing job is returned.
     *
     * @param priority higher runs first
     * @param delay    time before the job becomes claimable
     */
    JobHandle enqueue(String contentId, int priority, Duration delay);

    QueueStats stats();

    Optional<EnhancementJob> getJob(String jobId);

    void pause();

    void resume();

    /**
     * Remove terminal jobs that finished more than {@code maxAge} ago.
     *
     * @return number of jobs removed
     */
    int cleanup(Duration maxAge);
}
