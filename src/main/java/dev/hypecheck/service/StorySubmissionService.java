package dev.hypecheck.service;

import dev.hypecheck.exception.ContentNotFoundException;
import dev.hypecheck.exception.QueueShutdownException;
import dev.hypecheck.exception.SubmissionRejectedException;
import dev.hypecheck.metrics.EnhancementMetrics;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.JobHandle;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.queue.EnhancementApi;
import dev.hypecheck.ratelimit.SubmissionRateLimiter;
import dev.hypecheck.store.JpaStoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Synchronous submission path: score inline, persist the baseline, then ask
 * for enhancement. Enhancement problems never fail a submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorySubmissionService {

    private final HeuristicScorer heuristicScorer;
    private final JpaStoryStore storyStore;
    private final SubmissionRateLimiter submissionRateLimiter;
    private final EnhancementApi enhancementApi;
    private final EnhancementMetrics metrics;

    /**
     * Accept a new or edited story.
     *
     * @param content      the story
     * @param submitterKey identity the submission rate limit is counted against
     * @return baseline scores, plus the enhancement job if one was admitted
     */
    public SubmissionResult submit(ContentItem content, String submitterKey) {
        if (content == null || content.id() == null || content.id().isBlank()) {
            throw new IllegalArgumentException("content id must not be blank");
        }
        requireSubmitterKey(submitterKey);

        ScoreResult baseline = heuristicScorer.score(content.title(), content.body());
        storyStore.saveBaseline(content, baseline);
        log.info("Story {} scored inline: hype={} ({}), ethics={}, tags={}", content.id(),
                baseline.hypeScore(), HeuristicScorer.hypeLevel(baseline.hypeScore()),
                baseline.ethicsScore(), baseline.impactTags());

        if (!submissionRateLimiter.allow(submitterKey)) {
            metrics.recordSubmissionRejected();
            return new SubmissionResult(content.id(), baseline, null, SubmissionResult.Status.RATE_LIMITED);
        }

        try {
            JobHandle handle = enhancementApi.enqueue(content.id());
            SubmissionResult.Status status = handle.duplicate()
                    ? SubmissionResult.Status.ALREADY_QUEUED
                    : SubmissionResult.Status.QUEUED;
            return new SubmissionResult(content.id(), baseline, handle, status);
        } catch (QueueShutdownException e) {
            log.warn("Story {} saved without enhancement: {}", content.id(), e.getMessage());
            return new SubmissionResult(content.id(), baseline, null, SubmissionResult.Status.QUEUE_UNAVAILABLE);
        }
    }

    /**
     * Explicit re-score: recompute the baseline (replacing any enhanced
     * scores) and queue a fresh enhancement.
     *
     * @throws SubmissionRejectedException when the submitter is over the limit
     * @throws ContentNotFoundException    when the story does not exist
     */
    public JobHandle requestRescore(String contentId, String submitterKey) {
        requireSubmitterKey(submitterKey);
        if (!submissionRateLimiter.allow(submitterKey)) {
            metrics.recordSubmissionRejected();
            throw new SubmissionRejectedException(submitterKey);
        }

        ContentItem item = storyStore.fetch(contentId)
                .orElseThrow(() -> new ContentNotFoundException(contentId));
        ScoreResult baseline = heuristicScorer.score(item.title(), item.body());
        storyStore.saveBaseline(item, baseline);
        log.info("Re-score requested for {} by {}", contentId, submitterKey);
        return enhancementApi.enqueue(contentId);
    }

    private static void requireSubmitterKey(String submitterKey) {
        if (submitterKey == null || submitterKey.isBlank()) {
            throw new IllegalArgumentException("submitter key must not be blank");
        }
    }
}
