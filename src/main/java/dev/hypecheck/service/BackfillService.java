package dev.hypecheck.service;

import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.exception.QueueShutdownException;
import dev.hypecheck.model.EnhancementJob;
import dev.hypecheck.queue.EnhancementApi;
import dev.hypecheck.store.JpaStoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Re-queues stories that still hold heuristic scores only. Recovers work lost
 * when the worker restarts, and retries degraded stories once their previous
 * job has been cleaned up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillService {

    private final JpaStoryStore storyStore;
    private final EnhancementApi enhancementApi;
    private final ScoringClient scoringClient;
    private final EnhancementConfig config;

    /**
     * @return number of jobs queued
     */
    public int enqueuePending() {
        EnhancementConfig.Backfill backfill = config.getBackfill();
        if (!backfill.isEnabled() || !scoringClient.isEnabled()) {
            return 0;
        }

        List<String> ids = storyStore.findIdsAwaitingEnhancement(backfill.getBatchSize());
        int queued = 0;
        for (String contentId : ids) {
            // any retained job, finished or not, means this story was tried recently
            if (enhancementApi.getJob(EnhancementJob.jobIdFor(contentId)).isPresent()) {
                continue;
            }
            try {
                enhancementApi.enqueue(contentId, backfill.getPriority(), Duration.ZERO);
                queued++;
            } catch (QueueShutdownException e) {
                log.warn("Backfill stopped: {}", e.getMessage());
                break;
            }
        }

        if (queued > 0) {
            log.info("Backfill queued {} stories awaiting enhancement", queued);
        }
        return queued;
    }
}
