package dev.hypecheck.service;

import dev.hypecheck.call.RetryingCallClient;
import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.metrics.EnhancementMetrics;
import dev.hypecheck.model.QueueStats;
import dev.hypecheck.queue.EnhancementQueue;
import dev.hypecheck.ratelimit.SubmissionRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic housekeeping for the queue and the rate limiters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class QueueMaintenanceService {

    private final EnhancementQueue queue;
    private final EnhancementConfig config;
    private final SubmissionRateLimiter submissionRateLimiter;
    private final RetryingCallClient callClient;
    private final BackfillService backfillService;
    private final EnhancementMetrics metrics;

    @Scheduled(fixedDelayString = "${app.maintenance.stats-interval:PT30S}")
    public QueueStats logStats() {
        QueueStats stats = queue.stats();
        metrics.updateQueueStats(stats);
        if (stats.failed() > 0) {
            log.warn("Queue stats: {} (failed jobs need attention)", stats);
        } else {
            log.info("Queue stats: {}", stats);
        }
        return stats;
    }

    @Scheduled(fixedDelayString = "${app.maintenance.cleanup-interval:PT1H}",
            initialDelayString = "${app.maintenance.cleanup-interval:PT1H}")
    public int cleanup() {
        return queue.cleanup(config.getCompletedRetention(), config.getFailedRetention());
    }

    @Scheduled(fixedDelayString = "${app.maintenance.rate-window-purge-interval:PT5M}",
            initialDelayString = "${app.maintenance.rate-window-purge-interval:PT5M}")
    public int purgeRateWindows() {
        int purged = submissionRateLimiter.purgeExpired() + callClient.getRateLimiter().purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired rate-limit windows", purged);
        }
        return purged;
    }

    @Scheduled(fixedDelayString = "${app.maintenance.backfill-interval:PT10M}",
            initialDelayString = "${app.maintenance.backfill-interval:PT10M}")
    public int backfill() {
        return backfillService.enqueuePending();
    }
}
