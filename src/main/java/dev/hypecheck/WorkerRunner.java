package dev.hypecheck;

import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.service.BackfillService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs the worker configuration on startup and re-queues stories left
 * unenhanced by a previous run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerRunner implements ApplicationRunner {

    private static final String SEPARATOR = "========================================";

    private final EnhancementConfig config;
    private final ScoringClient scoringClient;
    private final BackfillService backfillService;

    @Override
    public void run(ApplicationArguments args) {
        log.info(SEPARATOR);
        log.info("HypeCheck Enhancement Worker Starting");
        log.info("Concurrency: {}, max retries: {}, attempt timeout: {}",
                config.getConcurrency(), config.getMaxRetries(), config.getAttemptTimeout());
        log.info("External scoring: {}", scoringClient.isEnabled()
                ? "enabled (" + scoringClient.model() + ")"
                : "disabled, heuristic scores only");
        log.info(SEPARATOR);

        try {
            int recovered = backfillService.enqueuePending();
            log.info("Recovered {} stories awaiting enhancement", recovered);
        } catch (RuntimeException e) {
            log.error("Startup backfill failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Startup backfill failed", e);
        }
    }
}
