package dev.hypecheck.queue;

import dev.hypecheck.ai.ScoringRequest;
import dev.hypecheck.call.CallResult;
import dev.hypecheck.call.RetryingCallClient;
import dev.hypecheck.call.Sleeper;
import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.exception.ContentFetchException;
import dev.hypecheck.exception.ContentNotFoundException;
import dev.hypecheck.exception.ResultPersistenceException;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.service.HeuristicScorer;
import dev.hypecheck.service.ScoreMerger;
import dev.hypecheck.store.ContentFetch;
import dev.hypecheck.store.ResultWriteback;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Body of one enhancement job: fetch, heuristic floor, external refinement,
 * write-back.
 *
 * <p>
 * A failed or rejected refinement is not an error: the heuristic result is
 * persisted with {@code enhanced=false}. Only a missing or unreadable story,
 * or a write-back that still fails after its retry, throws.
 */
@Slf4j
@Service
public class EnhancementProcessor {

    private final ContentFetch contentFetch;
    private final ResultWriteback resultWriteback;
    private final HeuristicScorer heuristicScorer;
    private final RetryingCallClient callClient;
    private final Sleeper sleeper;
    private final int writebackRetries;
    private final Duration writebackRetryDelay;

    @Autowired
    public EnhancementProcessor(ContentFetch contentFetch, ResultWriteback resultWriteback,
            HeuristicScorer heuristicScorer, RetryingCallClient callClient, Sleeper sleeper,
            EnhancementConfig config) {
        this(contentFetch, resultWriteback, heuristicScorer, callClient, sleeper,
                config.getWritebackRetries(), config.getWritebackRetryDelay());
    }

    EnhancementProcessor(ContentFetch contentFetch, ResultWriteback resultWriteback,
            HeuristicScorer heuristicScorer, RetryingCallClient callClient, Sleeper sleeper,
            int writebackRetries, Duration writebackRetryDelay) {
        this.contentFetch = contentFetch;
        this.resultWriteback = resultWriteback;
        this.heuristicScorer = heuristicScorer;
        this.callClient = callClient;
        this.sleeper = sleeper;
        this.writebackRetries = Math.max(0, writebackRetries);
        this.writebackRetryDelay = writebackRetryDelay;
    }

    /**
     * Score and persist one story.
     *
     * @return the persisted result
     * @throws ContentNotFoundException   when no story has this id
     * @throws ContentFetchException      when the store cannot be read
     * @throws ResultPersistenceException when write-back fails after its retry
     */
    public ScoreResult process(String contentId) {
        ContentItem item = fetch(contentId);
        ScoreResult baseline = heuristicScorer.score(item.title(), item.body());

        ScoringRequest request = ScoringRequest.of(item, baseline);
        CallResult call = callClient.call(request, request.scope());

        ScoreResult result;
        if (call.isSuccess() && ScoreMerger.isSane(call.response())) {
            result = ScoreMerger.merge(baseline, call.response());
            log.info("Enhanced {}: hype {} -> {}, ethics {} -> {}", contentId,
                    baseline.hypeScore(), result.hypeScore(), baseline.ethicsScore(), result.ethicsScore());
        } else if (call.isSuccess()) {
            result = baseline;
            log.warn("Discarding refinement for {}: scores missing or out of range (hype={}, ethics={})",
                    contentId, call.response().hypeScore(), call.response().ethicsScore());
        } else {
            result = baseline;
            log.info("Keeping heuristic scores for {} ({}: {})", contentId, call.outcome(), call.error());
        }

        persist(contentId, result);
        return result;
    }

    private ContentItem fetch(String contentId) {
        try {
            return contentFetch.fetch(contentId)
                    .orElseThrow(() -> new ContentNotFoundException(contentId));
        } catch (ContentNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContentFetchException(contentId, e);
        }
    }

    private void persist(String contentId, ScoreResult result) {
        int attempts = writebackRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                resultWriteback.save(contentId, result);
                return;
            } catch (RuntimeException e) {
                if (attempt >= attempts) {
                    throw new ResultPersistenceException(contentId, attempt, e);
                }
                log.warn("Write-back for {} failed (attempt {}/{}): {}", contentId, attempt, attempts,
                        e.getMessage());
                try {
                    sleeper.sleep(writebackRetryDelay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ResultPersistenceException(contentId, attempt, e);
                }
            }
        }
    }
}
