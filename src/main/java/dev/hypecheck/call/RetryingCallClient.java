package dev.hypecheck.call;

import dev.hypecheck.ai.ResponseParseException;
import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.ai.ScoringRequest;
import dev.hypecheck.ai.ScoringResponse;
import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.ratelimit.RateLimiter;
import dev.hypecheck.ratelimit.SlidingWindowRateLimiter;
import dev.hypecheck.report.CallReport;
import dev.hypecheck.report.ResultReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Wraps a single external scoring call with rate limiting, retries and
 * per-attempt reporting.
 *
 * <p>
 * The rate limit is checked once, before the first attempt. Retryable failures
 * (429, 5xx, timeouts, transport errors) back off and try again up to
 * {@code maxRetries} times; terminal failures return immediately. Backoff
 * delays come from {@link BackoffPolicy} and never decrease within one call.
 */
@Slf4j
@Service
public class RetryingCallClient {

    static final String OPERATION = "score-story";
    static final String LIMITER_NAME = "external-call";

    private final ScoringClient scoringClient;
    private final ResultReporter reporter;
    private final ModelPricing pricing;
    private final RateLimiter rateLimiter;
    private final BackoffPolicy backoff;
    private final int maxRetries;
    private final Duration attemptTimeout;

    @Autowired
    public RetryingCallClient(ScoringClient scoringClient, ResultReporter reporter, ModelPricing pricing,
            EnhancementConfig config, Clock clock) {
        this(scoringClient, reporter, pricing,
                new SlidingWindowRateLimiter(LIMITER_NAME,
                        config.getCallRateLimit().getLength(),
                        config.getCallRateLimit().getMaxRequests(),
                        clock),
                BackoffPolicy.from(config),
                config.getMaxRetries(),
                config.getAttemptTimeout());
    }

    RetryingCallClient(ScoringClient scoringClient, ResultReporter reporter, ModelPricing pricing,
            RateLimiter rateLimiter, BackoffPolicy backoff, int maxRetries, Duration attemptTimeout) {
        this.scoringClient = scoringClient;
        this.reporter = reporter;
        this.pricing = pricing;
        this.rateLimiter = rateLimiter;
        this.backoff = backoff;
        this.maxRetries = Math.max(0, maxRetries);
        this.attemptTimeout = attemptTimeout;
    }

    public CallResult call(ScoringRequest request) {
        return call(request, request.scope());
    }

    /**
     * Score a story with retries, blocking the calling worker until the call
     * settles.
     *
     * @param request the story and its heuristic baseline
     * @param scope   rate-limit key, e.g. "company:42" or "global"
     */
    public CallResult call(ScoringRequest request, String scope) {
        AtomicInteger attempts = new AtomicInteger();
        long callStart = System.nanoTime();
        try {
            return callAsync(request, scope, attempts).block();
        } catch (RuntimeException e) {
            if (!(Exceptions.unwrap(e) instanceof InterruptedException)) {
                throw e;
            }
            Thread.currentThread().interrupt();
            log.warn("Scoring {} interrupted after {} attempts", request.contentId(), attempts.get());
            return CallResult.failure(CallOutcome.TERMINAL_ERROR, attempts.get(),
                    "Interrupted during backoff", elapsedSince(callStart));
        }
    }

    /**
     * Non-blocking form of {@link #call(ScoringRequest, String)}. The returned
     * Mono always completes with a result; failures are mapped to outcomes.
     */
    public Mono<CallResult> callAsync(ScoringRequest request, String scope) {
        return callAsync(request, scope, new AtomicInteger());
    }

    private Mono<CallResult> callAsync(ScoringRequest request, String scope, AtomicInteger attempts) {
        if (!scoringClient.isEnabled()) {
            return Mono.just(CallResult.disabled());
        }

        if (!rateLimiter.allow(scope)) {
            log.warn("External call rate limit reached for {}; skipping enhancement of {}",
                    scope, request.contentId());
            report(request, () -> CallReport.builder()
                    .operation(OPERATION)
                    .scope(scope)
                    .contentId(request.contentId())
                    .model(scoringClient.model())
                    .attemptIndex(0)
                    .outcome(CallReport.Outcome.RATE_LIMITED)
                    .error("rate limit exceeded")
                    .build());
            return Mono.just(CallResult.rateLimited(scope));
        }

        long callStart = System.nanoTime();
        AtomicReference<Duration> previousDelay = new AtomicReference<>(Duration.ZERO);

        return Mono.defer(() -> attempt(request, scope, attempts.getAndIncrement()))
                .retryWhen(Retry.max(maxRetries)
                        .filter(CallErrorClassifier::isRetryable)
                        .doBeforeRetryAsync(signal -> {
                            Duration delay = backoff.delay((int) signal.totalRetries(), previousDelay.get());
                            previousDelay.set(delay);
                            log.info("Scoring {} attempt {} failed ({}); retrying in {}ms",
                                    request.contentId(), signal.totalRetries() + 1,
                                    CallErrorClassifier.describe(signal.failure()), delay.toMillis());
                            return Mono.delay(delay).then();
                        }))
                .map(response -> CallResult.success(response, attempts.get(), elapsedSince(callStart)))
                .onErrorResume(e -> Mono.just(failure(request, e, attempts.get(), elapsedSince(callStart))));
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    private Mono<ScoringResponse> attempt(ScoringRequest request, String scope, int attempt) {
        long attemptStart = System.nanoTime();
        return scoringClient.score(request)
                .timeout(attemptTimeout)
                .switchIfEmpty(Mono.error(() -> new ResponseParseException("Scoring service returned no result", null)))
                .doOnNext(response -> report(request,
                        () -> successReport(request, scope, attempt, elapsedSince(attemptStart), response)))
                .doOnError(error -> report(request,
                        () -> failureReport(request, scope, attempt, elapsedSince(attemptStart), error)));
    }

    private CallResult failure(ScoringRequest request, Throwable error, int attempts, Duration elapsed) {
        if (Exceptions.isRetryExhausted(error)) {
            String description = CallErrorClassifier.describe(error.getCause());
            log.warn("Scoring {} failed after {} attempts: {}", request.contentId(), attempts, description);
            return CallResult.failure(CallOutcome.RETRIES_EXHAUSTED, attempts, description, elapsed);
        }
        String description = CallErrorClassifier.describe(error);
        log.warn("Scoring {} failed with terminal error on attempt {}: {}", request.contentId(), attempts, description);
        return CallResult.failure(CallOutcome.TERMINAL_ERROR, attempts, description, elapsed);
    }

    private CallReport successReport(ScoringRequest request, String scope, int attempt, Duration duration,
            ScoringResponse response) {
        String model = response.model() != null ? response.model() : scoringClient.model();
        return CallReport.builder()
                .operation(OPERATION)
                .scope(scope)
                .contentId(request.contentId())
                .model(model)
                .attemptIndex(attempt)
                .duration(duration)
                .inputTokens(response.inputTokens())
                .outputTokens(response.outputTokens())
                .estimatedCostUsd(pricing.estimateCost(model, response.inputTokens(), response.outputTokens()))
                .outcome(CallReport.Outcome.SUCCESS)
                .build();
    }

    private CallReport failureReport(ScoringRequest request, String scope, int attempt, Duration duration,
            Throwable error) {
        boolean retryable = CallErrorClassifier.isRetryable(error);
        return CallReport.builder()
                .operation(OPERATION)
                .scope(scope)
                .contentId(request.contentId())
                .model(scoringClient.model())
                .attemptIndex(attempt)
                .duration(duration)
                .estimatedCostUsd(BigDecimal.ZERO)
                .outcome(retryable ? CallReport.Outcome.RETRYABLE_FAILURE : CallReport.Outcome.TERMINAL_FAILURE)
                .error(CallErrorClassifier.describe(error))
                .build();
    }

    // building the report (pricing lookups included) must not turn a settled attempt into a failure
    private void report(ScoringRequest request, Supplier<CallReport> callReport) {
        try {
            reporter.reportCall(callReport.get());
        } catch (RuntimeException e) {
            log.warn("Result reporter failed for call report on {}: {}", request.contentId(), e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
