package dev.hypecheck.metrics;

import dev.hypecheck.model.JobState;
import dev.hypecheck.model.QueueStats;
import dev.hypecheck.report.CallReport;
import dev.hypecheck.report.JobReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the enhancement pipeline.
 */
@Component
public class EnhancementMetrics {

    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_MODEL = "model";
    private final MeterRegistry registry;

    // Counters
    private final Counter jobsCompletedCounter;
    private final Counter jobsEnhancedCounter;
    private final Counter jobsDegradedCounter;
    private final Counter jobsFailedCounter;
    private final Counter submissionsRejectedCounter;

    // Cost
    private final DistributionSummary callCost;

    // Timers (per outcome)
    private final ConcurrentHashMap<String, Timer> callTimers = new ConcurrentHashMap<>();
    private final Timer jobTimer;

    // Gauges
    private final AtomicInteger queued = new AtomicInteger(0);
    private final AtomicInteger active = new AtomicInteger(0);
    private final AtomicInteger delayed = new AtomicInteger(0);
    private final AtomicInteger paused = new AtomicInteger(0);

    public EnhancementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsCompletedCounter = Counter.builder("hypecheck_jobs_completed_total")
                .description("Enhancement jobs that produced a result")
                .register(registry);

        this.jobsEnhancedCounter = Counter.builder("hypecheck_jobs_enhanced_total")
                .description("Completed jobs whose scores were refined by the external service")
                .register(registry);

        this.jobsDegradedCounter = Counter.builder("hypecheck_jobs_heuristic_only_total")
                .description("Completed jobs that kept heuristic scores only")
                .register(registry);

        this.jobsFailedCounter = Counter.builder("hypecheck_jobs_failed_total")
                .description("Enhancement jobs that failed (fetch or persistence failure)")
                .register(registry);

        this.submissionsRejectedCounter = Counter.builder("hypecheck_submissions_rejected_total")
                .description("Submissions rejected by the submission rate limiter")
                .register(registry);

        this.callCost = DistributionSummary.builder("hypecheck_ai_call_cost_usd")
                .description("Estimated cost of external scoring calls in USD")
                .register(registry);

        this.jobTimer = Timer.builder("hypecheck_job_duration")
                .description("Time from claim to terminal state")
                .register(registry);

        Gauge.builder("hypecheck_queue_queued", queued, AtomicInteger::get)
                .description("Jobs waiting to be claimed")
                .register(registry);

        Gauge.builder("hypecheck_queue_active", active, AtomicInteger::get)
                .description("Jobs currently being processed")
                .register(registry);

        Gauge.builder("hypecheck_queue_delayed", delayed, AtomicInteger::get)
                .description("Queued jobs not yet available")
                .register(registry);

        Gauge.builder("hypecheck_queue_paused", paused, AtomicInteger::get)
                .description("1 when the queue is paused")
                .register(registry);
    }

    /**
     * Get or create a timer for a call outcome.
     */
    public Timer getCallTimer(CallReport.Outcome outcome) {
        return callTimers.computeIfAbsent(outcome.name(), name ->
                Timer.builder("hypecheck_ai_call_duration")
                        .description("External scoring attempt latency")
                        .tag(TAG_OUTCOME, name.toLowerCase())
                        .register(registry)
        );
    }

    /**
     * Record one external scoring attempt.
     */
    public void recordCall(CallReport report) {
        getCallTimer(report.outcome()).record(report.duration());
        callCost.record(report.estimatedCostUsd().doubleValue());

        String model = report.model() == null ? "unknown" : report.model();
        Counter.builder("hypecheck_ai_calls_total")
                .tag(TAG_OUTCOME, report.outcome().name().toLowerCase())
                .tag(TAG_MODEL, model)
                .register(registry)
                .increment();
        Counter.builder("hypecheck_ai_tokens_total")
                .tag("direction", "input")
                .tag(TAG_MODEL, model)
                .register(registry)
                .increment(report.inputTokens());
        Counter.builder("hypecheck_ai_tokens_total")
                .tag("direction", "output")
                .tag(TAG_MODEL, model)
                .register(registry)
                .increment(report.outputTokens());
    }

    /**
     * Record a job reaching a terminal state.
     */
    public void recordJob(JobReport report) {
        jobTimer.record(report.processingTime());
        if (report.state() == JobState.FAILED) {
            jobsFailedCounter.increment();
            return;
        }
        jobsCompletedCounter.increment();
        if (report.enhanced()) {
            jobsEnhancedCounter.increment();
        } else {
            jobsDegradedCounter.increment();
        }
    }

    /**
     * Record a submission rejected at admission.
     */
    public void recordSubmissionRejected() {
        submissionsRejectedCounter.increment();
    }

    /**
     * Update queue gauges from a stats snapshot.
     */
    public void updateQueueStats(QueueStats stats) {
        queued.set(stats.queued());
        active.set(stats.active());
        delayed.set(stats.delayed());
        paused.set(stats.paused() ? 1 : 0);
    }
}
