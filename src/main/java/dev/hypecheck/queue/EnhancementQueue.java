package dev.hypecheck.queue;

import dev.hypecheck.config.EnhancementConfig;
import dev.hypecheck.exception.EnhancementException;
import dev.hypecheck.exception.QueueShutdownException;
import dev.hypecheck.model.EnhancementJob;
import dev.hypecheck.model.JobHandle;
import dev.hypecheck.model.JobState;
import dev.hypecheck.model.QueueStats;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.report.JobReport;
import dev.hypecheck.report.ResultReporter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process enhancement queue with a fixed worker pool.
 *
 * <p>
 * Jobs are keyed by {@link EnhancementJob#jobIdFor(String)}, so at most one
 * job per story is queued or active at a time. The job map holds immutable
 * snapshots; every transition swaps the snapshot through {@code compute}, and
 * a worker only claims a ready entry whose snapshot is still the current one.
 *
 * <p>
 * Ready jobs run highest priority first, FIFO within a priority. Delayed jobs
 * are released into the ready queue by a scheduler when their delay elapses.
 */
@Slf4j
@Service
public class EnhancementQueue implements EnhancementApi {

    private static final long POLL_INTERVAL_MS = 200;

    private final EnhancementProcessor processor;
    private final ResultReporter reporter;
    private final Clock clock;
    private final int concurrency;
    private final Duration drainTimeout;

    private final ConcurrentMap<String, EnhancementJob> jobs = new ConcurrentHashMap<>();
    private final PriorityBlockingQueue<ReadyEntry> ready = new PriorityBlockingQueue<>();
    private final Set<String> delayedJobIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition resumed = stateLock.newCondition();
    private final Condition idle = stateLock.newCondition();

    private volatile boolean paused;
    private volatile boolean accepting = true;
    private volatile boolean running;

    private ExecutorService workers;
    private ScheduledExecutorService delayScheduler;

    @Autowired
    public EnhancementQueue(EnhancementProcessor processor, ResultReporter reporter, Clock clock,
            EnhancementConfig config) {
        this(processor, reporter, clock, config.getConcurrency(), config.getDrainTimeout());
    }

    EnhancementQueue(EnhancementProcessor processor, ResultReporter reporter, Clock clock,
            int concurrency, Duration drainTimeout) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.processor = processor;
        this.reporter = reporter;
        this.clock = clock;
        this.concurrency = concurrency;
        this.drainTimeout = drainTimeout;
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        accepting = true;
        delayScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("enhance-delay"));
        workers = Executors.newFixedThreadPool(concurrency, namedThreads("enhance-worker"));
        for (int i = 0; i < concurrency; i++) {
            workers.execute(this::workerLoop);
        }
        log.info("Enhancement queue started with {} workers", concurrency);
    }

    @Override
    public JobHandle enqueue(String contentId, int priority, Duration delay) {
        if (contentId == null || contentId.isBlank()) {
            throw new IllegalArgumentException("contentId must not be blank");
        }
        if (!accepting) {
            throw new QueueShutdownException(contentId);
        }

        Instant now = clock.instant();
        Duration effectiveDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        if (!effectiveDelay.isZero() && delayScheduler == null) {
            throw new IllegalStateException("Enhancement queue not started");
        }
        String jobId = EnhancementJob.jobIdFor(contentId);
        AtomicReference<EnhancementJob> outstanding = new AtomicReference<>();

        EnhancementJob job = jobs.compute(jobId, (id, current) -> {
            if (current != null && current.isOutstanding()) {
                outstanding.set(current);
                return current;
            }
            return EnhancementJob.builder()
                    .jobId(id)
                    .contentId(contentId)
                    .priority(priority)
                    .enqueuedAt(now)
                    .availableAt(now.plus(effectiveDelay))
                    .attempt(0)
                    .state(JobState.QUEUED)
                    .build();
        });

        if (outstanding.get() != null) {
            log.debug("Job {} already {}; returning existing handle", jobId, job.state());
            return JobHandle.existing(job);
        }

        if (effectiveDelay.isZero()) {
            ready.offer(new ReadyEntry(job, sequence.incrementAndGet()));
        } else {
            delayedJobIds.add(jobId);
            delayScheduler.schedule(() -> release(job), effectiveDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Queued enhancement job {} (priority={}, delay={}ms)", jobId, priority, effectiveDelay.toMillis());
        return JobHandle.created(job);
    }

    /**
     * Run one story through the pipeline on the calling thread, outside the job
     * lifecycle. Workers use the same path.
     */
    public ScoreResult process(String contentId) {
        return processor.process(contentId);
    }

    @Override
    public QueueStats stats() {
        int queued = 0;
        int active = 0;
        int completed = 0;
        int failed = 0;
        int delayed = 0;
        for (EnhancementJob job : jobs.values()) {
            switch (job.state()) {
                case QUEUED -> {
                    if (delayedJobIds.contains(job.jobId())) {
                        delayed++;
                    } else {
                        queued++;
                    }
                }
                case ACTIVE -> active++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new QueueStats(queued, active, completed, failed, delayed, paused);
    }

    @Override
    public Optional<EnhancementJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public void pause() {
        paused = true;
        log.info("Enhancement queue paused");
    }

    @Override
    public void resume() {
        stateLock.lock();
        try {
            paused = false;
            resumed.signalAll();
        } finally {
            stateLock.unlock();
        }
        log.info("Enhancement queue resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public int cleanup(Duration maxAge) {
        return cleanup(maxAge, maxAge);
    }

    /**
     * Remove completed and failed jobs older than their own retention.
     */
    public int cleanup(Duration completedMaxAge, Duration failedMaxAge) {
        Instant now = clock.instant();
        Instant completedCutoff = now.minus(completedMaxAge);
        Instant failedCutoff = now.minus(failedMaxAge);
        AtomicInteger removed = new AtomicInteger();

        jobs.forEach((jobId, snapshot) -> {
            if (!snapshot.state().isTerminal()) {
                return;
            }
            boolean remove = jobs.computeIfPresent(jobId, (id, current) -> {
                Instant finished = current.finishedAt();
                if (!current.state().isTerminal() || finished == null) {
                    return current;
                }
                Instant cutoff = current.state() == JobState.COMPLETED ? completedCutoff : failedCutoff;
                return finished.isBefore(cutoff) ? null : current;
            }) == null;
            if (remove) {
                removed.incrementAndGet();
            }
        });

        if (removed.get() > 0) {
            log.info("Cleaned up {} finished enhancement jobs", removed.get());
        }
        return removed.get();
    }

    /**
     * Wait until no job is queued or active, or the timeout passes.
     *
     * @return true if the queue became idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        stateLock.lock();
        try {
            while (hasOutstandingJobs()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stop accepting jobs, stop claiming, and let in-flight jobs finish within
     * the drain timeout. Queued jobs that were never claimed are dropped and
     * logged; the backfill recovers their stories on the next start.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!running) {
            accepting = false;
            dropUnclaimed();
            return;
        }
        log.info("Shutting down enhancement queue (stats: {})", stats());
        accepting = false;
        running = false;
        stateLock.lock();
        try {
            resumed.signalAll();
        } finally {
            stateLock.unlock();
        }

        delayScheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight jobs did not finish within {}; interrupting workers", drainTimeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        dropUnclaimed();
        log.info("Enhancement queue stopped");
    }

    private void dropUnclaimed() {
        List<String> dropped = new ArrayList<>();
        jobs.forEach((jobId, job) -> {
            if (job.state() == JobState.QUEUED && jobs.remove(jobId, job)) {
                dropped.add(jobId);
            }
        });
        ready.clear();
        delayedJobIds.clear();
        if (!dropped.isEmpty()) {
            log.warn("Dropped {} unclaimed jobs at shutdown: {}", dropped.size(), dropped);
        }
        signalIfIdle();
    }

    private void workerLoop() {
        while (running) {
            try {
                awaitResumed();
                ReadyEntry entry = ready.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (entry == null) {
                    continue;
                }
                if (paused || !running) {
                    ready.offer(entry);
                    continue;
                }
                EnhancementJob claimed = claim(entry.job());
                if (claimed != null) {
                    run(claimed);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void awaitResumed() throws InterruptedException {
        stateLock.lock();
        try {
            while (paused && running) {
                resumed.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * QUEUED -> ACTIVE, only if the entry still matches the current snapshot.
     */
    private EnhancementJob claim(EnhancementJob queued) {
        AtomicReference<EnhancementJob> claimed = new AtomicReference<>();
        jobs.computeIfPresent(queued.jobId(), (id, current) -> {
            if (current != queued || current.state() != JobState.QUEUED) {
                return current;
            }
            EnhancementJob active = current.toBuilder()
                    .state(JobState.ACTIVE)
                    .startedAt(clock.instant())
                    .attempt(current.attempt() + 1)
                    .build();
            claimed.set(active);
            return active;
        });
        return claimed.get();
    }

    private void run(EnhancementJob job) {
        log.debug("Processing job {} (attempt {})", job.jobId(), job.attempt());
        EnhancementJob finished = null;
        try {
            ScoreResult result = processor.process(job.contentId());
            finished = transition(job, JobState.COMPLETED, result, null);
        } catch (EnhancementException e) {
            log.error("Job {} failed: {}", job.jobId(), e.getMessage());
            finished = transition(job, JobState.FAILED, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.jobId(), e);
            finished = transition(job, JobState.FAILED, null, e.toString());
        } catch (VirtualMachineError e) {
            log.error("Job {} aborted: {}", job.jobId(), e.toString());
            throw e;
        } catch (Error e) {
            log.error("Job {} failed with an error", job.jobId(), e);
            finished = transition(job, JobState.FAILED, null, e.toString());
        } finally {
            // an ACTIVE job must never outlive its worker
            if (finished == null) {
                finished = transition(job, JobState.FAILED, null, "Worker aborted");
            }
            report(finished);
            signalIfIdle();
        }
    }

    private EnhancementJob transition(EnhancementJob active, JobState state, ScoreResult result, String error) {
        EnhancementJob finished = active.toBuilder()
                .state(state)
                .finishedAt(clock.instant())
                .result(result)
                .error(error)
                .build();
        jobs.computeIfPresent(active.jobId(), (id, current) -> current == active ? finished : current);
        return finished;
    }

    private void release(EnhancementJob job) {
        delayedJobIds.remove(job.jobId());
        if (jobs.get(job.jobId()) == job) {
            ready.offer(new ReadyEntry(job, sequence.incrementAndGet()));
        }
    }

    private void report(EnhancementJob job) {
        try {
            reporter.reportJob(JobReport.of(job));
        } catch (RuntimeException e) {
            log.warn("Result reporter failed for job {}: {}", job.jobId(), e.getMessage());
        }
    }

    private boolean hasOutstandingJobs() {
        return jobs.values().stream().anyMatch(EnhancementJob::isOutstanding);
    }

    private void signalIfIdle() {
        stateLock.lock();
        try {
            idle.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Higher priority first, then enqueue order.
     */
    record ReadyEntry(EnhancementJob job, long sequence) implements Comparable<ReadyEntry> {
        @Override
        public int compareTo(ReadyEntry other) {
            int byPriority = Integer.compare(other.job.priority(), job.priority());
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
