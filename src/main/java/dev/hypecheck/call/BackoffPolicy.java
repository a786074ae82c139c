package dev.hypecheck.call;

import dev.hypecheck.config.EnhancementConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter.
 *
 * <p>
 * Attempt {@code n} (0-indexed) waits {@code min(maxDelay, baseDelay * multiplier^n)}
 * shifted by up to {@code ±jitterFactor}. The jittered value is then held
 * between the previous delay and {@code maxDelay}, so a retry sequence never
 * waits less than the step before it.
 */
public class BackoffPolicy {

    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, double multiplier, Duration maxDelay, double jitterFactor,
            DoubleSupplier random) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    public static BackoffPolicy from(EnhancementConfig config) {
        return new BackoffPolicy(config.getBaseDelay(), config.getMultiplier(), config.getMaxDelay(),
                config.getJitterFactor(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay before the retry that follows attempt {@code attempt}, without jitter.
     */
    public Duration nominalDelay(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        return Duration.ofMillis((long) Math.min(maxDelay.toMillis(), millis));
    }

    /**
     * Jittered delay for {@code attempt}, never below {@code previous} and never above maxDelay.
     */
    public Duration delay(int attempt, Duration previous) {
        long nominal = nominalDelay(attempt).toMillis();
        // random() in [0,1) maps to a factor in [1 - jitter, 1 + jitter)
        double factor = 1.0 + jitterFactor * (2.0 * random.getAsDouble() - 1.0);
        long jittered = Math.round(nominal * factor);

        long floor = previous == null ? 0 : previous.toMillis();
        return Duration.ofMillis(Math.max(floor, Math.min(maxDelay.toMillis(), jittered)));
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
