package dev.hypecheck.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * One counting window for a (limiter, key) pair. Immutable; the limiter swaps
 * instances atomically.
 */
public record RateWindow(String key, int count, Instant windowStart, Duration windowLength, int limit) {

    public static RateWindow open(String key, Instant now, Duration windowLength, int limit) {
        return new RateWindow(key, 1, now, windowLength, limit);
    }

    public boolean isExpired(Instant now) {
        return Duration.between(windowStart, now).compareTo(windowLength) >= 0;
    }

    public RateWindow increment() {
        return new RateWindow(key, count + 1, windowStart, windowLength, limit);
    }

    public boolean withinLimit() {
        return count <= limit;
    }

    public Instant resetsAt() {
        return windowStart.plus(windowLength);
    }
}
