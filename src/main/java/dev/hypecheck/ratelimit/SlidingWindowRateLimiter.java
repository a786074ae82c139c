package dev.hypecheck.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process fixed-length window limiter. A window starts at the first request
 * for a key and is replaced by a fresh one once {@code windowLength} has
 * elapsed. Denied requests still count.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final String name;
    private final Duration windowLength;
    private final int maxRequests;
    private final Clock clock;
    private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(String name, Duration windowLength, int maxRequests, Clock clock) {
        if (windowLength == null || windowLength.isNegative() || windowLength.isZero()) {
            throw new IllegalArgumentException("windowLength must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.name = name;
        this.windowLength = windowLength;
        this.maxRequests = maxRequests;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public boolean allow(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("rate limit key must not be blank");
        }
        Instant now = clock.instant();
        RateWindow window = windows.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return RateWindow.open(k, now, windowLength, maxRequests);
            }
            return current.increment();
        });

        boolean allowed = window.withinLimit();
        if (!allowed) {
            log.debug("[{}] Rate limit hit for '{}' ({}/{}), resets at {}",
                    name, key, window.count(), maxRequests, window.resetsAt());
        }
        return allowed;
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        windows.entrySet().removeIf(entry -> {
            boolean expired = entry.getValue().isExpired(now);
            if (expired) {
                removed.incrementAndGet();
            }
            return expired;
        });
        int purged = removed.get();
        if (purged > 0) {
            log.debug("[{}] Purged {} expired rate windows", name, purged);
        }
        return purged;
    }

    @Override
    public int trackedKeys() {
        return windows.size();
    }

    /**
     * Current window for a key, if one is tracked and not yet expired.
     */
    public Optional<RateWindow> window(String key) {
        RateWindow window = windows.get(key);
        if (window == null || window.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(window);
    }

    public String getName() {
        return name;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindowLength() {
        return windowLength;
    }
}
