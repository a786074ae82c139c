package dev.hypecheck.ratelimit;

import dev.hypecheck.config.SubmissionConfig;
import dev.hypecheck.config.Window;
import dev.hypecheck.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionRateLimiterTest {

    private MutableClock clock;
    private SubmissionRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        SubmissionConfig config = new SubmissionConfig();
        config.setRateLimit(new Window(Duration.ofMinutes(15), 2));
        limiter = new SubmissionRateLimiter(config, clock);
    }

    @Test
    @DisplayName("Should apply the configured window per submitter")
    void shouldApplyConfiguredWindow() {
        assertThat(limiter.allow("user:alice")).isTrue();
        assertThat(limiter.allow("user:alice")).isTrue();
        assertThat(limiter.allow("user:alice")).isFalse();
        assertThat(limiter.allow("user:bob")).isTrue();

        clock.advance(Duration.ofMinutes(15));

        assertThat(limiter.allow("user:alice")).isTrue();
    }

    @Test
    @DisplayName("Should default to five submissions per fifteen minutes")
    void shouldUseDefaults() {
        SubmissionRateLimiter defaults = new SubmissionRateLimiter(new SubmissionConfig(), clock);

        for (int i = 0; i < 5; i++) {
            assertThat(defaults.allow("ip:10.0.0.1")).isTrue();
        }
        assertThat(defaults.allow("ip:10.0.0.1")).isFalse();
    }

    @Test
    @DisplayName("Should not share windows with another limiter instance")
    void shouldNotShareState() {
        SlidingWindowRateLimiter callLimiter = new SlidingWindowRateLimiter("external-call", Duration.ofHours(1), 1, clock);

        limiter.allow("global");
        limiter.allow("global");

        assertThat(callLimiter.allow("global")).isTrue();
        assertThat(limiter.trackedKeys()).isEqualTo(1);
        assertThat(callLimiter.trackedKeys()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should purge expired submitter windows")
    void shouldPurgeExpiredWindows() {
        limiter.allow("user:alice");
        clock.advance(Duration.ofMinutes(16));

        assertThat(limiter.purgeExpired()).isEqualTo(1);
        assertThat(limiter.trackedKeys()).isZero();
    }
}
