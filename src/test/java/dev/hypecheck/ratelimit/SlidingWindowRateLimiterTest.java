package dev.hypecheck.ratelimit;

import dev.hypecheck.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        limiter = new SlidingWindowRateLimiter("test", Duration.ofMillis(1000), 3, clock);
    }

    @Nested
    @DisplayName("Window counting")
    class WindowCountingTests {

        @Test
        @DisplayName("Should admit up to the limit and deny the next request")
        void shouldAdmitUpToLimit() {
            assertThat(limiter.allow("k")).isTrue();
            assertThat(limiter.allow("k")).isTrue();
            assertThat(limiter.allow("k")).isTrue();
            assertThat(limiter.allow("k")).isFalse();
        }

        @Test
        @DisplayName("Should start a fresh window once the window length has elapsed")
        void shouldResetAfterWindow() {
            for (int i = 0; i < 4; i++) {
                limiter.allow("k");
            }

            clock.advance(Duration.ofMillis(1000));

            assertThat(limiter.allow("k")).isTrue();
            assertThat(limiter.window("k")).get()
                    .extracting(RateWindow::count)
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("Should keep denying until the window has fully elapsed")
        void shouldDenyJustBeforeExpiry() {
            for (int i = 0; i < 3; i++) {
                limiter.allow("k");
            }

            clock.advance(Duration.ofMillis(999));

            assertThat(limiter.allow("k")).isFalse();
        }

        @Test
        @DisplayName("Should count denied requests")
        void shouldCountDeniedRequests() {
            for (int i = 0; i < 5; i++) {
                limiter.allow("k");
            }

            assertThat(limiter.window("k")).get()
                    .extracting(RateWindow::count)
                    .isEqualTo(5);
        }

        @Test
        @DisplayName("Should track keys independently")
        void shouldTrackKeysIndependently() {
            for (int i = 0; i < 3; i++) {
                limiter.allow("user:1");
            }

            assertThat(limiter.allow("user:1")).isFalse();
            assertThat(limiter.allow("user:2")).isTrue();
            assertThat(limiter.trackedKeys()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Should purge only expired windows")
        void shouldPurgeExpiredWindows() {
            limiter.allow("old");
            clock.advance(Duration.ofMillis(600));
            limiter.allow("recent");
            clock.advance(Duration.ofMillis(500));

            int purged = limiter.purgeExpired();

            assertThat(purged).isEqualTo(1);
            assertThat(limiter.trackedKeys()).isEqualTo(1);
            assertThat(limiter.window("recent")).isPresent();
            assertThat(limiter.window("old")).isEmpty();
        }

        @Test
        @DisplayName("Should reject invalid limits")
        void shouldRejectInvalidLimits() {
            assertThatThrownBy(() -> new SlidingWindowRateLimiter("bad", Duration.ZERO, 3, clock))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new SlidingWindowRateLimiter("bad", Duration.ofSeconds(1), 0, clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject missing keys without opening a window")
        void shouldRejectMissingKeys() {
            assertThatThrownBy(() -> limiter.allow(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> limiter.allow(" "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(limiter.trackedKeys()).isZero();
        }
    }

    @Test
    @DisplayName("Should admit exactly the limit under concurrent access")
    void shouldAdmitExactlyLimitConcurrently() throws Exception {
        SlidingWindowRateLimiter shared = new SlidingWindowRateLimiter("concurrent", Duration.ofHours(1), 500, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        for (int t = 0; t < 8; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                int admitted = 0;
                for (int i = 0; i < 100; i++) {
                    if (shared.allow("hot-key")) {
                        admitted++;
                    }
                }
                return admitted;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> future : futures) {
            total += future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(total).isEqualTo(500);
    }
}
