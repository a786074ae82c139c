package dev.hypecheck.ratelimit;

import dev.hypecheck.config.SubmissionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Guards the enqueue entry point against submission floods. Keyed by
 * submitter identity (user, IP, or endpoint plus identity). Owns its own
 * window map; never shared with the external-call limiter.
 */
@Slf4j
@Component
public class SubmissionRateLimiter implements RateLimiter {

    static final String NAME = "submission";

    private final SlidingWindowRateLimiter delegate;

    @Autowired
    public SubmissionRateLimiter(SubmissionConfig config, Clock clock) {
        this(new SlidingWindowRateLimiter(NAME,
                config.getRateLimit().getLength(),
                config.getRateLimit().getMaxRequests(),
                clock));
    }

    SubmissionRateLimiter(SlidingWindowRateLimiter delegate) {
        this.delegate = delegate;
        log.info("Submission rate limit: {} requests per {}",
                delegate.getMaxRequests(), delegate.getWindowLength());
    }

    @Override
    public boolean allow(String key) {
        boolean allowed = delegate.allow(key);
        if (!allowed) {
            log.warn("Submission rejected for '{}': rate limit exceeded", key);
        }
        return allowed;
    }

    @Override
    public int purgeExpired() {
        return delegate.purgeExpired();
    }

    @Override
    public int trackedKeys() {
        return delegate.trackedKeys();
    }
}
