package dev.hypecheck.call;

import java.time.Duration;

/**
 * Blocks the calling worker thread between write-back attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
