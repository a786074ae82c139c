package dev.hypecheck.ratelimit;

/**
 * Admission check keyed by an arbitrary caller identity.
 * The in-process implementation can be swapped for a shared counter service
 * behind the same contract.
 */
public interface RateLimiter {

    /**
     * Counts one request for {@code key} and tells whether it is admitted.
     */
    boolean allow(String key);

    /**
     * Drops windows that have expired. Returns the number removed.
     */
    int purgeExpired();

    /**
     * Number of keys currently tracked.
     */
    int trackedKeys();
}
