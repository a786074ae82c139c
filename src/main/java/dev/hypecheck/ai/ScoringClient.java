package dev.hypecheck.ai;

import reactor.core.publisher.Mono;

/**
 * Transport for the external scoring service.
 */
public interface ScoringClient {

    /**
     * Perform a single scoring call. Errors are signalled through the Mono and
     * classified by the caller; implementations never retry on their own.
     */
    Mono<ScoringResponse> score(ScoringRequest request);

    /**
     * Whether the provider is configured and calls should be attempted.
     */
    boolean isEnabled();

    /**
     * Model requested by this client, used for cost estimation.
     */
    String model();
}
