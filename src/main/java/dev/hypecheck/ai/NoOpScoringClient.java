package dev.hypecheck.ai;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Used when no scoring provider is configured, or the configured one is not
 * known. Stories keep their heuristic scores.
 */
@Slf4j
public class NoOpScoringClient implements ScoringClient {

    public NoOpScoringClient() {
        this("none");
    }

    public NoOpScoringClient(String provider) {
        if (provider == null || provider.isBlank() || "none".equalsIgnoreCase(provider)) {
            log.info("No scoring provider configured. Stories keep heuristic scores only.");
        } else {
            log.warn("Unknown scoring provider '{}'. Stories keep heuristic scores only.", provider);
        }
    }

    @Override
    public Mono<ScoringResponse> score(ScoringRequest request) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String model() {
        return "none";
    }
}
