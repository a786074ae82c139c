package dev.hypecheck.ai;

import lombok.Builder;

import java.util.Set;

/**
 * Refined scores as returned by the external service, plus token usage.
 * Score fields are nullable: the service may omit them.
 */
@Builder(toBuilder = true)
public record ScoringResponse(
        Double hypeScore,
        Double ethicsScore,
        Set<String> impactTags,
        String realityCheck,
        String eli5Summary,
        String hypeJustification,
        String ethicsJustification,
        Double confidence,
        String model,
        int inputTokens,
        int outputTokens) {

    public ScoringResponse {
        impactTags = impactTags == null ? Set.of() : Set.copyOf(impactTags);
    }
}
