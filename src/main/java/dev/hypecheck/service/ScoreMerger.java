package dev.hypecheck.service;

import dev.hypecheck.ai.ScoringResponse;
import dev.hypecheck.model.ScoreResult;

/**
 * Combines the heuristic floor with an external refinement.
 */
public final class ScoreMerger {

    private ScoreMerger() {
    }

    /**
     * A refinement is usable only when both scores are present, finite and
     * already within {@code [1, 10]}. Out-of-range values are rejected, not
     * clamped: they mean the model ignored the scale.
     */
    public static boolean isSane(ScoringResponse response) {
        return response != null
                && ScoreResult.inRange(response.hypeScore())
                && ScoreResult.inRange(response.ethicsScore());
    }

    /**
     * External values take precedence field by field; the baseline fills any gap.
     *
     * @throws IllegalArgumentException if the refinement is not sane
     */
    public static ScoreResult merge(ScoreResult baseline, ScoringResponse response) {
        if (!isSane(response)) {
            throw new IllegalArgumentException("Refinement scores missing or out of range");
        }
        return baseline.toBuilder()
                .hypeScore(response.hypeScore())
                .ethicsScore(response.ethicsScore())
                .impactTags(response.impactTags().isEmpty() ? baseline.impactTags() : response.impactTags())
                .realityCheck(firstNonNull(response.realityCheck(), baseline.realityCheck()))
                .eli5Summary(firstNonNull(response.eli5Summary(), baseline.eli5Summary()))
                .hypeJustification(firstNonNull(response.hypeJustification(), baseline.hypeJustification()))
                .ethicsJustification(firstNonNull(response.ethicsJustification(), baseline.ethicsJustification()))
                .confidence(response.confidence() != null ? response.confidence() : baseline.confidence())
                .enhanced(true)
                .build();
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
