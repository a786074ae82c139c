package dev.hypecheck.model;

import lombok.Builder;

import java.util.Set;

/**
 * Scores for one story. {@code enhanced == false} means only the heuristic
 * floor was applied.
 *
 * <p>
 * Hype and ethics scores are clamped to {@code [1, 10]} on construction, so no
 * instance can carry an out-of-range value whatever produced it.
 */
@Builder(toBuilder = true)
public record ScoreResult(
        double hypeScore,
        double ethicsScore,
        Set<String> impactTags,
        String realityCheck,
        String eli5Summary,
        String hypeJustification,
        String ethicsJustification,
        Double confidence,
        boolean enhanced) {

    public static final double MIN_SCORE = 1.0;
    public static final double MAX_SCORE = 10.0;

    public ScoreResult {
        hypeScore = clamp(hypeScore);
        ethicsScore = clamp(ethicsScore);
        impactTags = impactTags == null ? Set.of() : Set.copyOf(impactTags);
        if (confidence != null) {
            confidence = Double.isNaN(confidence) ? null : Math.max(0.0, Math.min(1.0, confidence));
        }
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static boolean inRange(Double score) {
        return score != null && !score.isNaN() && score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
