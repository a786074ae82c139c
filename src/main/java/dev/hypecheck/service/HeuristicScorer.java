package dev.hypecheck.service;

import dev.hypecheck.config.ScoringConfig;
import dev.hypecheck.model.ScoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based baseline scorer. Pure and deterministic: the same title and body
 * always produce the same result, with no I/O and no clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeuristicScorer {

    public static final String TAG_PRIVACY = "privacy";
    public static final String TAG_LABOR = "labor";
    public static final String TAG_ENVIRONMENT = "environment";
    public static final String TAG_SAFETY = "safety";

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private final ScoringConfig scoringConfig;

    /**
     * Score a story's title and body. Null or empty text counts as zero matches.
     *
     * @return a non-enhanced ScoreResult carrying only scores and impact tags
     */
    public ScoreResult score(String title, String body) {
        String text = normalize(title) + " " + normalize(body);

        double hype = scoringConfig.getHypeBase()
                + scoringConfig.getHypeTermWeight() * countTerms(text, scoringConfig.getHypeTerms())
                + scoringConfig.getExclamationWeight() * countExclamations(text)
                - scoringConfig.getTechnicalTermWeight() * countTerms(text, scoringConfig.getTechnicalTerms());

        double ethics = scoringConfig.getEthicsBase()
                + scoringConfig.getPrivacyTermWeight() * countTerms(text, scoringConfig.getPrivacyTerms());
        if (containsAny(text, scoringConfig.getLaborTerms())) {
            ethics -= scoringConfig.getLaborPenalty();
        }
        if (containsAny(text, scoringConfig.getEnvironmentTerms())) {
            ethics += scoringConfig.getEnvironmentBonus();
        }

        ScoreResult result = ScoreResult.builder()
                .hypeScore(roundToTenth(ScoreResult.clamp(hype)))
                .ethicsScore(roundToTenth(ScoreResult.clamp(ethics)))
                .impactTags(impactTags(text))
                .enhanced(false)
                .build();

        log.debug("Heuristic score: hype={}, ethics={}, tags={}",
                result.hypeScore(), result.ethicsScore(), result.impactTags());
        return result;
    }

    /**
     * Human-readable band for a hype score.
     */
    public static String hypeLevel(double score) {
        if (score >= 8) return "Extremely High Hype";
        if (score >= 6) return "High Hype";
        if (score >= 4) return "Moderate Hype";
        if (score >= 2) return "Low Hype";
        return "Minimal Hype";
    }

    private Set<String> impactTags(String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (containsAny(text, scoringConfig.getPrivacyTerms())) {
            tags.add(TAG_PRIVACY);
        }
        if (containsAny(text, scoringConfig.getLaborTerms())) {
            tags.add(TAG_LABOR);
        }
        if (containsAny(text, scoringConfig.getEnvironmentTerms())) {
            tags.add(TAG_ENVIRONMENT);
        }
        if (containsAny(text, scoringConfig.getSafetyTerms())) {
            tags.add(TAG_SAFETY);
        }
        return tags;
    }

    private int countTerms(String text, List<String> terms) {
        if (terms == null) {
            return 0;
        }
        int total = 0;
        for (String term : terms) {
            total += countWord(text, term);
        }
        return total;
    }

    private boolean containsAny(String text, List<String> terms) {
        return terms != null && terms.stream().anyMatch(term -> countWord(text, term) > 0);
    }

    private static int countExclamations(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '!') {
                count++;
            }
        }
        return count;
    }

    /**
     * Occurrences of a word or phrase with word boundaries.
     */
    private static int countWord(String text, String word) {
        if (text.isEmpty() || word == null || word.isBlank()) {
            return 0;
        }
        String regex = "\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "\\b";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, Pattern::compile);
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
