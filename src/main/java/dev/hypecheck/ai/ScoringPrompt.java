package dev.hypecheck.ai;

import dev.hypecheck.model.CompanyContext;
import dev.hypecheck.model.ScoreResult;

import java.util.TreeSet;

/**
 * Prompt text for the refinement call.
 */
public final class ScoringPrompt {

    static final int MAX_BODY_LENGTH = 4000;

    public static final String SYSTEM = """
            You are an expert tech ethics analyst and hype detector. Analyze the given story and provide:
            1. Refined hype score (1-10)
            2. Refined ethics score (1-10)
            3. Reality check (2-3 sentences)
            4. ELI5 summary (60-second read)
            5. Hype justification (1-2 sentences)
            6. Ethics justification (1-2 sentences)
            7. Confidence level (0-1)

            Be objective, factual, and helpful for users making informed decisions about technology.""";

    private ScoringPrompt() {
    }

    public static String user(ScoringRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze this tech story and provide enhanced scoring:\n\n");
        prompt.append("STORY TITLE: ").append(nullToEmpty(request.title())).append("\n\n");
        prompt.append("STORY CONTENT: ").append(truncate(request.body())).append("\n\n");
        prompt.append("SOURCE URL: ")
                .append(request.sourceUrl() == null || request.sourceUrl().isBlank() ? "Not provided" : request.sourceUrl())
                .append("\n\n");

        CompanyContext company = request.company();
        if (company != null) {
            prompt.append("COMPANY: ").append(nullToEmpty(company.name()));
            if (!company.sectorTags().isEmpty()) {
                prompt.append(" (sectors: ").append(String.join(", ", company.sectorTags())).append(")");
            }
            prompt.append("\n");
            if (company.credibilityScore() != null) {
                prompt.append("- Credibility Score: ").append(company.credibilityScore()).append("\n");
            }
            if (company.ethicsScore() != null) {
                prompt.append("- Historical Ethics Score: ").append(company.ethicsScore()).append("/10\n");
            }
            if (company.ethicsStatementUrl() != null) {
                prompt.append("- Ethics Statement: ").append(company.ethicsStatementUrl()).append("\n");
            }
            if (company.privacyPolicyUrl() != null) {
                prompt.append("- Privacy Policy: ").append(company.privacyPolicyUrl()).append("\n");
            }
            prompt.append("\n");
        }

        ScoreResult baseline = request.baseline();
        if (baseline != null) {
            prompt.append("LOCAL ANALYSIS:\n");
            prompt.append("- Hype Score: ").append(baseline.hypeScore()).append("/10\n");
            prompt.append("- Ethics Score: ").append(baseline.ethicsScore()).append("/10\n");
            prompt.append("- Impact Tags: ").append(String.join(", ", new TreeSet<>(baseline.impactTags()))).append("\n\n");
        }

        prompt.append("""
                Please provide your analysis in the following JSON format:
                {
                  "hypeScore": <number 1-10>,
                  "ethicsScore": <number 1-10>,
                  "impactTags": [<zero or more of "privacy", "labor", "environment", "safety">],
                  "realityCheck": "<2-3 sentences about accuracy and verification>",
                  "eli5Summary": "<60-second summary for general audience>",
                  "hypeJustification": "<1-2 sentences explaining hype level>",
                  "ethicsJustification": "<1-2 sentences explaining ethics score>",
                  "confidence": <number 0-1>
                }

                Focus on:
                - Marketing language vs factual claims
                - Privacy, safety, and ethical implications
                - Accuracy and verification of claims
                - Real-world impact assessment
                """);
        return prompt.toString();
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) + "..." : body;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
