package dev.hypecheck.ai;

import dev.hypecheck.model.CompanyContext;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;

/**
 * Input for one external refinement call: the story plus the heuristic
 * baseline the model is asked to refine.
 */
public record ScoringRequest(
        String contentId,
        String title,
        String body,
        String sourceUrl,
        CompanyContext company,
        ScoreResult baseline) {

    public static ScoringRequest of(ContentItem item, ScoreResult baseline) {
        return new ScoringRequest(item.id(), item.title(), item.body(), item.sourceUrl(),
                item.companyContext(), baseline);
    }

    /**
     * Rate-limit scope: per company when known, otherwise global.
     */
    public String scope() {
        if (company != null && company.id() != null && !company.id().isBlank()) {
            return "company:" + company.id();
        }
        return "global";
    }
}
