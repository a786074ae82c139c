package dev.hypecheck.ai;

import dev.hypecheck.model.CompanyContext;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringPromptTest {

    @Test
    @DisplayName("Should include story, company context and local analysis")
    void shouldIncludeContext() {
        ContentItem item = ContentItem.builder()
                .id("story-1")
                .title("Acme automates support")
                .body("The assistant replaces 500 workers.")
                .companyContext(CompanyContext.builder()
                        .id("7")
                        .name("Acme")
                        .sectorTags(List.of("ai", "retail"))
                        .credibilityScore(62.0)
                        .privacyPolicyUrl("https://acme.example/privacy")
                        .build())
                .build();
        ScoreResult baseline = ScoreResult.builder()
                .hypeScore(1.0).ethicsScore(3.0).impactTags(Set.of("labor")).build();

        String prompt = ScoringPrompt.user(ScoringRequest.of(item, baseline));

        assertThat(prompt)
                .contains("STORY TITLE: Acme automates support")
                .contains("SOURCE URL: Not provided")
                .contains("COMPANY: Acme (sectors: ai, retail)")
                .contains("- Credibility Score: 62.0")
                .contains("- Privacy Policy: https://acme.example/privacy")
                .contains("- Ethics Score: 3.0/10")
                .contains("- Impact Tags: labor")
                .contains("\"hypeScore\": <number 1-10>");
    }

    @Test
    @DisplayName("Should truncate very long bodies")
    void shouldTruncateLongBodies() {
        String body = "a".repeat(ScoringPrompt.MAX_BODY_LENGTH + 500);

        assertThat(ScoringPrompt.truncate(body)).hasSize(ScoringPrompt.MAX_BODY_LENGTH + 3);
        assertThat(ScoringPrompt.truncate(null)).isEmpty();
    }

    @Test
    @DisplayName("Should scope requests by company when known")
    void shouldScopeByCompany() {
        ScoreResult baseline = ScoreResult.builder().hypeScore(1).ethicsScore(5).build();
        ContentItem withCompany = ContentItem.builder().id("1")
                .companyContext(CompanyContext.builder().id("42").build()).build();
        ContentItem withoutCompany = ContentItem.builder().id("2").build();

        assertThat(ScoringRequest.of(withCompany, baseline).scope()).isEqualTo("company:42");
        assertThat(ScoringRequest.of(withoutCompany, baseline).scope()).isEqualTo("global");
    }
}
