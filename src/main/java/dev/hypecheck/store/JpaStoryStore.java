package dev.hypecheck.store;

import dev.hypecheck.entity.Story;
import dev.hypecheck.model.CompanyContext;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.repository.StoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Story table backed implementation of both collaborator contracts.
 *
 * <p>
 * Write-back never replaces enhanced scores with heuristic-only ones; only
 * {@link #saveBaseline} (an explicit re-score) may do that.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaStoryStore implements ContentFetch, ResultWriteback {

    private final StoryRepository storyRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<ContentItem> fetch(String contentId) {
        return storyRepository.findById(contentId).map(JpaStoryStore::toContentItem);
    }

    @Override
    @Transactional
    public void save(String contentId, ScoreResult result) {
        Story story = storyRepository.findById(contentId)
                .orElseThrow(() -> new IllegalStateException("Story " + contentId + " no longer exists"));

        if (story.isEnhanced() && !result.enhanced()) {
            log.info("Story {} already has enhanced scores; keeping them over heuristic result", contentId);
            return;
        }

        applyScores(story, result);
        storyRepository.save(story);
        log.debug("Saved scores for {} (enhanced={})", contentId, result.enhanced());
    }

    /**
     * Insert or update a story with freshly computed heuristic scores,
     * replacing any earlier result including an enhanced one.
     */
    @Transactional
    public void saveBaseline(ContentItem item, ScoreResult baseline) {
        LocalDateTime now = LocalDateTime.now(clock);
        Story story = storyRepository.findById(item.id())
                .orElseGet(() -> Story.builder().id(item.id()).createdAt(now).build());

        story.setTitle(item.title() == null ? "" : item.title());
        story.setBody(item.body());
        story.setSourceUrl(item.sourceUrl());
        CompanyContext company = item.companyContext();
        if (company != null) {
            story.setCompanyId(company.id());
            story.setCompanyName(company.name());
            story.setCompanySectorTags(company.sectorTags().isEmpty() ? null : String.join(",", company.sectorTags()));
            story.setCompanyCredibilityScore(company.credibilityScore());
            story.setCompanyEthicsScore(company.ethicsScore());
            story.setCompanyEthicsStatementUrl(company.ethicsStatementUrl());
            story.setCompanyPrivacyPolicyUrl(company.privacyPolicyUrl());
        }
        applyScores(story, baseline);
        storyRepository.save(story);
    }

    /**
     * Stories still holding heuristic scores only, oldest first.
     */
    @Transactional(readOnly = true)
    public List<String> findIdsAwaitingEnhancement(int limit) {
        return storyRepository.findIdsAwaitingEnhancement(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public Optional<ScoreResult> findScores(String contentId) {
        return storyRepository.findById(contentId)
                .filter(story -> story.getHypeScore() != null && story.getEthicsScore() != null)
                .map(JpaStoryStore::toScoreResult);
    }

    private void applyScores(Story story, ScoreResult result) {
        story.setHypeScore(result.hypeScore());
        story.setEthicsScore(result.ethicsScore());
        story.setImpactTags(result.impactTags().isEmpty() ? null : String.join(",", new TreeSet<>(result.impactTags())));
        story.setRealityCheck(result.realityCheck());
        story.setEli5Summary(result.eli5Summary());
        story.setHypeJustification(result.hypeJustification());
        story.setEthicsJustification(result.ethicsJustification());
        story.setConfidence(result.confidence());
        story.setEnhanced(result.enhanced());
        story.setScoredAt(LocalDateTime.now(clock));
    }

    static ContentItem toContentItem(Story story) {
        CompanyContext company = null;
        if (story.getCompanyId() != null) {
            company = CompanyContext.builder()
                    .id(story.getCompanyId())
                    .name(story.getCompanyName())
                    .sectorTags(List.copyOf(splitCsv(story.getCompanySectorTags())))
                    .credibilityScore(story.getCompanyCredibilityScore())
                    .ethicsScore(story.getCompanyEthicsScore())
                    .ethicsStatementUrl(story.getCompanyEthicsStatementUrl())
                    .privacyPolicyUrl(story.getCompanyPrivacyPolicyUrl())
                    .build();
        }
        return ContentItem.builder()
                .id(story.getId())
                .title(story.getTitle())
                .body(story.getBody())
                .sourceUrl(story.getSourceUrl())
                .companyContext(company)
                .build();
    }

    static ScoreResult toScoreResult(Story story) {
        return ScoreResult.builder()
                .hypeScore(story.getHypeScore())
                .ethicsScore(story.getEthicsScore())
                .impactTags(splitCsv(story.getImpactTags()))
                .realityCheck(story.getRealityCheck())
                .eli5Summary(story.getEli5Summary())
                .hypeJustification(story.getHypeJustification())
                .ethicsJustification(story.getEthicsJustification())
                .confidence(story.getConfidence())
                .enhanced(story.isEnhanced())
                .build();
    }

    private static Set<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
