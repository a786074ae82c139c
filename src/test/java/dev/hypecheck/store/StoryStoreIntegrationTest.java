package dev.hypecheck.store;

import dev.hypecheck.WorkerRunner;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.repository.StoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StoryStoreIntegrationTest {

    @MockitoBean
    private WorkerRunner workerRunner;

    @Autowired
    private JpaStoryStore store;

    @Autowired
    private StoryRepository storyRepository;

    @BeforeEach
    void setUp() {
        storyRepository.deleteAll();
    }

    private static ContentItem story(String id) {
        return ContentItem.builder().id(id).title("Title " + id).body("Body " + id).build();
    }

    private static ScoreResult scores(double hype, boolean enhanced) {
        return ScoreResult.builder().hypeScore(hype).ethicsScore(5.0).impactTags(Set.of("safety")).enhanced(enhanced).build();
    }

    @Test
    void shouldKeepEnhancedScoresAgainstLateHeuristicWrite() {
        store.saveBaseline(story("s1"), scores(3.0, false));
        store.save("s1", scores(8.0, true));
        store.save("s1", scores(3.0, false));

        ScoreResult stored = store.findScores("s1").orElseThrow();
        assertThat(stored.enhanced()).isTrue();
        assertThat(stored.hypeScore()).isEqualTo(8.0);
        assertThat(stored.impactTags()).containsExactly("safety");
    }

    @Test
    void shouldListStoriesAwaitingEnhancement() {
        store.saveBaseline(story("s1"), scores(3.0, false));
        store.saveBaseline(story("s2"), scores(3.0, false));
        store.saveBaseline(story("s3"), scores(3.0, false));
        store.save("s2", scores(6.0, true));

        assertThat(store.findIdsAwaitingEnhancement(10)).containsExactlyInAnyOrder("s1", "s3");
        assertThat(store.findIdsAwaitingEnhancement(1)).hasSize(1);
        assertThat(storyRepository.countByEnhancedTrue()).isEqualTo(1);
        assertThat(storyRepository.countByEnhancedFalse()).isEqualTo(2);
    }
}
