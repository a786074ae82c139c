package dev.hypecheck.ai;

import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class NoOpScoringClientTest {

    private final NoOpScoringClient client = new NoOpScoringClient();

    @Test
    void shouldBeDisabled() {
        assertThat(client.isEnabled()).isFalse();
        assertThat(client.model()).isEqualTo("none");
    }

    @Test
    void shouldCompleteWithoutResponse() {
        ScoringRequest request = ScoringRequest.of(
                ContentItem.builder().id("story-1").title("t").body("b").build(),
                ScoreResult.builder().hypeScore(1).ethicsScore(5).build());

        StepVerifier.create(client.score(request)).verifyComplete();
    }
}
