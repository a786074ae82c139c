package dev.hypecheck;

import dev.hypecheck.ai.NoOpScoringClient;
import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.ai.ScoringRequest;
import dev.hypecheck.call.CallOutcome;
import dev.hypecheck.call.RetryingCallClient;
import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.report.ConsoleResultReporter;
import dev.hypecheck.report.ResultReporter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "app.ai.provider=gemini",
    "app.reporting.mode=syslog"
})
@ActiveProfiles("test")
class ProviderFallbackContextTest {

  @MockitoBean
  private WorkerRunner workerRunner;

  @Autowired
  private ApplicationContext context;

  @Test
  void unknownProviderAndReportingModeFallBack() {
    assertThat(context.getBeansOfType(ScoringClient.class)).hasSize(1);
    assertThat(context.getBean(ScoringClient.class)).isInstanceOf(NoOpScoringClient.class);
    assertThat(context.getBean(ResultReporter.class)).isInstanceOf(ConsoleResultReporter.class);
    assertThat(context.getBean(RetryingCallClient.class).getRateLimiter()).isNotNull();
  }

  @Test
  void unknownProviderDisablesEnhancement() {
    ContentItem item = ContentItem.builder().id("story-1").title("Revolutionary AI").body("Amazing").build();
    ScoringRequest request = ScoringRequest.of(item, ScoreResult.builder().hypeScore(3.0).ethicsScore(5.0).build());

    assertThat(context.getBean(RetryingCallClient.class).call(request).outcome()).isEqualTo(CallOutcome.DISABLED);
  }
}
