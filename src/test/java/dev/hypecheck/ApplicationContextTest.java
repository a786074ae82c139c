package dev.hypecheck;

import dev.hypecheck.ai.NoOpScoringClient;
import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.queue.EnhancementQueue;
import dev.hypecheck.report.NoOpResultReporter;
import dev.hypecheck.report.ResultReporter;
import dev.hypecheck.service.QueueMaintenanceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private WorkerRunner workerRunner;

  @Autowired
  private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(ScoringClient.class)).isInstanceOf(NoOpScoringClient.class);
    assertThat(context.getBean(ResultReporter.class)).isInstanceOf(NoOpResultReporter.class);
    assertThat(context.getBeansOfType(QueueMaintenanceService.class)).isEmpty();
    assertThat(context.getBean(EnhancementQueue.class).isAccepting()).isTrue();
  }
}
