package dev.hypecheck.report;

import dev.hypecheck.model.EnhancementJob;
import dev.hypecheck.model.JobState;
import dev.hypecheck.model.ScoreResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConsoleResultReporterTest {

    private final ConsoleResultReporter reporter = new ConsoleResultReporter();

    @Test
    @DisplayName("Should log call reports of every outcome")
    void shouldLogCalls() {
        for (CallReport.Outcome outcome : CallReport.Outcome.values()) {
            CallReport report = CallReport.builder()
                    .operation("score-story")
                    .scope("global")
                    .outcome(outcome)
                    .estimatedCostUsd(new BigDecimal("0.001"))
                    .build();

            assertThatCode(() -> reporter.reportCall(report)).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Should derive job reports from finished jobs")
    void shouldDeriveJobReport() {
        Instant started = Instant.parse("2024-05-01T10:00:00Z");
        EnhancementJob job = EnhancementJob.builder()
                .jobId("enhance:1")
                .contentId("1")
                .state(JobState.COMPLETED)
                .attempt(1)
                .startedAt(started)
                .finishedAt(started.plusMillis(1500))
                .result(ScoreResult.builder().hypeScore(5).ethicsScore(5).enhanced(true).build())
                .build();

        JobReport report = JobReport.of(job);

        assertThat(report.enhanced()).isTrue();
        assertThat(report.processingTime()).isEqualTo(Duration.ofMillis(1500));
        assertThatCode(() -> reporter.reportJob(report)).doesNotThrowAnyException();
        assertThatCode(() -> reporter.reportJob(JobReport.of(job.toBuilder()
                .state(JobState.FAILED).result(null).error("Content not found: 1").build())))
                .doesNotThrowAnyException();
    }
}
