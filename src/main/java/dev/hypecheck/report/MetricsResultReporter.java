package dev.hypecheck.report;

import dev.hypecheck.metrics.EnhancementMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Feeds call and job outcomes into Micrometer.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.reporting.mode", havingValue = "metrics")
public class MetricsResultReporter implements ResultReporter {

    private final EnhancementMetrics metrics;

    @Override
    public void reportCall(CallReport report) {
        metrics.recordCall(report);
    }

    @Override
    public void reportJob(JobReport report) {
        metrics.recordJob(report);
    }
}
