package dev.hypecheck.report;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.reporting.mode", havingValue = "none")
public class NoOpResultReporter implements ResultReporter {

    @Override
    public void reportCall(CallReport report) {
        // reporting disabled
    }

    @Override
    public void reportJob(JobReport report) {
        // reporting disabled
    }
}
