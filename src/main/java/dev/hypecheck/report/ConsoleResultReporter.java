package dev.hypecheck.report;

import dev.hypecheck.model.JobState;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every call attempt and finished job to the application log. The
 * default reporter for {@code console} and for any unrecognized mode.
 */
@Slf4j
public class ConsoleResultReporter implements ResultReporter {

    @Override
    public void reportCall(CallReport report) {
        if (report.isSuccess()) {
            log.info("AI call {} [{}] attempt={} model={} duration={}ms tokens={}/{} cost=${}",
                    report.operation(), report.scope(), report.attemptIndex() + 1, report.model(),
                    report.duration().toMillis(), report.inputTokens(), report.outputTokens(),
                    report.estimatedCostUsd().toPlainString());
        } else {
            log.info("AI call {} [{}] attempt={} model={} duration={}ms outcome={} error={}",
                    report.operation(), report.scope(), report.attemptIndex() + 1, report.model(),
                    report.duration().toMillis(), report.outcome(), report.error());
        }
    }

    @Override
    public void reportJob(JobReport report) {
        if (report.state() == JobState.FAILED) {
            log.error("Job {} failed after {} attempt(s): {}", report.jobId(), report.attempt(), report.error());
        } else if (report.enhanced()) {
            log.info("Job {} completed with enhanced scores in {}ms", report.jobId(),
                    report.processingTime().toMillis());
        } else {
            log.info("Job {} completed with heuristic scores only in {}ms", report.jobId(),
                    report.processingTime().toMillis());
        }
    }
}
