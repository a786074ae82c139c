package dev.hypecheck.report;

/**
 * Side channel for call and job outcomes. Implementations may fail; callers
 * must never let a reporting failure change the outcome of the work reported.
 */
public interface ResultReporter {

    void reportCall(CallReport report);

    void reportJob(JobReport report);
}
