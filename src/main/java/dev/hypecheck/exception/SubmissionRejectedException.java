package dev.hypecheck.exception;

/**
 * Admission refused by the submission rate limiter. No job was created.
 */
public class SubmissionRejectedException extends EnhancementException {

    private final String submitterKey;

    public SubmissionRejectedException(String submitterKey) {
        super("Too many enhancement requests for " + submitterKey + ". Please try again later.");
        this.submitterKey = submitterKey;
    }

    public String getSubmitterKey() {
        return submitterKey;
    }
}
