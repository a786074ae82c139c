package dev.hypecheck.exception;

/**
 * Write-back failed after its bounded retry.
 */
public class ResultPersistenceException extends EnhancementException {

    public ResultPersistenceException(String contentId, int attempts, Throwable cause) {
        super("Failed to persist scores for " + contentId + " after " + attempts + " attempt(s): "
                + cause.getMessage(), cause);
    }
}
