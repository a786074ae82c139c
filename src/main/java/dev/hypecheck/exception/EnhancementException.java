package dev.hypecheck.exception;

/**
 * Base class for failures of the enhancement pipeline.
 */
public class EnhancementException extends RuntimeException {

    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
