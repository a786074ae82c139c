package dev.hypecheck.exception;

/**
 * The content store could not be read. Fails the job; the caller re-enqueues.
 */
public class ContentFetchException extends EnhancementException {

    public ContentFetchException(String contentId, Throwable cause) {
        super("Failed to fetch content " + contentId + ": " + cause.getMessage(), cause);
    }
}
