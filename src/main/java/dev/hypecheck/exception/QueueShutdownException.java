package dev.hypecheck.exception;

public class QueueShutdownException extends EnhancementException {

    public QueueShutdownException(String contentId) {
        super("Enhancement queue is shut down; rejected job for " + contentId);
    }
}
