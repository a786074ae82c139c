package dev.hypecheck.exception;

public class ContentNotFoundException extends EnhancementException {

    private final String contentId;

    public ContentNotFoundException(String contentId) {
        super("Content not found: " + contentId);
        this.contentId = contentId;
    }

    public String getContentId() {
        return contentId;
    }
}
