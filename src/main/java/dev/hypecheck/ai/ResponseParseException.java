package dev.hypecheck.ai;

/**
 * The scoring service answered, but the body could not be read as the expected
 * JSON. Never retried.
 */
public class ResponseParseException extends RuntimeException {

    static final int MAX_RAW_LENGTH = 500;

    private final String rawSnippet;

    public ResponseParseException(String message, String raw) {
        super(message + " (raw: " + truncate(raw) + ")");
        this.rawSnippet = truncate(raw);
    }

    public ResponseParseException(String message, String raw, Throwable cause) {
        super(message + " (raw: " + truncate(raw) + ")", cause);
        this.rawSnippet = truncate(raw);
    }

    public String getRawSnippet() {
        return rawSnippet;
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "<empty>";
        }
        return raw.length() > MAX_RAW_LENGTH ? raw.substring(0, MAX_RAW_LENGTH) + "..." : raw;
    }
}
