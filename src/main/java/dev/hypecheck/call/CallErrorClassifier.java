package dev.hypecheck.call;

import dev.hypecheck.ai.ResponseParseException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Splits scoring call failures into retryable and terminal.
 * Retryable: HTTP 429, HTTP 5xx, timeouts and transport errors (reset,
 * refused, premature close). Everything else, including malformed responses,
 * is terminal.
 */
public final class CallErrorClassifier {

    private static final int TOO_MANY_REQUESTS = 429;
    private static final int MAX_CAUSE_DEPTH = 10;

    private CallErrorClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof ResponseParseException || error instanceof DecodingException) {
            return false;
        }
        if (error instanceof WebClientResponseException responseError) {
            return isRetryableStatus(responseError.getStatusCode().value());
        }

        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TimeoutException
                    || current instanceof WebClientRequestException
                    || current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isRetryableStatus(int status) {
        return status == TOO_MANY_REQUESTS || status >= 500;
    }

    /**
     * Short description for logs and reports.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        if (error instanceof WebClientResponseException responseError) {
            return "HTTP " + responseError.getStatusCode().value() + " from scoring service";
        }
        if (error instanceof TimeoutException) {
            return "Scoring call timed out";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
