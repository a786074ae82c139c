package dev.hypecheck.call;

import dev.hypecheck.ai.ResponseParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class CallErrorClassifierTest {

    static WebClientResponseException httpError(int status) {
        return WebClientResponseException.create(HttpStatusCode.valueOf(status), "status " + status,
                new HttpHeaders(), new byte[0], null, null);
    }

    @ParameterizedTest
    @CsvSource({
            "429, true",
            "500, true",
            "502, true",
            "503, true",
            "504, true",
            "400, false",
            "401, false",
            "403, false",
            "404, false",
            "422, false"
    })
    @DisplayName("Should retry only 429 and server errors")
    void shouldClassifyHttpStatus(int status, boolean retryable) {
        assertThat(CallErrorClassifier.isRetryable(httpError(status))).isEqualTo(retryable);
    }

    @Nested
    @DisplayName("Transport errors")
    class TransportErrorTests {

        @Test
        @DisplayName("Should retry timeouts")
        void shouldRetryTimeouts() {
            assertThat(CallErrorClassifier.isRetryable(new TimeoutException("no response in 60s"))).isTrue();
        }

        @Test
        @DisplayName("Should retry connection resets and refusals")
        void shouldRetryConnectionErrors() {
            assertThat(CallErrorClassifier.isRetryable(new IOException("Connection reset by peer"))).isTrue();
            assertThat(CallErrorClassifier.isRetryable(new WebClientRequestException(
                    new ConnectException("Connection refused"), HttpMethod.POST,
                    URI.create("http://localhost/v1/chat/completions"), new HttpHeaders()))).isTrue();
        }

        @Test
        @DisplayName("Should retry transport errors wrapped in another exception")
        void shouldRetryWrappedTransportErrors() {
            assertThat(CallErrorClassifier.isRetryable(
                    new IllegalStateException("call failed", new IOException("Connection reset")))).isTrue();
        }
    }

    @Nested
    @DisplayName("Terminal errors")
    class TerminalErrorTests {

        @Test
        @DisplayName("Should not retry malformed responses")
        void shouldNotRetryParseFailures() {
            assertThat(CallErrorClassifier.isRetryable(new ResponseParseException("bad json", "{oops"))).isFalse();
            assertThat(CallErrorClassifier.isRetryable(new DecodingException("cannot decode"))).isFalse();
        }

        @Test
        @DisplayName("Should not retry unknown errors")
        void shouldNotRetryUnknownErrors() {
            assertThat(CallErrorClassifier.isRetryable(new IllegalStateException("boom"))).isFalse();
            assertThat(CallErrorClassifier.isRetryable(null)).isFalse();
        }
    }

    @Test
    @DisplayName("Should describe errors for reports")
    void shouldDescribeErrors() {
        assertThat(CallErrorClassifier.describe(httpError(503))).isEqualTo("HTTP 503 from scoring service");
        assertThat(CallErrorClassifier.describe(new TimeoutException())).isEqualTo("Scoring call timed out");
        assertThat(CallErrorClassifier.describe(new IOException("reset"))).isEqualTo("IOException: reset");
    }
}
