package dev.hypecheck.ai;

import dev.hypecheck.config.AiConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Scoring client for OpenAI-compatible chat-completions endpoints.
 * One HTTP request per call; retries, timeouts and rate limits belong to
 * {@link dev.hypecheck.call.RetryingCallClient}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiScoringClient implements ScoringClient {

    static final String CHAT_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final ScoringResponseParser parser;
    private final AiConfig config;

    @Autowired
    public OpenAiScoringClient(AiConfig config, WebClient.Builder webClientBuilder, ScoringResponseParser parser) {
        this.config = config;
        this.parser = parser;
        this.webClient = webClientBuilder
                .baseUrl(stripTrailingSlash(config.getBaseUrl()))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        if (!config.hasApiKey()) {
            log.warn("OpenAI API key is missing! Story enhancement is disabled.");
        } else {
            log.info("OpenAI story enhancement enabled with model: {}", config.getModel());
        }
    }

    @Override
    public Mono<ScoringResponse> score(ScoringRequest request) {
        ChatRequest body = new ChatRequest(
                config.getModel(),
                List.of(new ChatRequest.Message("system", ScoringPrompt.SYSTEM),
                        new ChatRequest.Message("user", ScoringPrompt.user(request))),
                config.getTemperature(),
                config.getMaxTokens());

        return webClient.post()
                .uri(CHAT_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(() -> new ResponseParseException("Empty response body", null)))
                .map(parser::parse)
                .doOnNext(response -> log.debug("Scored {} with {} ({} in / {} out tokens)",
                        request.contentId(), response.model(), response.inputTokens(), response.outputTokens()));
    }

    @Override
    public boolean isEnabled() {
        return config.hasApiKey();
    }

    @Override
    public String model() {
        return config.getModel();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // DTOs
    record ChatRequest(String model, List<Message> messages, double temperature, int max_tokens) {
        record Message(String role, String content) {
        }
    }
}
