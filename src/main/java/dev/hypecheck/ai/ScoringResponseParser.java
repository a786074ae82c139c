package dev.hypecheck.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a chat-completions response body into a {@link ScoringResponse}.
 * The model's answer is expected to contain one JSON object, possibly wrapped
 * in prose or a code fence.
 */
@Component
@RequiredArgsConstructor
public class ScoringResponseParser {

    private final ObjectMapper objectMapper;

    public ScoringResponse parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ResponseParseException("Empty response body", rawBody);
        }

        JsonNode envelope = readTree(rawBody, "Response body is not valid JSON");
        JsonNode choices = envelope.path("choices");
        String content = choices.isArray() && !choices.isEmpty()
                ? choices.get(0).path("message").path("content").asText(null)
                : null;
        if (content == null || content.isBlank()) {
            throw new ResponseParseException("No message content in response", rawBody);
        }

        JsonNode usage = envelope.path("usage");
        ScoringResponse.ScoringResponseBuilder builder = parseContent(content).toBuilder()
                .model(textOrNull(envelope, "model"))
                .inputTokens(usage.path("prompt_tokens").asInt(0))
                .outputTokens(usage.path("completion_tokens").asInt(0));
        return builder.build();
    }

    /**
     * Extract and read the JSON object embedded in the model's answer.
     */
    ScoringResponse parseContent(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ResponseParseException("No JSON object in model answer", content);
        }

        JsonNode node = readTree(content.substring(start, end + 1), "Model answer is not valid JSON");
        if (!node.isObject()) {
            throw new ResponseParseException("Model answer is not a JSON object", content);
        }

        return ScoringResponse.builder()
                .hypeScore(numberOrNull(node, "hypeScore"))
                .ethicsScore(numberOrNull(node, "ethicsScore"))
                .impactTags(tags(node.path("impactTags")))
                .realityCheck(textOrNull(node, "realityCheck"))
                .eli5Summary(textOrNull(node, "eli5Summary"))
                .hypeJustification(textOrNull(node, "hypeJustification"))
                .ethicsJustification(textOrNull(node, "ethicsJustification"))
                .confidence(numberOrNull(node, "confidence"))
                .build();
    }

    private JsonNode readTree(String json, String message) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(message, json, e);
        }
    }

    private static Double numberOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Set<String> tags(JsonNode array) {
        Set<String> tags = new LinkedHashSet<>();
        if (array.isArray()) {
            array.forEach(tag -> {
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    tags.add(tag.asText().trim().toLowerCase(Locale.ROOT));
                }
            });
        }
        return tags;
    }
}
