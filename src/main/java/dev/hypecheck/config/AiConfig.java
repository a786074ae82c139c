package dev.hypecheck.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * External scoring service settings.
 * Loaded from application.yml under 'app.ai' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ai")
public class AiConfig {

    /**
     * "openai" enables the OpenAI-compatible client; "none" or any other value disables enhancement.
     */
    private String provider = "none";
    private String apiKey;
    private String baseUrl = "https://api.openai.com";
    private String model = "gpt-4";
    private double temperature = 0.3;
    private int maxTokens = 1000;

    /**
     * Model used for cost estimation when the response names an unknown model.
     */
    private String defaultPricingModel = "gpt-4";

    /**
     * USD per 1K tokens. Keys containing dots must use bracket notation in YAML.
     */
    private Map<String, TokenRate> pricing = new HashMap<>(Map.of(
            "gpt-4", new TokenRate(new BigDecimal("0.03"), new BigDecimal("0.06")),
            "gpt-4-turbo", new TokenRate(new BigDecimal("0.01"), new BigDecimal("0.03")),
            "gpt-3.5-turbo", new TokenRate(new BigDecimal("0.0015"), new BigDecimal("0.002"))));

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenRate {
        private BigDecimal input = BigDecimal.ZERO;
        private BigDecimal output = BigDecimal.ZERO;
    }
}
