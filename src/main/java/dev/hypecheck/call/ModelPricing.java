package dev.hypecheck.call;

import dev.hypecheck.config.AiConfig;
import dev.hypecheck.config.AiConfig.TokenRate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static per-model token price table (USD per 1K tokens).
 * Versioned model names ("gpt-4-0613") resolve to the longest configured
 * prefix; unknown models use the default model's rates.
 */
@Slf4j
@Component
public class ModelPricing {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int COST_SCALE = 6;

    private final Map<String, TokenRate> rates;
    private final TokenRate fallback;

    @Autowired
    public ModelPricing(AiConfig config) {
        this(config.getPricing(), config.getDefaultPricingModel());
    }

    ModelPricing(Map<String, TokenRate> rates, String defaultModel) {
        this.rates = new TreeMap<>();
        rates.forEach((model, rate) -> this.rates.put(model.toLowerCase(Locale.ROOT), rate));
        TokenRate defaultRate = this.rates.get(defaultModel == null ? "" : defaultModel.toLowerCase(Locale.ROOT));
        this.fallback = defaultRate != null ? defaultRate : new TokenRate();
    }

    public TokenRate rateFor(String model) {
        if (model == null || model.isBlank()) {
            return fallback;
        }
        String key = model.toLowerCase(Locale.ROOT);
        TokenRate exact = rates.get(key);
        if (exact != null) {
            return exact;
        }
        String best = null;
        for (String candidate : rates.keySet()) {
            if (key.startsWith(candidate) && (best == null || candidate.length() > best.length())) {
                best = candidate;
            }
        }
        if (best == null) {
            log.debug("No price for model '{}', using default rates", model);
            return fallback;
        }
        return rates.get(best);
    }

    public BigDecimal estimateCost(String model, int inputTokens, int outputTokens) {
        TokenRate rate = rateFor(model);
        BigDecimal input = rate.getInput().multiply(BigDecimal.valueOf(Math.max(0, inputTokens)));
        BigDecimal output = rate.getOutput().multiply(BigDecimal.valueOf(Math.max(0, outputTokens)));
        return input.add(output).divide(THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
    }
}
