package dev.hypecheck.call;

import dev.hypecheck.config.AiConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ModelPricingTest {

    private ModelPricing pricing;

    @BeforeEach
    void setUp() {
        pricing = new ModelPricing(new AiConfig());
    }

    @ParameterizedTest
    @CsvSource({
            "gpt-4, 1000, 1000, 0.09",
            "gpt-4-turbo, 1000, 1000, 0.04",
            "gpt-3.5-turbo, 2000, 1000, 0.005",
            "gpt-4, 250, 100, 0.0135"
    })
    @DisplayName("Should price input and output tokens per thousand")
    void shouldPriceTokens(String model, int input, int output, String expected) {
        assertThat(pricing.estimateCost(model, input, output)).isEqualByComparingTo(new BigDecimal(expected));
    }

    @Test
    @DisplayName("Should resolve versioned model names by longest prefix")
    void shouldResolveVersionedModels() {
        assertThat(pricing.estimateCost("gpt-4-turbo-2024-04-09", 1000, 0)).isEqualByComparingTo("0.01");
        assertThat(pricing.estimateCost("gpt-4-0613", 1000, 0)).isEqualByComparingTo("0.03");
        assertThat(pricing.estimateCost("GPT-3.5-TURBO-0125", 1000, 0)).isEqualByComparingTo("0.0015");
    }

    @Test
    @DisplayName("Should fall back to gpt-4 rates for unknown models")
    void shouldFallBackForUnknownModels() {
        assertThat(pricing.estimateCost("some-other-model", 1000, 1000)).isEqualByComparingTo("0.09");
        assertThat(pricing.estimateCost(null, 1000, 1000)).isEqualByComparingTo("0.09");
    }

    @Test
    @DisplayName("Should cost nothing without tokens")
    void shouldCostNothingWithoutTokens() {
        assertThat(pricing.estimateCost("gpt-4", 0, 0)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(pricing.estimateCost("gpt-4", -5, 0)).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
