package dev.hypecheck.config;

import dev.hypecheck.ai.NoOpScoringClient;
import dev.hypecheck.ai.ScoringClient;
import dev.hypecheck.report.ConsoleResultReporter;
import dev.hypecheck.report.ResultReporter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans registered when no provider or reporting mode matched, so an unknown
 * {@code app.ai.provider} or {@code app.reporting.mode} degrades instead of
 * failing startup.
 */
@Configuration
public class FallbackBeansConfig {

    @Bean
    @ConditionalOnMissingBean(ScoringClient.class)
    public NoOpScoringClient noOpScoringClient(AiConfig aiConfig) {
        return new NoOpScoringClient(aiConfig.getProvider());
    }

    @Bean
    @ConditionalOnMissingBean(ResultReporter.class)
    public ConsoleResultReporter consoleResultReporter() {
        return new ConsoleResultReporter();
    }
}
