package dev.hypecheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Enhancement queue, retry and call rate-limit settings.
 * Loaded from application.yml under 'app.enhancement' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.enhancement")
public class EnhancementConfig {

    private int concurrency = 5;

    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofMillis(1000);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofMillis(10000);
    private double jitterFactor = 0.2;
    private Duration attemptTimeout = Duration.ofSeconds(60);

    private int writebackRetries = 1;
    private Duration writebackRetryDelay = Duration.ofMillis(500);

    private Duration completedRetention = Duration.ofHours(1);
    private Duration failedRetention = Duration.ofHours(24);
    private Duration drainTimeout = Duration.ofSeconds(65);

    private Window callRateLimit = new Window(Duration.ofHours(1), 100);

    private Backfill backfill = new Backfill();

    @Data
    public static class Backfill {
        private boolean enabled = true;
        private int batchSize = 50;
        private int priority = -1;
    }
}
