package dev.hypecheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Admission limits for the story submission entry point.
 * Loaded from application.yml under 'app.submission' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.submission")
public class SubmissionConfig {

    /**
     * Five enhancement requests per submitter every 15 minutes.
     */
    private Window rateLimit = new Window(Duration.ofMinutes(15), 5);
}
