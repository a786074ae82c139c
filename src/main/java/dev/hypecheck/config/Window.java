package dev.hypecheck.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Sliding window limit: at most {@code maxRequests} per {@code length}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Window {
    private Duration length = Duration.ofMinutes(15);
    private int maxRequests = 5;
}
