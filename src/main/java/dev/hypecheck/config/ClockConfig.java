package dev.hypecheck.config;

import dev.hypecheck.call.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources shared by the limiters, the retry client and the queue.
 * Tests replace them to run without real waiting.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD_SLEEP;
    }
}
