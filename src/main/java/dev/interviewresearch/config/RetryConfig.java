package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared retry policy for external calls.
 * Loaded from application.yml under 'research.retry' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.retry")
public class RetryConfig {

    private int maxRetries = 2;
    private Duration initialDelay = Duration.ofSeconds(1);
}
