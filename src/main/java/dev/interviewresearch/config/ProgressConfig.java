package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Stall detection thresholds.
 * Loaded from application.yml under 'research.progress' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.progress")
public class ProgressConfig {

    private Duration stallThreshold = Duration.ofSeconds(30);
    private Duration escalationThreshold = Duration.ofSeconds(45);
}
