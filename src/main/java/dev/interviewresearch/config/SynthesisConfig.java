package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Budgets for the consolidated synthesis call.
 * Loaded from application.yml under 'research.synthesis' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.synthesis")
public class SynthesisConfig {

    private int maxTokens = 8000;
    private Duration timeout = Duration.ofSeconds(90);

    private int companyChars = 12000;
    private int jobChars = 8000;
    private int cvChars = 8000;
}
