package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the completion (LLM) service.
 * Loaded from application.yml under 'research.completion' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.completion")
public class CompletionConfig {

    /** openai or gemini. */
    private String provider = "openai";

    private String apiKey;
    private String baseUrl = "https://api.openai.com";
    private String model = "gpt-4o";
    private boolean jsonMode = true;

    /** Timeout for a single gatherer analysis call. */
    private Duration callTimeout = Duration.ofSeconds(25);

    private MaxTokens maxTokens = new MaxTokens();
    private Gemini gemini = new Gemini();

    @Data
    public static class MaxTokens {
        private int companyAnalysis = 5000;
        private int jobAnalysis = 3000;
        private int cvAnalysis = 3000;
    }

    @Data
    public static class Gemini {
        private String apiKey;
        private String model = "gemini-flash-latest";
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String path = "/v1beta/models/%s:generateContent";
    }
}
