package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the web search/extraction service.
 * Loaded from application.yml under 'research.search' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.search")
public class SearchConfig {

    private String apiKey;
    private String baseUrl = "https://api.tavily.com";
    private String searchDepth = "basic";
    private String timeRange = "year";

    /** Results requested per discovery query. */
    private int maxResults = 3;

    /** Number of query templates run per company research. */
    private int discoveryQueries = 2;

    /** Maximum URLs sent to deep extraction. */
    private int extractLimit = 5;

    /** Minimum ranking score for a URL to be considered for extraction. */
    private int minUrlScore = 3;

    private Duration searchTimeout = Duration.ofSeconds(15);
    private Duration extractTimeout = Duration.ofSeconds(20);

    private List<String> allowedDomains = new ArrayList<>();
    private List<String> queryTemplates = new ArrayList<>();
    private Map<String, String> companyTickers = new HashMap<>();

    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }
}
