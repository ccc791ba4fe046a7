package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Content reuse thresholds.
 * Loaded from application.yml under 'research.cache' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.cache")
public class CacheConfig {

    private int maxAgeDays = 7;
    private double minQuality = 0.6;
    private int lookupLimit = 20;

    /** Entries whose full text is loaded for one gatherer run. */
    private int hydrateLimit = 10;

    /** Quality above which a hydrated entry counts towards skipping a fresh search. */
    private double highQualityFloor = 0.7;
    private int skipFreshSearchThreshold = 5;

    /** A domain with this many reusable entries is excluded from fresh searches. */
    private int domainSaturation = 3;

    private int summaryChars = 500;
    private Duration lookupTimeout = Duration.ofSeconds(10);
}
