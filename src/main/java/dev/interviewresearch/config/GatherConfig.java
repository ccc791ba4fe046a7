package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Per-gatherer deadlines and content budgets.
 * Loaded from application.yml under 'research.gather' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "research.gather")
public class GatherConfig {

    private Duration companyResearchTimeout = Duration.ofSeconds(20);
    private Duration jobAnalysisTimeout = Duration.ofSeconds(20);
    private Duration cvAnalysisTimeout = Duration.ofSeconds(15);

    /** Deadline for the whole fan-out; gatherers still running are abandoned. */
    private Duration overallDeadline = Duration.ofSeconds(35);

    private int sourceSnippetChars = 4500;
    private int deepExtractChars = 6000;
    private int contextChars = 32000;
    private int jobDescriptionChars = 3000;
    private int cvChars = 12000;
    private int maxRoleLinks = 5;
}
