package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "research.job")
public class JobConfig {

    /** Hard limit for one coordinator run. */
    private Duration maxDuration = Duration.ofMinutes(5);

    private int workerThreads = 8;
}
