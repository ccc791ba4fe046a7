package dev.interviewresearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "research.persistence")
public class PersistenceConfig {

    private Duration checkpointTimeout = Duration.ofSeconds(30);
}
