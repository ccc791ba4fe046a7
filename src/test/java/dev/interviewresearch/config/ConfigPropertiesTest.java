package dev.interviewresearch.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @Autowired
  private SearchConfig searchConfig;

  @Autowired
  private CompletionConfig completionConfig;

  @Autowired
  private RetryConfig retryConfig;

  @Autowired
  private CacheConfig cacheConfig;

  @Autowired
  private PersistenceConfig persistenceConfig;

  @Test
  void shouldLoadSearchConfig() {
    assertThat(searchConfig.getAllowedDomains()).contains("glassdoor.com", "reddit.com");
    assertThat(searchConfig.getQueryTemplates()).isNotEmpty();
    assertThat(searchConfig.getCompanyTickers()).containsEntry("amazon", "AMZN");
    // Test profile blanks the key
    assertThat(searchConfig.hasCredential()).isFalse();
  }

  @Test
  void shouldLoadCompletionConfig() {
    assertThat(completionConfig.getProvider()).isEqualTo("openai");
    assertThat(completionConfig.getApiKey()).isEqualTo("test-openai-key");
    assertThat(completionConfig.getModel()).isEqualTo("gpt-4o");
  }

  @Test
  void shouldApplyTestOverrides() {
    assertThat(retryConfig.getInitialDelay()).isEqualTo(Duration.ofMillis(10));
    assertThat(persistenceConfig.getCheckpointTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(cacheConfig.getMinQuality()).isGreaterThan(0);
  }
}
