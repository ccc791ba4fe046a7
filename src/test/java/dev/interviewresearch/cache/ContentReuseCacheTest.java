package dev.interviewresearch.cache;

import dev.interviewresearch.config.CacheConfig;
import dev.interviewresearch.entity.ScrapedUrl;
import dev.interviewresearch.entity.ScrapedUrlUsage;
import dev.interviewresearch.entity.UsageType;
import dev.interviewresearch.repository.ScrapedUrlRepository;
import dev.interviewresearch.repository.ScrapedUrlUsageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentReuseCacheTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private ScrapedUrlRepository scrapedUrlRepository;

    @Mock
    private ScrapedUrlUsageRepository usageRepository;

    @Captor
    private ArgumentCaptor<ScrapedUrl> entryCaptor;

    @Captor
    private ArgumentCaptor<ScrapedUrlUsage> usageCaptor;

    private ContentReuseCache cache;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        cache = new ContentReuseCache(scrapedUrlRepository, usageRepository, new ContentQualityScorer(),
                new CacheConfig(), clock);
    }

    private ScrapedUrl entry(String id, String url, String role, String country, int ageDays, double quality) {
        return ScrapedUrl.builder()
                .id(id)
                .url(url)
                .urlHash(ContentReuseCache.hashUrl(url))
                .domain(ContentReuseCache.domainOf(url))
                .title("Interview at Acme")
                .fullContent("I interviewed at Acme last month. The interviewer asked about system design.")
                .companyName("Acme")
                .roleTitle(role)
                .country(country)
                .qualityScore(quality)
                .firstScrapedAt(now.minusDays(ageDays))
                .build();
    }

    @Nested
    @DisplayName("Reuse lookup")
    class LookupTests {

        @Test
        @DisplayName("Should drop entries older than the age window")
        void shouldDropStaleEntries() {
            when(scrapedUrlRepository.findCandidates("Acme", 0.6)).thenReturn(List.of(
                    entry("1", "https://www.glassdoor.com/Interview/acme-1", null, null, 2, 0.9),
                    entry("2", "https://reddit.com/r/cscareerquestions/acme", null, null, 10, 0.9),
                    entry("3", "https://www.glassdoor.com/Interview/acme-3", null, null, 7, 0.8),
                    entry("4", "https://www.glassdoor.com/Interview/acme-4", null, null, 8, 0.8)));

            ReuseLookup result = cache.lookup("Acme", null, null, 7, 0.6);

            // exactly seven days old is still inside the window
            assertThat(result.urls()).containsExactly(
                    "https://www.glassdoor.com/Interview/acme-1",
                    "https://www.glassdoor.com/Interview/acme-3");
        }

        @Test
        @DisplayName("Should match role as case-insensitive substring and exclude entries without a role")
        void shouldMatchRoleSubstring() {
            when(scrapedUrlRepository.findCandidates("Acme", 0.6)).thenReturn(List.of(
                    entry("1", "https://a.com/1", "Senior Backend Engineer", null, 1, 0.8),
                    entry("2", "https://a.com/2", "Product Manager", null, 1, 0.8),
                    entry("3", "https://a.com/3", null, null, 1, 0.8)));

            ReuseLookup result = cache.lookup("Acme", "backend engineer", null, 7, 0.6);

            assertThat(result.entries()).extracting(ReusableUrl::entryId).containsExactly("1");
        }

        @Test
        @DisplayName("Should accept entries without a country when a country is requested")
        void shouldAcceptEntriesWithoutCountry() {
            when(scrapedUrlRepository.findCandidates("Acme", 0.6)).thenReturn(List.of(
                    entry("1", "https://a.com/1", null, "Germany", 1, 0.8),
                    entry("2", "https://a.com/2", null, null, 1, 0.8),
                    entry("3", "https://a.com/3", null, "United States", 1, 0.8)));

            ReuseLookup result = cache.lookup("Acme", null, "germany", 7, 0.6);

            assertThat(result.entries()).extracting(ReusableUrl::entryId).containsExactly("1", "2");
        }

        @Test
        @DisplayName("Should exclude domains with three or more reusable entries")
        void shouldExcludeSaturatedDomains() {
            when(scrapedUrlRepository.findCandidates("Acme", 0.6)).thenReturn(List.of(
                    entry("1", "https://www.glassdoor.com/Interview/1", null, null, 1, 0.9),
                    entry("2", "https://www.glassdoor.com/Interview/2", null, null, 1, 0.9),
                    entry("3", "https://www.glassdoor.com/Interview/3", null, null, 1, 0.9),
                    entry("4", "https://reddit.com/r/x/4", null, null, 1, 0.9)));

            ReuseLookup result = cache.lookup("Acme", null, null, 7, 0.6);

            assertThat(result.entries()).hasSize(4);
            assertThat(result.excludedDomains()).containsExactly("glassdoor.com");
        }

        @Test
        @DisplayName("Should behave as empty when the repository fails")
        void shouldBehaveAsEmptyOnError() {
            when(scrapedUrlRepository.findCandidates(anyString(), anyDouble()))
                    .thenThrow(new IllegalStateException("database locked"));

            StepVerifier.create(cache.findReusable("Acme", null, null, 7, 0.6))
                    .assertNext(result -> assertThat(result.isEmpty()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should skip the repository for a blank company")
        void shouldSkipBlankCompany() {
            StepVerifier.create(cache.findReusable(" ", null, null, 7, 0.6))
                    .assertNext(result -> assertThat(result.isEmpty()).isTrue())
                    .verifyComplete();

            verify(scrapedUrlRepository, never()).findCandidates(anyString(), anyDouble());
        }
    }

    @Nested
    @DisplayName("Storing and counters")
    class StoreTests {

        @Test
        @DisplayName("Should insert a new entry with hash, domain and quality")
        void shouldInsertNewEntry() {
            String url = "https://www.glassdoor.com/Interview/acme";
            when(scrapedUrlRepository.findByUrlHashAndCompanyName(ContentReuseCache.hashUrl(url), "Acme"))
                    .thenReturn(Optional.empty());
            when(scrapedUrlRepository.save(any(ScrapedUrl.class))).thenAnswer(inv -> {
                ScrapedUrl saved = inv.getArgument(0);
                saved.setId("new-id");
                return saved;
            });

            StepVerifier.create(cache.store(url, "Acme interview", "They asked me about system design",
                            "Acme", "Engineer", "US"))
                    .assertNext(content -> {
                        assertThat(content.entryId()).isEqualTo("new-id");
                        assertThat(content.qualityScore()).isGreaterThan(0.3);
                    })
                    .verifyComplete();

            verify(scrapedUrlRepository).save(entryCaptor.capture());
            ScrapedUrl saved = entryCaptor.getValue();
            assertThat(saved.getDomain()).isEqualTo("glassdoor.com");
            assertThat(saved.getContentType()).isEqualTo("interview_review");
            assertThat(saved.getFirstScrapedAt()).isEqualTo(now);
            assertThat(saved.getTimesReused()).isZero();
        }

        @Test
        @DisplayName("Should reuse the existing row after a concurrent insert")
        void shouldRecoverFromConcurrentInsert() {
            String url = "https://a.com/post";
            ScrapedUrl existing = entry("existing", url, null, null, 0, 0.5);
            when(scrapedUrlRepository.findByUrlHashAndCompanyName(ContentReuseCache.hashUrl(url), "Acme"))
                    .thenReturn(Optional.empty(), Optional.of(existing));
            when(scrapedUrlRepository.save(any(ScrapedUrl.class)))
                    .thenThrow(new DataIntegrityViolationException("UNIQUE constraint failed"));

            StepVerifier.create(cache.store(url, "t", "content", "Acme", null, null))
                    .assertNext(content -> assertThat(content.entryId()).isEqualTo("existing"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should record usage with type and quality")
        void shouldRecordUsage() {
            StepVerifier.create(cache.recordUsage("search-1", "entry-1", UsageType.REUSED, 0.85))
                    .verifyComplete();

            verify(usageRepository).save(usageCaptor.capture());
            ScrapedUrlUsage usage = usageCaptor.getValue();
            assertThat(usage.getSearchId()).isEqualTo("search-1");
            assertThat(usage.getUsageType()).isEqualTo(UsageType.REUSED);
            assertThat(usage.getQualityAtUse()).isEqualTo(0.85);
            assertThat(usage.getUsedAt()).isEqualTo(now);
        }

        @Test
        @DisplayName("Should swallow increment failures")
        void shouldSwallowIncrementFailure() {
            when(scrapedUrlRepository.incrementReuse(eq("entry-1"), any(LocalDateTime.class)))
                    .thenThrow(new IllegalStateException("database locked"));

            StepVerifier.create(cache.incrementReuse("entry-1"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Url helpers")
    class HelperTests {

        @Test
        @DisplayName("Should hash urls deterministically")
        void shouldHashDeterministically() {
            assertThat(ContentReuseCache.hashUrl("https://a.com/x"))
                    .isEqualTo(ContentReuseCache.hashUrl(" https://a.com/x "))
                    .hasSize(64);
        }

        @Test
        @DisplayName("Should strip www and fall back to unknown")
        void shouldExtractDomain() {
            assertThat(ContentReuseCache.domainOf("https://www.Glassdoor.com/Interview")).isEqualTo("glassdoor.com");
            assertThat(ContentReuseCache.domainOf("not a url")).isEqualTo("unknown");
        }
    }
}
