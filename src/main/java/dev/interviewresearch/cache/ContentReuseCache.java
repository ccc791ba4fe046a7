package dev.interviewresearch.cache;

import dev.interviewresearch.config.CacheConfig;
import dev.interviewresearch.entity.ScrapedUrl;
import dev.interviewresearch.entity.ScrapedUrlUsage;
import dev.interviewresearch.entity.UsageType;
import dev.interviewresearch.repository.ScrapedUrlRepository;
import dev.interviewresearch.repository.ScrapedUrlUsageRepository;
import dev.interviewresearch.support.TextLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Service for reusing previously fetched documents across searches for the same subject.
 * Every call runs on the bounded-elastic scheduler and is bounded by the lookup timeout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentReuseCache {

    private final ScrapedUrlRepository scrapedUrlRepository;
    private final ScrapedUrlUsageRepository usageRepository;
    private final ContentQualityScorer qualityScorer;
    private final CacheConfig cacheConfig;
    private final Clock clock;

    /**
     * Find reusable entries for a subject. Lookups never mutate counters.
     * On error or timeout the cache behaves as empty.
     */
    public Mono<ReuseLookup> findReusable(String company, String role, String country,
                                          int maxAgeDays, double minQuality) {
        if (isBlank(company)) {
            return Mono.just(ReuseLookup.empty());
        }
        return Mono.fromCallable(() -> lookup(company, role, country, maxAgeDays, minQuality))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(cacheConfig.getLookupTimeout())
                .doOnNext(result -> log.info("Cache lookup for {}: {} reusable urls, {} excluded domains",
                        company, result.entries().size(), result.excludedDomains().size()))
                .onErrorResume(e -> {
                    log.warn("Cache lookup for {} failed, continuing without cache: {}", company, e.toString());
                    return Mono.just(ReuseLookup.empty());
                });
    }

    /**
     * Load the full text of the given URLs for a subject.
     */
    public Mono<List<CachedContent>> getContent(Collection<String> urls, String company, String role,
                                                String country) {
        if (urls == null || urls.isEmpty() || isBlank(company)) {
            return Mono.just(List.of());
        }
        return Mono.fromCallable(() -> scrapedUrlRepository.findByCompanyAndUrls(company, urls).stream()
                        .filter(entry -> matchesRole(entry, role) && matchesCountry(entry, country))
                        .filter(entry -> !isBlank(entry.getFullContent()))
                        .map(entry -> new CachedContent(entry.getId(), entry.getUrl(), entry.getTitle(),
                                entry.getFullContent(), entry.getQualityScore()))
                        .toList())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(cacheConfig.getLookupTimeout())
                .onErrorResume(e -> {
                    log.warn("Loading cached content for {} failed: {}", company, e.toString());
                    return Mono.just(List.of());
                });
    }

    /**
     * Upsert a freshly fetched document keyed by (url hash, company). Empty when the write fails.
     */
    public Mono<CachedContent> store(String url, String title, String content, String company,
                                     String role, String country) {
        if (isBlank(url) || isBlank(company) || isBlank(content)) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> upsert(url, title, content, company, role, country))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(cacheConfig.getLookupTimeout())
                .map(entry -> new CachedContent(entry.getId(), entry.getUrl(), entry.getTitle(),
                        entry.getFullContent(), entry.getQualityScore()))
                .onErrorResume(e -> {
                    log.warn("Storing {} in cache failed: {}", url, e.toString());
                    return Mono.empty();
                });
    }

    /**
     * Record that a search used a cache entry. Never errors.
     */
    public Mono<Void> recordUsage(String searchId, String entryId, UsageType usageType, double qualityAtUse) {
        return Mono.fromRunnable(() -> usageRepository.save(ScrapedUrlUsage.builder()
                        .searchId(searchId)
                        .scrapedUrlId(entryId)
                        .usageType(usageType)
                        .qualityAtUse(qualityAtUse)
                        .usedAt(LocalDateTime.now(clock))
                        .build()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(cacheConfig.getLookupTimeout())
                .onErrorResume(e -> {
                    log.warn("Recording cache usage of {} for search {} failed: {}", entryId, searchId, e.toString());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Atomically increment the reuse counter of an entry. Never errors.
     */
    public Mono<Void> incrementReuse(String entryId) {
        return Mono.fromCallable(() -> scrapedUrlRepository.incrementReuse(entryId, LocalDateTime.now(clock)))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(cacheConfig.getLookupTimeout())
                .doOnNext(updated -> {
                    if (updated == 0) {
                        log.debug("Reuse increment matched no entry: {}", entryId);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Incrementing reuse count of {} failed: {}", entryId, e.toString());
                    return Mono.empty();
                })
                .then();
    }

    ReuseLookup lookup(String company, String role, String country, int maxAgeDays, double minQuality) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(maxAgeDays);

        List<ReusableUrl> entries = scrapedUrlRepository.findCandidates(company, minQuality).stream()
                .filter(entry -> entry.getFirstScrapedAt() != null && !entry.getFirstScrapedAt().isBefore(cutoff))
                .filter(entry -> matchesRole(entry, role) && matchesCountry(entry, country))
                .limit(cacheConfig.getLookupLimit())
                .map(entry -> new ReusableUrl(entry.getId(), entry.getUrl(), entry.getDomain(), entry.getTitle(),
                        entry.getQualityScore(), entry.getTimesReused()))
                .toList();

        Map<String, Integer> perDomain = new LinkedHashMap<>();
        entries.forEach(entry -> perDomain.merge(entry.domain(), 1, Integer::sum));
        List<String> excluded = perDomain.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() >= cacheConfig.getDomainSaturation())
                .map(Map.Entry::getKey)
                .toList();

        return new ReuseLookup(entries, excluded);
    }

    private ScrapedUrl upsert(String url, String title, String content, String company, String role,
                              String country) {
        String hash = hashUrl(url);
        LocalDateTime now = LocalDateTime.now(clock);
        double quality = qualityScorer.score(url, title, content);

        ScrapedUrl entry = scrapedUrlRepository.findByUrlHashAndCompanyName(hash, company)
                .orElseGet(() -> ScrapedUrl.builder()
                        .url(url)
                        .urlHash(hash)
                        .domain(domainOf(url))
                        .companyName(company)
                        .roleTitle(role)
                        .country(country)
                        .firstScrapedAt(now)
                        .build());

        entry.setTitle(TextLimits.truncate(title, 990));
        entry.setFullContent(content);
        entry.setContentSummary(TextLimits.truncate(content, cacheConfig.getSummaryChars()));
        entry.setContentType(qualityScorer.classify(url, title));
        entry.setQualityScore(quality);
        entry.setUpdatedAt(now);

        try {
            return scrapedUrlRepository.save(entry);
        } catch (DataIntegrityViolationException e) {
            // another job inserted the same (hash, company) first
            log.debug("Concurrent insert of {} for {}, reusing existing entry", url, company);
            Optional<ScrapedUrl> existing = scrapedUrlRepository.findByUrlHashAndCompanyName(hash, company);
            return existing.orElseThrow(() -> e);
        }
    }

    public static String hashUrl(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.trim().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String domainOf(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) {
                return "unknown";
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return "unknown";
        }
    }

    private static boolean matchesRole(ScrapedUrl entry, String role) {
        if (isBlank(role)) {
            return true;
        }
        return entry.getRoleTitle() != null
                && entry.getRoleTitle().toLowerCase(Locale.ROOT).contains(role.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean matchesCountry(ScrapedUrl entry, String country) {
        if (isBlank(country) || entry.getCountry() == null) {
            return true;
        }
        return entry.getCountry().toLowerCase(Locale.ROOT).contains(country.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
