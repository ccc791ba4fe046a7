package dev.interviewresearch.gather;

import com.fasterxml.jackson.databind.JsonNode;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.cache.CachedContent;
import dev.interviewresearch.cache.ContentReuseCache;
import dev.interviewresearch.cache.ReuseLookup;
import dev.interviewresearch.cache.UrlRanker;
import dev.interviewresearch.config.CacheConfig;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.config.GatherConfig;
import dev.interviewresearch.config.SearchConfig;
import dev.interviewresearch.entity.UsageType;
import dev.interviewresearch.error.ResearchException;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.model.GathererKey;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.search.ExtractedPage;
import dev.interviewresearch.search.SearchClient;
import dev.interviewresearch.search.SearchRequest;
import dev.interviewresearch.search.SearchResponse;
import dev.interviewresearch.search.SearchResponse.SearchHit;
import dev.interviewresearch.support.JsonResponseParser;
import dev.interviewresearch.support.TextLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Company interview research: cached documents first, then discovery queries against the
 * search service, deep extraction of the best interview URLs and one analysis call.
 */
@Slf4j
@Component
public class CompanyResearchGatherer extends AbstractGatherer {

    private static final String SYSTEM_PROMPT = """
            You are an expert company research analyst specializing in interview preparation.
            Based on the provided research data from Glassdoor, Blind, Reddit, LinkedIn and other sources,
            extract company insights with focus on recent interview experiences.

            Priorities:
            1. Extract every specific interview question candidates report.
            2. Describe the interview process: number of rounds, what each round covers, duration and interviewer.
            3. Capture culture and values as they show up in interviews, plus red flags and success factors.

            Base the interview stages on candidate reports in the research data, not on generic assumptions.
            Respond with a single JSON object only.
            """;

    private static final String OUTPUT_SCHEMA = """
            Return this JSON structure:
            {
              "industry": "string",
              "culture": ["string"],
              "values": ["string"],
              "interview_philosophy": "string",
              "recent_hiring_trends": ["string"],
              "interview_stages": [
                {"name": "string", "order_index": 1, "duration": "string", "interviewer": "string",
                 "content": "string", "typical_questions": ["string"], "success_tips": ["string"]}
              ],
              "interview_experiences": {
                "positive_feedback": ["string"], "negative_feedback": ["string"],
                "common_themes": ["string"], "difficulty_rating": "string", "process_duration": "string"
              },
              "interview_questions_bank": {
                "behavioral": ["string"], "technical": ["string"], "situational": ["string"], "company_specific": ["string"]
              },
              "red_flags": ["string"],
              "success_factors": ["string"]
            }
            """;

    private final SearchClient searchClient;
    private final ContentReuseCache cache;
    private final UrlRanker urlRanker;
    private final SearchConfig searchConfig;
    private final CacheConfig cacheConfig;
    private final GatherConfig gatherConfig;
    private final ResearchMetrics metrics;

    public CompanyResearchGatherer(CompletionClient completionClient, CompletionConfig completionConfig,
                                   JsonResponseParser jsonParser, SearchClient searchClient,
                                   ContentReuseCache cache, UrlRanker urlRanker, SearchConfig searchConfig,
                                   CacheConfig cacheConfig, GatherConfig gatherConfig, ResearchMetrics metrics) {
        super(completionClient, completionConfig, jsonParser);
        this.searchClient = searchClient;
        this.cache = cache;
        this.urlRanker = urlRanker;
        this.searchConfig = searchConfig;
        this.cacheConfig = cacheConfig;
        this.gatherConfig = gatherConfig;
        this.metrics = metrics;
    }

    @Override
    public GathererKey getKey() {
        return GathererKey.COMPANY_RESEARCH;
    }

    @Override
    protected Duration getTimeout() {
        return gatherConfig.getCompanyResearchTimeout();
    }

    @Override
    protected boolean appliesTo(ResearchRequest request) {
        return request.getCompany() != null && !request.getCompany().isBlank();
    }

    @Override
    protected Mono<JsonNode> doGather(ResearchRequest request, String searchId) {
        String company = request.getCompany();
        logPhase(searchId, "cache_check", company);

        return cache.findReusable(company, request.getRole(), request.getCountry(),
                        cacheConfig.getMaxAgeDays(), cacheConfig.getMinQuality())
                .flatMap(lookup -> hydrate(lookup, request)
                        .flatMap(cached -> Mono.zip(
                                        discover(request, searchId, lookup, cached),
                                        markReused(cached, searchId).thenReturn(Boolean.TRUE))
                                .flatMap(tuple -> {
                                    Discovery discovery = tuple.getT1();
                                    logPhase(searchId, "analysis", String.format("%d cached, %d fresh, %d extracted",
                                            cached.size(), discovery.hits().size(), discovery.pages().size()));
                                    String context = buildResearchContext(cached, discovery);
                                    if (context.isBlank()) {
                                        return Mono.<JsonNode>error(new ResearchException("NO_RESEARCH_CONTENT",
                                                "No research material found for " + company));
                                    }
                                    return analyze("company research", SYSTEM_PROMPT,
                                            buildUserPrompt(request, context),
                                            completionConfig.getMaxTokens().getCompanyAnalysis());
                                })))
                .doOnNext(result -> logPhase(searchId, "result", "company insights ready"));
    }

    private Mono<List<CachedContent>> hydrate(ReuseLookup lookup, ResearchRequest request) {
        if (lookup.isEmpty()) {
            metrics.recordCacheMiss();
            return Mono.just(List.of());
        }
        List<String> urls = lookup.urls().stream().limit(cacheConfig.getHydrateLimit()).toList();
        return cache.getContent(urls, request.getCompany(), request.getRole(), request.getCountry())
                .doOnNext(cached -> {
                    if (cached.isEmpty()) {
                        metrics.recordCacheMiss();
                    } else {
                        metrics.recordCacheHits(cached.size());
                    }
                });
    }

    private Mono<Discovery> discover(ResearchRequest request, String searchId, ReuseLookup lookup,
                                     List<CachedContent> cached) {
        long highQuality = cached.stream()
                .filter(c -> c.qualityScore() > cacheConfig.getHighQualityFloor())
                .count();
        if (highQuality >= cacheConfig.getSkipFreshSearchThreshold()) {
            logPhase(searchId, "discovery", "skipped, " + highQuality + " high quality cached sources");
            return Mono.just(Discovery.none());
        }
        if (!searchClient.isEnabled()) {
            log.warn("[{}] Search credential missing, company research uses cached content only", searchId);
            return Mono.just(Discovery.none());
        }

        List<String> queries = buildQueries(request);
        logPhase(searchId, "discovery", queries.size() + " queries");

        Set<String> cachedUrls = cached.stream().map(CachedContent::url).collect(Collectors.toSet());
        return Flux.fromIterable(queries)
                .flatMap(query -> searchClient.search(searchRequest(query, lookup.excludedDomains()))
                        .map(SearchResponse::hits)
                        .onErrorResume(e -> Mono.just(List.of())))
                .flatMapIterable(hits -> hits)
                .collectList()
                .flatMap(hits -> storeFresh(hits, request, searchId)
                        .then(extract(hits, cachedUrls, request, searchId))
                        .map(pages -> new Discovery(hits, pages)));
    }

    private Mono<List<ExtractedPage>> extract(List<SearchHit> hits, Set<String> cachedUrls,
                                              ResearchRequest request, String searchId) {
        List<String> ranked = urlRanker.rank(hits, cachedUrls);
        logPhase(searchId, "extraction", ranked.size() + " urls");
        if (ranked.isEmpty()) {
            return Mono.just(List.of());
        }
        return searchClient.extract(ranked)
                .onErrorResume(e -> Mono.just(List.of()))
                .flatMap(pages -> Flux.fromIterable(pages)
                        .flatMap(page -> storeAndRecord(page.url(), null, page.content(), request, searchId))
                        .then(Mono.just(pages)));
    }

    private Mono<Void> storeFresh(List<SearchHit> hits, ResearchRequest request, String searchId) {
        return Flux.fromIterable(hits)
                .filter(hit -> hit.content() != null && !hit.content().isBlank())
                .flatMap(hit -> storeAndRecord(hit.url(), hit.title(), hit.content(), request, searchId))
                .then();
    }

    private Mono<Void> storeAndRecord(String url, String title, String content, ResearchRequest request,
                                      String searchId) {
        return cache.store(url, title, content, request.getCompany(), request.getRole(), request.getCountry())
                .flatMap(entry -> cache.recordUsage(searchId, entry.entryId(), UsageType.FRESH_SCRAPE,
                        entry.qualityScore()));
    }

    private Mono<Void> markReused(List<CachedContent> cached, String searchId) {
        return Flux.fromIterable(cached)
                .flatMap(entry -> Mono.when(
                        cache.incrementReuse(entry.entryId()),
                        cache.recordUsage(searchId, entry.entryId(), UsageType.REUSED, entry.qualityScore())))
                .then();
    }

    private SearchRequest searchRequest(String query, Collection<String> excludedDomains) {
        List<String> include = searchConfig.getAllowedDomains().stream()
                .filter(domain -> !excludedDomains.contains(domain))
                .toList();
        return SearchRequest.builder()
                .query(query)
                .searchDepth(searchConfig.getSearchDepth())
                .maxResults(searchConfig.getMaxResults())
                .includeAnswer(true)
                .includeRawContent(false)
                .includeDomains(include)
                .excludeDomains(List.copyOf(excludedDomains))
                .timeRange(searchConfig.getTimeRange())
                .build();
    }

    /**
     * Fill the configured query templates for the subject, first templates first.
     */
    List<String> buildQueries(ResearchRequest request) {
        String company = request.getCompany().trim();
        String ticker = searchConfig.getCompanyTickers()
                .getOrDefault(company.toLowerCase(Locale.ROOT), company.toUpperCase(Locale.ROOT));
        return searchConfig.getQueryTemplates().stream()
                .map(template -> template
                        .replace("{company}", company)
                        .replace("{role}", valueOrEmpty(request.getRole()))
                        .replace("{country}", valueOrEmpty(request.getCountry()))
                        .replace("{ticker}", ticker)
                        .replaceAll("\\s+", " ")
                        .trim())
                .distinct()
                .limit(searchConfig.getDiscoveryQueries())
                .toList();
    }

    /**
     * Research context with per-source budgets and an overall cap.
     */
    String buildResearchContext(List<CachedContent> cached, Discovery discovery) {
        StringBuilder context = new StringBuilder();
        int total = gatherConfig.getContextChars();

        for (CachedContent entry : cached) {
            appendSource(context, entry.url(), entry.content(), gatherConfig.getSourceSnippetChars(), total);
        }
        for (SearchHit hit : discovery.hits()) {
            appendSource(context, hit.url(), hit.content(), gatherConfig.getSourceSnippetChars(), total);
        }
        for (ExtractedPage page : discovery.pages()) {
            appendSource(context, page.url(), page.content(), gatherConfig.getDeepExtractChars(), total);
        }
        return context.toString();
    }

    private static void appendSource(StringBuilder context, String url, String content, int sourceChars, int total) {
        if (content == null || content.isBlank()) {
            return;
        }
        int available = TextLimits.remaining(total, context.length());
        if (available <= 0) {
            return;
        }
        String block = "SOURCE-START\n" + url + "\n" + TextLimits.truncate(content, sourceChars) + "\nSOURCE-END\n\n";
        context.append(block.length() > available ? block.substring(0, available) : block);
    }

    private static String buildUserPrompt(ResearchRequest request, String context) {
        return String.format("""
                Company: %s
                Role: %s
                Country: %s

                Research data:
                %s

                %s
                """,
                request.getCompany(),
                request.getRole() != null ? request.getRole() : "Not specified",
                request.getCountry() != null ? request.getCountry() : "Not specified",
                context,
                OUTPUT_SCHEMA);
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }

    record Discovery(List<SearchHit> hits, List<ExtractedPage> pages) {
        static Discovery none() {
            return new Discovery(List.of(), List.of());
        }
    }
}
