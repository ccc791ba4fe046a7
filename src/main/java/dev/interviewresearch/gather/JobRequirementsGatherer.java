package dev.interviewresearch.gather;

import com.fasterxml.jackson.databind.JsonNode;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.cache.CachedContent;
import dev.interviewresearch.cache.ContentReuseCache;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.config.GatherConfig;
import dev.interviewresearch.entity.UsageType;
import dev.interviewresearch.error.ResearchException;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.model.GathererKey;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.search.ExtractedPage;
import dev.interviewresearch.search.SearchClient;
import dev.interviewresearch.support.JsonResponseParser;
import dev.interviewresearch.support.TextLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Job posting research: reads the role links (cached text where available, extraction
 * otherwise) and turns them into structured requirements.
 */
@Slf4j
@Component
public class JobRequirementsGatherer extends AbstractGatherer {

    private static final String SYSTEM_PROMPT = """
            You are an expert job requirements analyst. Extract the concrete requirements,
            responsibilities and interview signals from the job descriptions provided.
            Respond with a single JSON object only.
            """;

    private static final String OUTPUT_SCHEMA = """
            Return this JSON structure:
            {
              "technical_skills": ["string"],
              "soft_skills": ["string"],
              "experience_level": "string",
              "responsibilities": ["string"],
              "qualifications": ["string"],
              "nice_to_have": ["string"],
              "company_culture_hints": ["string"],
              "interview_process_hints": ["string"]
            }
            """;

    private final SearchClient searchClient;
    private final ContentReuseCache cache;
    private final GatherConfig gatherConfig;
    private final ResearchMetrics metrics;

    public JobRequirementsGatherer(CompletionClient completionClient, CompletionConfig completionConfig,
                                   JsonResponseParser jsonParser, SearchClient searchClient,
                                   ContentReuseCache cache, GatherConfig gatherConfig, ResearchMetrics metrics) {
        super(completionClient, completionConfig, jsonParser);
        this.searchClient = searchClient;
        this.cache = cache;
        this.gatherConfig = gatherConfig;
        this.metrics = metrics;
    }

    @Override
    public GathererKey getKey() {
        return GathererKey.JOB_REQUIREMENTS;
    }

    @Override
    protected Duration getTimeout() {
        return gatherConfig.getJobAnalysisTimeout();
    }

    @Override
    protected boolean appliesTo(ResearchRequest request) {
        return request.hasRoleLinks();
    }

    @Override
    protected Mono<JsonNode> doGather(ResearchRequest request, String searchId) {
        List<String> links = request.getRoleLinks().stream()
                .filter(link -> link != null && !link.isBlank())
                .map(String::trim)
                .distinct()
                .limit(gatherConfig.getMaxRoleLinks())
                .toList();
        logPhase(searchId, "discovery", links.size() + " role links");

        return cache.getContent(links, request.getCompany(), request.getRole(), request.getCountry())
                .flatMap(cached -> {
                    if (cached.isEmpty()) {
                        metrics.recordCacheMiss();
                    } else {
                        metrics.recordCacheHits(cached.size());
                    }
                    Set<String> cachedUrls = cached.stream().map(CachedContent::url).collect(Collectors.toSet());
                    List<String> missing = links.stream().filter(link -> !cachedUrls.contains(link)).toList();

                    return Mono.zip(extractMissing(missing, request, searchId),
                                    markReused(cached, searchId).thenReturn(Boolean.TRUE))
                            .map(tuple -> orderByLinks(links, cached, tuple.getT1()));
                })
                .flatMap(descriptions -> {
                    logPhase(searchId, "analysis", descriptions.size() + " job descriptions");
                    if (descriptions.isEmpty()) {
                        return Mono.<JsonNode>error(new ResearchException("NO_RESEARCH_CONTENT",
                                "No job description could be read from the role links"));
                    }
                    return analyze("job analysis", SYSTEM_PROMPT, buildUserPrompt(request, descriptions),
                            completionConfig.getMaxTokens().getJobAnalysis());
                })
                .doOnNext(result -> logPhase(searchId, "result", "job requirements ready"));
    }

    private Mono<List<ExtractedPage>> extractMissing(List<String> missing, ResearchRequest request,
                                                     String searchId) {
        if (missing.isEmpty()) {
            return Mono.just(List.of());
        }
        if (!searchClient.isEnabled()) {
            log.warn("[{}] Search credential missing, {} role links cannot be read", searchId, missing.size());
            return Mono.just(List.of());
        }
        logPhase(searchId, "extraction", missing.size() + " urls");
        return searchClient.extract(missing)
                .onErrorResume(e -> Mono.just(List.of()))
                .flatMap(pages -> Flux.fromIterable(pages)
                        .flatMap(page -> cache.store(page.url(), null, page.content(), request.getCompany(),
                                        request.getRole(), request.getCountry())
                                .flatMap(entry -> cache.recordUsage(searchId, entry.entryId(),
                                        UsageType.FRESH_SCRAPE, entry.qualityScore())))
                        .then(Mono.just(pages)));
    }

    private Mono<Void> markReused(List<CachedContent> cached, String searchId) {
        return Flux.fromIterable(cached)
                .flatMap(entry -> Mono.when(
                        cache.incrementReuse(entry.entryId()),
                        cache.recordUsage(searchId, entry.entryId(), UsageType.REUSED, entry.qualityScore())))
                .then();
    }

    /**
     * Description text per link, in the order the links were given.
     */
    private static List<String> orderByLinks(List<String> links, List<CachedContent> cached,
                                             List<ExtractedPage> extracted) {
        Map<String, String> byUrl = new LinkedHashMap<>();
        cached.forEach(c -> byUrl.put(c.url(), c.content()));
        extracted.forEach(p -> byUrl.putIfAbsent(p.url(), p.content()));

        List<String> descriptions = new ArrayList<>();
        for (String link : links) {
            String content = byUrl.get(link);
            if (content != null && !content.isBlank()) {
                descriptions.add(content);
            }
        }
        return descriptions;
    }

    private String buildUserPrompt(ResearchRequest request, List<String> descriptions) {
        StringBuilder prompt = new StringBuilder()
                .append("Company: ").append(request.getCompany()).append('\n')
                .append("Role: ").append(request.getRole() != null ? request.getRole() : "Not specified")
                .append("\n\n");
        for (int i = 0; i < descriptions.size(); i++) {
            prompt.append("Job Description ").append(i + 1).append(":\n")
                    .append(TextLimits.truncate(descriptions.get(i), gatherConfig.getJobDescriptionChars()))
                    .append("\n\n");
        }
        return prompt.append(OUTPUT_SCHEMA).toString();
    }
}
