package dev.interviewresearch.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.interviewresearch.config.SearchConfig;
import dev.interviewresearch.error.ConfigurationMissingException;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.support.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * SearchClient backed by the Tavily search and extract endpoints.
 */
@Slf4j
@Service
public class TavilySearchClient implements SearchClient {

    private static final String SERVICE = "tavily";

    private final WebClient webClient;
    private final SearchConfig config;
    private final RetryPolicy retryPolicy;
    private final ResearchMetrics metrics;

    public TavilySearchClient(WebClient.Builder webClientBuilder, SearchConfig config,
                              RetryPolicy retryPolicy, ResearchMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder.clone()
                .baseUrl(Objects.requireNonNull(config.getBaseUrl()))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;

        if (!isEnabled()) {
            log.warn("Tavily API key is missing! Gatherers will only use cached content.");
        }
    }

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        if (!isEnabled()) {
            return Mono.error(new ConfigurationMissingException("Tavily API key is not configured"));
        }

        SearchPayload payload = new SearchPayload(
                request.query(),
                request.searchDepth() != null ? request.searchDepth() : config.getSearchDepth(),
                request.maxResults() > 0 ? request.maxResults() : config.getMaxResults(),
                request.includeAnswer(),
                request.includeRawContent(),
                emptyToNull(request.includeDomains()),
                emptyToNull(request.excludeDomains()),
                request.timeRange());

        Mono<SearchResponse> call = Mono.defer(() -> {
            metrics.recordExternalCall(SERVICE);
            metrics.recordFreshSearch();
            return timedPost("/search", payload, SearchResponse.class, config.getSearchTimeout());
        });

        return retryPolicy.apply(call, "Tavily search '" + request.query() + "'")
                .doOnNext(response -> log.debug("Tavily search '{}' returned {} results",
                        request.query(), response.hits().size()))
                .doOnError(e -> {
                    metrics.recordExternalError(SERVICE);
                    log.warn("Tavily search '{}' failed: {}", request.query(), e.getMessage());
                });
    }

    @Override
    public Mono<List<ExtractedPage>> extract(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return Mono.just(List.of());
        }
        if (!isEnabled()) {
            return Mono.error(new ConfigurationMissingException("Tavily API key is not configured"));
        }

        Mono<ExtractResponse> call = Mono.defer(() -> {
            metrics.recordExternalCall(SERVICE);
            return timedPost("/extract", new ExtractPayload(urls, "advanced"), ExtractResponse.class,
                    config.getExtractTimeout());
        });

        return retryPolicy.apply(call, "Tavily extract (" + urls.size() + " urls)")
                .map(this::toPages)
                .doOnNext(pages -> log.debug("Tavily extracted {}/{} pages", pages.size(), urls.size()))
                .doOnError(e -> {
                    metrics.recordExternalError(SERVICE);
                    log.warn("Tavily extract of {} urls failed: {}", urls.size(), e.getMessage());
                });
    }

    @Override
    public boolean isEnabled() {
        return config.hasCredential();
    }

    private List<ExtractedPage> toPages(ExtractResponse response) {
        if (response == null || response.results() == null) {
            return List.of();
        }
        return response.results().stream()
                .filter(r -> r.url() != null)
                .map(r -> new ExtractedPage(r.url(), stripHtml(r.rawContent() != null ? r.rawContent() : r.content())))
                .filter(p -> !p.content().isBlank())
                .toList();
    }

    /**
     * Strip HTML tags from text.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Execute a timed POST request.
     */
    @SuppressWarnings("null")
    private <T, R> Mono<T> timedPost(String path, R body, Class<T> responseType, Duration timeout) {
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(timeout)
                .doOnTerminate(() -> log.debug("Tavily {} took {}ms", path, System.currentTimeMillis() - start));
    }

    private static List<String> emptyToNull(List<String> list) {
        return list == null || list.isEmpty() ? null : list;
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchPayload(
            String query,
            @JsonProperty("search_depth") String searchDepth,
            @JsonProperty("max_results") int maxResults,
            @JsonProperty("include_answer") boolean includeAnswer,
            @JsonProperty("include_raw_content") boolean includeRawContent,
            @JsonProperty("include_domains") List<String> includeDomains,
            @JsonProperty("exclude_domains") List<String> excludeDomains,
            @JsonProperty("time_range") String timeRange) {
    }

    record ExtractPayload(
            List<String> urls,
            @JsonProperty("extract_depth") String extractDepth) {
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractResponse(List<ExtractResult> results) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record ExtractResult(
                String url,
                String content,
                @JsonProperty("raw_content") String rawContent) {
        }
    }
}
