package dev.interviewresearch.search;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for the web search and page extraction service used by the gatherers.
 */
public interface SearchClient {

    /**
     * Run one discovery query.
     */
    Mono<SearchResponse> search(SearchRequest request);

    /**
     * Fetch the readable text of the given pages. Pages the service could not read are left out.
     */
    Mono<List<ExtractedPage>> extract(List<String> urls);

    /**
     * Check if the search credential is configured.
     */
    boolean isEnabled();
}
