package dev.interviewresearch.search;

import lombok.Builder;

import java.util.List;

/**
 * One discovery query with its domain filters.
 */
@Builder
public record SearchRequest(
        String query,
        String searchDepth,
        int maxResults,
        boolean includeAnswer,
        boolean includeRawContent,
        List<String> includeDomains,
        List<String> excludeDomains,
        String timeRange) {
}
