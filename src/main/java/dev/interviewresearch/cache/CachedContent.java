package dev.interviewresearch.cache;

/**
 * Full text of a cache entry, ready to be placed into a research context.
 */
public record CachedContent(
        String entryId,
        String url,
        String title,
        String content,
        double qualityScore) {
}
