package dev.interviewresearch.cache;

/**
 * Cache entry returned by a reuse lookup, without its full text.
 */
public record ReusableUrl(
        String entryId,
        String url,
        String domain,
        String title,
        double qualityScore,
        int timesReused) {
}
