package dev.interviewresearch.search;

/**
 * Text of one deep-extracted page, HTML already stripped.
 */
public record ExtractedPage(String url, String content) {
}
