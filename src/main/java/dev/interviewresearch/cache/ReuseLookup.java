package dev.interviewresearch.cache;

import java.util.List;

/**
 * Result of a reuse lookup: best entries first, plus domains already covered well enough
 * that a fresh search can leave them out.
 */
public record ReuseLookup(List<ReusableUrl> entries, List<String> excludedDomains) {

    public static ReuseLookup empty() {
        return new ReuseLookup(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> urls() {
        return entries.stream().map(ReusableUrl::url).toList();
    }
}
