package dev.interviewresearch.cache;

import dev.interviewresearch.config.SearchConfig;
import dev.interviewresearch.search.SearchResponse.SearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores search hits by how likely they are to describe real interview experiences and
 * picks the ones worth a deep extraction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UrlRanker {

    private static final List<String> INTERVIEW_PATTERNS = List.of(
            "/interview", "blind.teamblind.com", "1point3acres.com", "levels.fyi",
            "reddit.com/r/cscareerquestions", "reddit.com/r/experienceddevs", "reddit.com/r/itcareerquestions",
            "leetcode.com/discuss", "interviewing.io", "interview");

    private static final List<String> EXPERIENCE_PATTERNS = List.of(
            "i interviewed at", "just finished my", "my interview experience", "went through the process",
            "interview rounds were", "they asked me", "the interviewer", "phone screen", "onsite interview",
            "virtual interview", "coding challenge", "system design", "behavioral questions");

    private static final Map<String, Integer> PRIORITY_DOMAINS = Map.of(
            "glassdoor.com/interview", 5,
            "blind.teamblind.com", 4,
            "levels.fyi", 3,
            "reddit.com/r/cscareerquestions", 3,
            "1point3acres.com", 2,
            "leetcode.com/discuss", 2);

    private final SearchConfig searchConfig;

    public int score(SearchHit hit) {
        String url = lower(hit.url());
        String title = lower(hit.title());
        String content = lower(hit.content());
        int score = 0;

        for (String pattern : INTERVIEW_PATTERNS) {
            if (url.contains(pattern)) score += 3;
            if (title.contains(pattern)) score += 2;
            if (content.contains(pattern)) score += 1;
        }
        for (String pattern : EXPERIENCE_PATTERNS) {
            if (title.contains(pattern)) score += 2;
            if (content.contains(pattern)) score += 1;
        }
        for (Map.Entry<String, Integer> domain : PRIORITY_DOMAINS.entrySet()) {
            if (url.contains(domain.getKey())) {
                score += domain.getValue();
            }
        }
        if (title.contains("2024") || title.contains("2025") || content.contains("2024") || content.contains("2025")) {
            score += 2;
        }
        return score;
    }

    /**
     * Best URLs first, each at or above the minimum score, skipping {@code exclude}.
     */
    public List<String> rank(Collection<SearchHit> hits, Collection<String> exclude) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            if (hit.url() == null || exclude.contains(hit.url())) {
                continue;
            }
            int score = score(hit);
            if (score >= searchConfig.getMinUrlScore()) {
                scores.merge(hit.url(), score, Math::max);
            }
        }

        List<String> ranked = scores.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .limit(searchConfig.getExtractLimit())
                .toList();

        log.debug("URL ranking: {} qualifying urls, keeping top {}", scores.size(), ranked.size());
        return ranked;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
