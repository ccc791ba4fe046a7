package dev.interviewresearch.cache;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic quality score in [0,1] for a fetched document, plus a coarse content type.
 */
@Component
public class ContentQualityScorer {

    private static final List<String> TRUSTED_DOMAINS = List.of(
            "glassdoor.com", "blind.teamblind.com", "levels.fyi", "leetcode.com",
            "reddit.com", "1point3acres.com", "interviewing.io");

    private static final List<String> EXPERIENCE_MARKERS = List.of(
            "i interviewed at", "my interview experience", "interview rounds", "they asked me",
            "the interviewer", "phone screen", "onsite", "coding challenge", "system design",
            "behavioral questions", "take-home", "hiring manager");

    public double score(String url, String title, String content) {
        String text = lower(content);
        String lowerTitle = lower(title);
        double score = 0.3;

        int length = text.length();
        if (length > 500) score += 0.1;
        if (length > 2000) score += 0.1;

        int markers = 0;
        for (String marker : EXPERIENCE_MARKERS) {
            if (text.contains(marker) || lowerTitle.contains(marker)) {
                markers++;
            }
        }
        score += Math.min(0.3, markers * 0.05);

        String lowerUrl = lower(url);
        if (TRUSTED_DOMAINS.stream().anyMatch(lowerUrl::contains)) {
            score += 0.2;
        }
        if (lowerTitle.contains("interview")) {
            score += 0.05;
        }

        return Math.min(1.0, Math.round(score * 100) / 100.0);
    }

    public String classify(String url, String title) {
        String lowerUrl = lower(url);
        String lowerTitle = lower(title);
        if (lowerUrl.contains("glassdoor.com") && lowerUrl.contains("/interview")) {
            return "interview_review";
        }
        if (lowerUrl.contains("reddit.com") || lowerUrl.contains("teamblind.com")
                || lowerUrl.contains("1point3acres.com") || lowerUrl.contains("leetcode.com/discuss")) {
            return "forum_post";
        }
        if (lowerUrl.contains("/jobs/") || lowerUrl.contains("/careers") || lowerTitle.contains("job description")) {
            return "job_posting";
        }
        if (lowerTitle.contains("interview")) {
            return "interview_review";
        }
        return "general";
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
