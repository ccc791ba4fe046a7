package dev.interviewresearch.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(
        String query,
        String answer,
        List<SearchHit> results) {

    public List<SearchHit> hits() {
        return results != null ? results : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchHit(
            String title,
            String url,
            String content,
            @JsonProperty("raw_content") String rawContent,
            double score,
            @JsonProperty("published_date") String publishedDate) {
    }
}
