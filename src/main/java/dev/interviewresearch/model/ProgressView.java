package dev.interviewresearch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.interviewresearch.entity.SearchStatus;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * What a polling client sees of a job.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressView(
        String searchId,
        SearchStatus status,
        String step,
        int percentage,
        String error,
        boolean stalled,
        long stalledSeconds,
        boolean retryOffered,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime updatedAt) {
}
