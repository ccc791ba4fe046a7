package dev.interviewresearch.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.interviewresearch.entity.InterviewQuestion;
import dev.interviewresearch.entity.InterviewStage;
import dev.interviewresearch.entity.SearchStatus;

import java.util.List;

/**
 * Saved interview preparation of one search: stages with their questions plus the
 * comparison and guidance documents.
 */
public record ResearchResults(
        String searchId,
        SearchStatus status,
        String company,
        String role,
        Double overallFitScore,
        List<String> preparationPriorities,
        List<StageWithQuestions> stages,
        JsonNode comparisonAnalysis,
        JsonNode preparationGuidance) {

    public record StageWithQuestions(InterviewStage stage, List<InterviewQuestion> questions) {
    }
}
