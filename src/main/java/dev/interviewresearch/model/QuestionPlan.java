package dev.interviewresearch.model;

import java.util.List;

/**
 * One synthesized interview question as the completion returned it.
 * Difficulty is the raw value; normalization happens when the row is written.
 */
public record QuestionPlan(
        String question,
        String category,
        String difficulty,
        String rationale,
        String suggestedAnswerApproach,
        List<String> evaluationCriteria,
        List<String> followUpQuestions,
        boolean starStoryFit,
        String companyContext,
        Double confidenceScore) {
}
