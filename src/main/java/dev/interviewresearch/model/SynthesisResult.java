package dev.interviewresearch.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured output of the synthesis call. Questions are keyed by category in the order
 * the completion listed them.
 */
public record SynthesisResult(
        List<InterviewStagePlan> stages,
        Map<String, List<QuestionPlan>> questionsByCategory,
        JsonNode comparisonAnalysis,
        JsonNode preparationGuidance,
        JsonNode stagesJson,
        JsonNode questionsJson,
        SynthesisMetadata metadata) {

    /**
     * Empty result used when the completion text could not be read as JSON.
     */
    public static SynthesisResult fallback(SynthesisMetadata metadata) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        return new SynthesisResult(
                List.of(),
                new LinkedHashMap<>(),
                nodes.objectNode(),
                nodes.objectNode(),
                nodes.arrayNode(),
                nodes.objectNode(),
                metadata.withFallback());
    }

    public int totalQuestions() {
        return questionsByCategory.values().stream().mapToInt(List::size).sum();
    }

    public Double overallFitScore() {
        JsonNode score = comparisonAnalysis.path("overall_fit_score");
        return score.isNumber() ? score.asDouble() : 0.0;
    }

    public List<String> preparationPriorities() {
        JsonNode priorities = preparationGuidance.path("preparation_priorities");
        if (!priorities.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        priorities.forEach(p -> {
            if (p.isTextual() && !p.asText().isBlank()) {
                values.add(p.asText());
            }
        });
        return values;
    }

    public boolean fallbackUsed() {
        return metadata.fallbackUsed();
    }
}
