package dev.interviewresearch.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.ai.CompletionRequest;
import dev.interviewresearch.config.SynthesisConfig;
import dev.interviewresearch.error.MalformedResponseException;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.InterviewStagePlan;
import dev.interviewresearch.model.QuestionPlan;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.model.SynthesisMetadata;
import dev.interviewresearch.model.SynthesisResult;
import dev.interviewresearch.support.JsonResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One consolidated completion call that turns the gathered research into stages, questions,
 * a CV comparison and preparation guidance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynthesisEngine {

    private final CompletionClient completionClient;
    private final SynthesisPromptBuilder promptBuilder;
    private final JsonResponseParser jsonParser;
    private final SynthesisConfig synthesisConfig;
    private final Clock clock;

    /**
     * Empty when the completion service could not be reached after retries.
     * Unreadable output yields the fallback result instead.
     */
    public Mono<SynthesisResult> synthesize(ResearchRequest request, GatheredResearch gathered) {
        return Mono.defer(() -> {
            SynthesisMetadata metadata = new SynthesisMetadata(completionClient.getDefaultModel(),
                    synthesisConfig.getMaxTokens(), Instant.now(clock), false);
            CompletionRequest completion = new CompletionRequest(
                    "synthesis",
                    null,
                    promptBuilder.systemPrompt(),
                    promptBuilder.userPrompt(request, gathered),
                    synthesisConfig.getMaxTokens(),
                    true,
                    synthesisConfig.getTimeout());

            log.info("Synthesizing from {}/3 sources with {} (max tokens {})",
                    gathered.availableSources(), metadata.model(), metadata.maxTokens());

            return completionClient.complete(completion)
                    .map(content -> toResult(content, metadata))
                    .onErrorResume(MalformedResponseException.class, e -> {
                        log.warn("Synthesis returned no usable content, using fallback: {}", e.getMessage());
                        return Mono.just(SynthesisResult.fallback(metadata));
                    })
                    .doOnNext(result -> log.info("Synthesis complete: {} stages, {} questions{}",
                            result.stages().size(), result.totalQuestions(),
                            result.fallbackUsed() ? " (fallback)" : ""))
                    .onErrorResume(e -> {
                        log.error("Synthesis call failed: {}", e.getMessage());
                        return Mono.empty();
                    });
        });
    }

    SynthesisResult toResult(String content, SynthesisMetadata metadata) {
        Optional<JsonNode> parsed = jsonParser.parse(content);
        if (parsed.isEmpty()) {
            return SynthesisResult.fallback(metadata);
        }
        JsonNode root = parsed.get();
        JsonNodeFactory nodes = JsonNodeFactory.instance;

        JsonNode stagesJson = root.path("interview_stages").isArray() ? root.get("interview_stages") : nodes.arrayNode();
        JsonNode questionsJson = root.path("interview_questions_data").isObject()
                ? root.get("interview_questions_data") : nodes.objectNode();
        JsonNode comparison = root.path("comparison_analysis").isObject()
                ? root.get("comparison_analysis") : nodes.objectNode();
        JsonNode guidance = root.path("preparation_guidance").isObject()
                ? root.get("preparation_guidance") : nodes.objectNode();

        return new SynthesisResult(
                readStages(stagesJson),
                readQuestions(questionsJson),
                comparison,
                guidance,
                stagesJson,
                questionsJson,
                metadata);
    }

    private static List<InterviewStagePlan> readStages(JsonNode stagesJson) {
        List<InterviewStagePlan> stages = new ArrayList<>();
        int index = 0;
        for (JsonNode stage : stagesJson) {
            index++;
            if (!stage.isObject()) {
                continue;
            }
            int order = stage.path("order_index").asInt(0);
            stages.add(new InterviewStagePlan(
                    text(stage, "name", "Stage " + index),
                    order > 0 ? order : index,
                    text(stage, "duration", null),
                    text(stage, "interviewer", null),
                    text(stage, "content", null),
                    text(stage, "guidance", null),
                    textList(stage, "preparation_tips"),
                    textList(stage, "common_questions"),
                    textList(stage, "red_flags_to_avoid")));
        }
        return stages;
    }

    private static Map<String, List<QuestionPlan>> readQuestions(JsonNode questionsJson) {
        Map<String, List<QuestionPlan>> byCategory = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = questionsJson.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                continue;
            }
            List<QuestionPlan> questions = new ArrayList<>();
            for (JsonNode q : field.getValue()) {
                String question = text(q, "question", null);
                if (question == null || question.isBlank()) {
                    continue;
                }
                JsonNode confidence = q.path("confidence_score");
                questions.add(new QuestionPlan(
                        question,
                        field.getKey(),
                        text(q, "difficulty", null),
                        text(q, "rationale", ""),
                        text(q, "suggested_answer_approach", ""),
                        textList(q, "evaluation_criteria"),
                        textList(q, "follow_up_questions"),
                        q.path("star_story_fit").asBoolean(false),
                        text(q, "company_context", ""),
                        confidence.isNumber() ? confidence.asDouble() : null));
            }
            byCategory.put(field.getKey(), questions);
        }
        return byCategory;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : fallback;
    }

    private static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> values = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(item -> {
                if (item.isValueNode() && !item.isNull()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }
}
