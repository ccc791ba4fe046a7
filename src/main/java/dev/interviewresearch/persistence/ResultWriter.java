package dev.interviewresearch.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.interviewresearch.entity.ArtifactStatus;
import dev.interviewresearch.entity.InterviewQuestion;
import dev.interviewresearch.entity.InterviewStage;
import dev.interviewresearch.entity.SearchArtifact;
import dev.interviewresearch.entity.SearchStatus;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.InterviewStagePlan;
import dev.interviewresearch.model.QuestionPlan;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.model.SynthesisMetadata;
import dev.interviewresearch.model.SynthesisResult;
import dev.interviewresearch.progress.ProgressHandle;
import dev.interviewresearch.progress.ProgressStep;
import dev.interviewresearch.repository.InterviewQuestionRepository;
import dev.interviewresearch.repository.InterviewStageRepository;
import dev.interviewresearch.repository.SearchArtifactRepository;
import dev.interviewresearch.repository.SearchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Writes the results of a run in checkpoints so that a failure late in the run keeps what
 * was already saved.
 *
 * <ol>
 *   <li>raw gatherer output (after gathering)</li>
 *   <li>synthesis output on the artifact row</li>
 *   <li>interview stage rows</li>
 *   <li>interview question rows, attached to the stages of 3</li>
 *   <li>final search update to completed</li>
 * </ol>
 * Checkpoints 1 to 4 are soft; checkpoint 5 fails the run when it fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultWriter {

    static final String RAW_ARTIFACTS = "raw_artifacts";
    static final String SYNTHESIS_ARTIFACTS = "synthesis_artifacts";
    static final String STAGES = "interview_stages";
    static final String QUESTIONS = "interview_questions";
    static final String SEARCH_COMPLETION = "search_completion";

    private static final Set<String> FIRST_STAGE_CATEGORIES = Set.of("behavioral", "cultural_fit");
    private static final Set<String> SECOND_STAGE_CATEGORIES = Set.of("technical", "role_specific");
    private static final Set<String> THIRD_STAGE_CATEGORIES = Set.of("situational", "experience_based");
    private static final double DEFAULT_CONFIDENCE = 0.8;

    private final SearchRepository searchRepository;
    private final SearchArtifactRepository artifactRepository;
    private final InterviewStageRepository stageRepository;
    private final InterviewQuestionRepository questionRepository;
    private final CheckpointGuard checkpointGuard;
    private final Clock clock;

    /**
     * Checkpoint 1: upsert the artifact row with the raw gatherer output.
     */
    public Mono<SearchArtifact> saveRawArtifacts(ProgressHandle handle, ResearchRequest request,
                                                 GatheredResearch gathered) {
        String searchId = handle.searchId();
        return checkpointGuard.soft(RAW_ARTIFACTS, searchId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            SearchArtifact artifact = artifactRepository.findBySearchId(searchId)
                    .orElseGet(() -> newArtifact(searchId, request.getUserId(), now));
            artifact.setCompanyResearchRaw(gathered.companyResearch());
            artifact.setJobAnalysisRaw(gathered.jobRequirements());
            artifact.setCvAnalysisRaw(gathered.cvAnalysis());
            artifact.setProcessingStatus(ArtifactStatus.RAW_DATA_SAVED);
            artifact.setProcessingRawSaveAt(now);
            artifact.setUpdatedAt(now);
            return artifactRepository.save(artifact);
        });
    }

    /**
     * Checkpoints 2 to 5. Emits true when the search was marked completed, false when it had
     * already reached a terminal state.
     */
    public Mono<Boolean> saveResults(ProgressHandle handle, ResearchRequest request, GatheredResearch gathered,
                                     SynthesisResult synthesis) {
        String searchId = handle.searchId();

        return checkpointGuard.soft(SYNTHESIS_ARTIFACTS, searchId,
                        () -> saveSynthesisArtifacts(searchId, request, gathered, synthesis))
                .then(checkpointGuard.soft(STAGES, searchId, () -> saveStages(searchId, synthesis.stages()))
                        .defaultIfEmpty(List.of()))
                .flatMap(stages -> checkpointGuard.soft(QUESTIONS, searchId,
                                () -> saveQuestions(searchId, stages, synthesis))
                        .defaultIfEmpty(0))
                .flatMap(saved -> handle.advance(ProgressStep.PERSIST_COMPLETE))
                .then(checkpointGuard.strict(SEARCH_COMPLETION, searchId, () -> completeSearch(searchId, synthesis)));
    }

    private SearchArtifact saveSynthesisArtifacts(String searchId, ResearchRequest request,
                                                  GatheredResearch gathered, SynthesisResult synthesis) {
        LocalDateTime now = LocalDateTime.now(clock);
        SearchArtifact artifact = artifactRepository.findBySearchId(searchId).orElseGet(() -> {
            log.warn("[{}] Artifact row missing at synthesis save, inserting it", searchId);
            SearchArtifact fresh = newArtifact(searchId, request.getUserId(), now);
            fresh.setCompanyResearchRaw(gathered.companyResearch());
            fresh.setJobAnalysisRaw(gathered.jobRequirements());
            fresh.setCvAnalysisRaw(gathered.cvAnalysis());
            return fresh;
        });

        artifact.setSynthesisMetadata(metadataJson(synthesis.metadata()));
        artifact.setComparisonAnalysis(synthesis.comparisonAnalysis());
        artifact.setInterviewStages(synthesis.stagesJson());
        artifact.setInterviewQuestionsData(synthesis.questionsJson());
        artifact.setPreparationGuidance(synthesis.preparationGuidance());
        artifact.setProcessingStatus(ArtifactStatus.COMPLETE);
        artifact.setProcessingSynthesisEndAt(now);
        artifact.setProcessingCompletedAt(now);
        artifact.setUpdatedAt(now);
        return artifactRepository.save(artifact);
    }

    private List<InterviewStage> saveStages(String searchId, List<InterviewStagePlan> plans) {
        if (plans.isEmpty()) {
            return List.of();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<InterviewStage> stages = plans.stream()
                .map(plan -> InterviewStage.builder()
                        .searchId(searchId)
                        .name(plan.name())
                        .orderIndex(plan.orderIndex())
                        .duration(plan.duration())
                        .interviewer(plan.interviewer())
                        .content(plan.content())
                        .guidance(plan.guidance())
                        .preparationTips(new ArrayList<>(plan.preparationTips()))
                        .commonQuestions(new ArrayList<>(plan.commonQuestions()))
                        .redFlagsToAvoid(new ArrayList<>(plan.redFlagsToAvoid()))
                        .createdAt(now)
                        .build())
                .toList();
        List<InterviewStage> saved = stageRepository.saveAll(stages);
        log.info("[{}] Interview stages saved ({})", searchId, saved.size());
        return saved;
    }

    private Integer saveQuestions(String searchId, List<InterviewStage> stages, SynthesisResult synthesis) {
        if (synthesis.totalQuestions() == 0) {
            return 0;
        }
        if (stages.isEmpty()) {
            throw new IllegalStateException("No interview stages were saved; cannot attach questions");
        }

        Map<Integer, String> stageIdByOrder = new TreeMap<>();
        stages.forEach(stage -> stageIdByOrder.putIfAbsent(stage.getOrderIndex(), stage.getId()));

        LocalDateTime now = LocalDateTime.now(clock);
        List<InterviewQuestion> questions = new ArrayList<>();
        synthesis.questionsByCategory().forEach((category, plans) -> {
            String stageId = stageIdFor(category, stageIdByOrder);
            for (QuestionPlan plan : plans) {
                questions.add(InterviewQuestion.builder()
                        .searchId(searchId)
                        .stageId(stageId)
                        .question(plan.question())
                        .category(category)
                        .questionType("synthesized")
                        .difficulty(normalizeDifficulty(plan.difficulty()))
                        .rationale(plan.rationale())
                        .suggestedAnswerApproach(plan.suggestedAnswerApproach())
                        .evaluationCriteria(new ArrayList<>(plan.evaluationCriteria()))
                        .followUpQuestions(new ArrayList<>(plan.followUpQuestions()))
                        .starStoryFit(plan.starStoryFit())
                        .companyContext(plan.companyContext())
                        .confidenceScore(plan.confidenceScore() != null && plan.confidenceScore() > 0
                                ? plan.confidenceScore() : DEFAULT_CONFIDENCE)
                        .createdAt(now)
                        .build());
            }
        });

        questionRepository.saveAll(questions);
        if (questions.size() < 20) {
            log.warn("[{}] Only {} questions were saved", searchId, questions.size());
        }
        return questions.size();
    }

    private Boolean completeSearch(String searchId, SynthesisResult synthesis) {
        int updated = searchRepository.markCompletedWithSummary(searchId, ProgressStep.COMPLETED.label(),
                LocalDateTime.now(clock), synthesis.overallFitScore(),
                new ArrayList<>(synthesis.preparationPriorities()), SearchStatus.TERMINAL);
        if (updated == 0) {
            log.warn("[{}] Search already terminal, completion not written", searchId);
        }
        return updated > 0;
    }

    /**
     * Stage for a question category: behavioral and cultural fit go to stage 1, technical and
     * role specific to stage 2, situational and experience based to stage 3, everything else to
     * stage 4. Falls back to the first saved stage.
     */
    static String stageIdFor(String category, Map<Integer, String> stageIdByOrder) {
        String key = category == null ? "" : category.toLowerCase(Locale.ROOT);
        if (stageIdByOrder.containsKey(1) && FIRST_STAGE_CATEGORIES.contains(key)) return stageIdByOrder.get(1);
        if (stageIdByOrder.containsKey(2) && SECOND_STAGE_CATEGORIES.contains(key)) return stageIdByOrder.get(2);
        if (stageIdByOrder.containsKey(3) && THIRD_STAGE_CATEGORIES.contains(key)) return stageIdByOrder.get(3);
        if (stageIdByOrder.containsKey(4)) return stageIdByOrder.get(4);
        return stageIdByOrder.values().iterator().next();
    }

    static String normalizeDifficulty(String difficulty) {
        if (difficulty == null) {
            return "Medium";
        }
        String d = difficulty.trim().toLowerCase(Locale.ROOT);
        return switch (d) {
            case "easy" -> "Easy";
            case "hard" -> "Hard";
            default -> "Medium";
        };
    }

    private static SearchArtifact newArtifact(String searchId, String userId, LocalDateTime now) {
        return SearchArtifact.builder()
                .searchId(searchId)
                .userId(userId)
                .processingStartedAt(now)
                .build();
    }

    private static JsonNode metadataJson(SynthesisMetadata metadata) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("model", metadata.model());
        node.put("max_tokens", metadata.maxTokens());
        node.put("timestamp", metadata.timestamp().toString());
        node.put("fallback_used", metadata.fallbackUsed());
        return node;
    }
}
