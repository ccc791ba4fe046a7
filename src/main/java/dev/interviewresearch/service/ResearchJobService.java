package dev.interviewresearch.service;

import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.config.JobConfig;
import dev.interviewresearch.config.SearchConfig;
import dev.interviewresearch.entity.InterviewQuestion;
import dev.interviewresearch.entity.InterviewStage;
import dev.interviewresearch.entity.Search;
import dev.interviewresearch.entity.SearchArtifact;
import dev.interviewresearch.error.CheckpointException;
import dev.interviewresearch.error.ConfigurationMissingException;
import dev.interviewresearch.error.ResearchException;
import dev.interviewresearch.error.SynthesisFailedException;
import dev.interviewresearch.gather.GatherCoordinator;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.model.ProgressView;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.model.ResearchResults;
import dev.interviewresearch.model.ResearchResults.StageWithQuestions;
import dev.interviewresearch.persistence.ResultWriter;
import dev.interviewresearch.progress.ProgressHandle;
import dev.interviewresearch.progress.ProgressStep;
import dev.interviewresearch.progress.ProgressTracker;
import dev.interviewresearch.repository.InterviewQuestionRepository;
import dev.interviewresearch.repository.InterviewStageRepository;
import dev.interviewresearch.repository.SearchArtifactRepository;
import dev.interviewresearch.repository.SearchRepository;
import dev.interviewresearch.synthesis.SynthesisEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Main orchestration service for research jobs. One run drives a search from pending to a
 * terminal state: gather, save raw material, synthesize, save results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchJobService {

    private static final String SEPARATOR = "========================================";

    private final SearchRepository searchRepository;
    private final SearchArtifactRepository artifactRepository;
    private final InterviewStageRepository stageRepository;
    private final InterviewQuestionRepository questionRepository;
    private final GatherCoordinator gatherCoordinator;
    private final SynthesisEngine synthesisEngine;
    private final ResultWriter resultWriter;
    private final ProgressTracker progressTracker;
    private final CompletionClient completionClient;
    private final SearchConfig searchConfig;
    private final ResearchMetrics metrics;
    private final JobConfig jobConfig;
    private final Scheduler researchJobScheduler;
    private final Clock clock;

    // Runs in flight, by search id
    private final Map<String, LocalDateTime> activeJobs = new ConcurrentHashMap<>();

    /**
     * Create a pending search and launch its run without waiting for it.
     *
     * @return the new search id
     */
    public Mono<String> startJob(ResearchRequest request) {
        if (request == null || request.getCompany() == null || request.getCompany().isBlank()) {
            return Mono.error(new IllegalArgumentException("Company is required"));
        }

        return Mono.fromCallable(() -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    return searchRepository.save(Search.builder()
                            .userId(request.getUserId())
                            .company(request.getCompany().trim())
                            .role(request.getRole())
                            .country(request.getCountry())
                            .roleLinks(request.getRoleLinks() != null
                                    ? new ArrayList<>(request.getRoleLinks()) : new ArrayList<>())
                            .targetSeniority(request.getTargetSeniority())
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(search -> {
                    launch(search.getId(), request);
                    return search.getId();
                });
    }

    private void launch(String searchId, ResearchRequest request) {
        activeJobs.put(searchId, LocalDateTime.now(clock));
        runJob(searchId, request)
                .subscribeOn(researchJobScheduler)
                .doFinally(signal -> activeJobs.remove(searchId))
                .subscribe(
                        ignored -> {
                        },
                        e -> log.error("[{}] Research run ended unexpectedly: {}", searchId, e.getMessage()));
    }

    /**
     * Drive one search to a terminal state. Never errors: failures end in {@code markFailed}.
     */
    Mono<Void> runJob(String searchId, ResearchRequest request) {
        ProgressHandle handle = progressTracker.handle(searchId);

        return Mono.defer(() -> {
                    log.info(SEPARATOR);
                    log.info("Research job {} starting: {} / {}", searchId, request.getCompany(),
                            request.getRole() != null ? request.getRole() : "-");
                    log.info(SEPARATOR);
                    metrics.recordJobStarted();
                    return handle.advance(ProgressStep.INITIALIZING);
                })
                .then(Mono.defer(this::checkCredentials))
                .then(handle.advance(ProgressStep.GATHER_START))
                .then(Mono.defer(() -> gatherCoordinator.gather(request, searchId)))
                .flatMap(gathered -> handle.advance(ProgressStep.GATHER_COMPLETE)
                        .then(resultWriter.saveRawArtifacts(handle, request, gathered))
                        .then(handle.advance(ProgressStep.RAW_DATA_SAVED))
                        .then(handle.advance(ProgressStep.SYNTHESIS_START))
                        .then(synthesisEngine.synthesize(request, gathered)
                                .switchIfEmpty(Mono.error(() -> new SynthesisFailedException(
                                        "completion service returned no result"))))
                        .flatMap(synthesis -> handle.advance(ProgressStep.SYNTHESIS_COMPLETE)
                                .then(handle.advance(ProgressStep.PERSIST_START))
                                .then(resultWriter.saveResults(handle, request, gathered, synthesis))))
                .timeout(jobConfig.getMaxDuration())
                .doOnNext(completed -> {
                    metrics.recordJobCompleted();
                    log.info(SEPARATOR);
                    log.info("Research job {} completed", searchId);
                    log.info(SEPARATOR);
                })
                .onErrorResume(e -> fail(searchId, e).then(Mono.<Boolean>empty()))
                .then();
    }

    private Mono<Void> checkCredentials() {
        if (!completionClient.isEnabled()) {
            return Mono.error(new ConfigurationMissingException("Completion service API key is not configured"));
        }
        if (!searchConfig.hasCredential()) {
            log.warn("Search service API key is not configured, gatherers will use cached content only");
        }
        return Mono.empty();
    }

    private Mono<Boolean> fail(String searchId, Throwable e) {
        String message = failureMessage(e);
        String code = e instanceof ResearchException re ? re.getErrorCode()
                : e instanceof TimeoutException ? "JOB_TIMEOUT" : "UNEXPECTED";

        log.error(SEPARATOR);
        log.error("Research job {} failed: {}", searchId, message, e);
        log.error(SEPARATOR);
        metrics.recordJobFailed(code);

        return progressTracker.markFailed(searchId, message, null)
                .onErrorResume(writeError -> {
                    log.error("[{}] Could not record failure: {}", searchId, writeError.getMessage());
                    return Mono.just(false);
                });
    }

    String failureMessage(Throwable e) {
        if (e instanceof SynthesisFailedException) {
            return "Synthesis failed: " + e.getMessage();
        }
        if (e instanceof ConfigurationMissingException) {
            return "Configuration error: " + e.getMessage();
        }
        if (e instanceof CheckpointException) {
            return "Failed to save results: " + e.getMessage();
        }
        if (e instanceof TimeoutException) {
            Duration max = jobConfig.getMaxDuration();
            return "Research timed out after " + max.toSeconds() + " seconds";
        }
        return "Research failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    public Mono<ProgressView> getProgress(String searchId) {
        return progressTracker.getProgress(searchId);
    }

    /**
     * Saved results of a search; empty when the search is unknown.
     */
    public Mono<ResearchResults> getResults(String searchId) {
        return Mono.fromCallable(() -> searchRepository.findById(searchId).map(this::loadResults))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(found -> found.map(Mono::just).orElseGet(Mono::empty));
    }

    private ResearchResults loadResults(Search search) {
        Optional<SearchArtifact> artifact = artifactRepository.findBySearchId(search.getId());
        Map<String, List<InterviewQuestion>> questionsByStage = questionRepository.findBySearchId(search.getId())
                .stream()
                .collect(Collectors.groupingBy(InterviewQuestion::getStageId));

        List<StageWithQuestions> stages = new ArrayList<>();
        for (InterviewStage stage : stageRepository.findBySearchIdOrderByOrderIndexAsc(search.getId())) {
            stages.add(new StageWithQuestions(stage, questionsByStage.getOrDefault(stage.getId(), List.of())));
        }

        return new ResearchResults(
                search.getId(),
                search.getStatus(),
                search.getCompany(),
                search.getRole(),
                search.getOverallFitScore(),
                search.getPreparationPriorities(),
                stages,
                artifact.map(SearchArtifact::getComparisonAnalysis).orElse(null),
                artifact.map(SearchArtifact::getPreparationGuidance).orElse(null));
    }

    public int getActiveJobCount() {
        return activeJobs.size();
    }
}
