package dev.interviewresearch.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.config.JobConfig;
import dev.interviewresearch.config.SearchConfig;
import dev.interviewresearch.entity.InterviewQuestion;
import dev.interviewresearch.entity.InterviewStage;
import dev.interviewresearch.entity.Search;
import dev.interviewresearch.entity.SearchArtifact;
import dev.interviewresearch.entity.SearchStatus;
import dev.interviewresearch.error.CheckpointException;
import dev.interviewresearch.gather.GatherCoordinator;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.model.SynthesisMetadata;
import dev.interviewresearch.model.SynthesisResult;
import dev.interviewresearch.persistence.ResultWriter;
import dev.interviewresearch.progress.ProgressHandle;
import dev.interviewresearch.progress.ProgressStep;
import dev.interviewresearch.progress.ProgressTracker;
import dev.interviewresearch.repository.InterviewQuestionRepository;
import dev.interviewresearch.repository.InterviewStageRepository;
import dev.interviewresearch.repository.SearchArtifactRepository;
import dev.interviewresearch.repository.SearchRepository;
import dev.interviewresearch.synthesis.SynthesisEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchJobServiceTest {

    private static final String SEARCH_ID = "s1";

    @Mock
    private SearchRepository searchRepository;

    @Mock
    private SearchArtifactRepository artifactRepository;

    @Mock
    private InterviewStageRepository stageRepository;

    @Mock
    private InterviewQuestionRepository questionRepository;

    @Mock
    private GatherCoordinator gatherCoordinator;

    @Mock
    private SynthesisEngine synthesisEngine;

    @Mock
    private ResultWriter resultWriter;

    @Mock
    private ProgressTracker progressTracker;

    @Mock
    private CompletionClient completionClient;

    @Captor
    private ArgumentCaptor<Search> searchCaptor;

    private SimpleMeterRegistry meterRegistry;
    private JobConfig jobConfig;
    private ResearchJobService service;

    private final ResearchRequest request = ResearchRequest.builder()
            .company("Acme")
            .role("Engineer")
            .cv("Six years of Java")
            .build();
    private final GatheredResearch gathered = new GatheredResearch(
            JsonNodeFactory.instance.objectNode().put("industry", "Aerospace"), null, null);
    private final SynthesisResult synthesis = SynthesisResult.fallback(
            new SynthesisMetadata("gpt-4o", 8000, Instant.EPOCH, false));

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        jobConfig = new JobConfig();
        SearchConfig searchConfig = new SearchConfig();
        searchConfig.setApiKey("test-search-key");

        service = new ResearchJobService(searchRepository, artifactRepository, stageRepository, questionRepository,
                gatherCoordinator, synthesisEngine, resultWriter, progressTracker, completionClient, searchConfig,
                new ResearchMetrics(meterRegistry), jobConfig, Schedulers.immediate(),
                Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    private void stubProgress() {
        when(progressTracker.handle(SEARCH_ID)).thenReturn(new ProgressHandle(SEARCH_ID, progressTracker));
        when(progressTracker.advance(eq(SEARCH_ID), any(), any())).thenReturn(Mono.just(true));
    }

    private void stubThroughSynthesis(Mono<SynthesisResult> result) {
        stubProgress();
        when(completionClient.isEnabled()).thenReturn(true);
        when(gatherCoordinator.gather(request, SEARCH_ID)).thenReturn(Mono.just(gathered));
        when(resultWriter.saveRawArtifacts(any(), eq(request), eq(gathered)))
                .thenReturn(Mono.just(new SearchArtifact()));
        when(synthesisEngine.synthesize(request, gathered)).thenReturn(result);
    }

    private double counter(String name) {
        return meterRegistry.counter(name).count();
    }

    @Nested
    @DisplayName("Run outcomes")
    class RunTests {

        @Test
        @DisplayName("Should walk every step and complete")
        void shouldCompleteRun() {
            stubThroughSynthesis(Mono.just(synthesis));
            when(resultWriter.saveResults(any(), eq(request), eq(gathered), eq(synthesis)))
                    .thenReturn(Mono.just(true));

            StepVerifier.create(service.runJob(SEARCH_ID, request))
                    .verifyComplete();

            for (ProgressStep step : List.of(ProgressStep.INITIALIZING, ProgressStep.GATHER_START,
                    ProgressStep.GATHER_COMPLETE, ProgressStep.RAW_DATA_SAVED, ProgressStep.SYNTHESIS_START,
                    ProgressStep.SYNTHESIS_COMPLETE, ProgressStep.PERSIST_START)) {
                verify(progressTracker).advance(SEARCH_ID, step, null);
            }
            verify(progressTracker, never()).markFailed(anyString(), anyString(), any());
            assertThat(counter("research_jobs_completed_total")).isEqualTo(1.0);
            assertThat(meterRegistry.get("research_jobs_active").gauge().value()).isZero();
        }

        @Test
        @DisplayName("Should fail when synthesis produces no result")
        void shouldFailOnEmptySynthesis() {
            stubThroughSynthesis(Mono.empty());
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull())).thenReturn(Mono.just(true));

            StepVerifier.create(service.runJob(SEARCH_ID, request))
                    .verifyComplete();

            verify(progressTracker).markFailed(SEARCH_ID,
                    "Synthesis failed: completion service returned no result", null);
            verify(resultWriter, never()).saveResults(any(), any(), any(), any());
            assertThat(meterRegistry.counter("research_jobs_failed_by_reason_total", "reason", "SYNTHESIS_FAILED")
                    .count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fail before gathering when the completion credential is missing")
        void shouldFailWithoutCompletionCredential() {
            stubProgress();
            when(completionClient.isEnabled()).thenReturn(false);
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull())).thenReturn(Mono.just(true));

            StepVerifier.create(service.runJob(SEARCH_ID, request))
                    .verifyComplete();

            verify(progressTracker).markFailed(eq(SEARCH_ID), startsWith("Configuration error:"), isNull());
            verify(gatherCoordinator, never()).gather(any(), any());
        }

        @Test
        @DisplayName("Should fail when the final checkpoint fails")
        void shouldFailOnCompletionCheckpoint() {
            stubThroughSynthesis(Mono.just(synthesis));
            when(resultWriter.saveResults(any(), eq(request), eq(gathered), eq(synthesis)))
                    .thenReturn(Mono.error(new CheckpointException("search_completion",
                            "Checkpoint search_completion failed: database is locked", null)));
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull())).thenReturn(Mono.just(true));

            StepVerifier.create(service.runJob(SEARCH_ID, request))
                    .verifyComplete();

            verify(progressTracker).markFailed(SEARCH_ID,
                    "Failed to save results: Checkpoint search_completion failed: database is locked", null);
            assertThat(counter("research_jobs_failed_total")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should still complete when the failure cannot be recorded")
        void shouldSurviveFailureWriteError() {
            stubThroughSynthesis(Mono.empty());
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull()))
                    .thenReturn(Mono.error(new IllegalStateException("database is locked")));

            StepVerifier.create(service.runJob(SEARCH_ID, request))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail a run that exceeds the maximum duration")
        void shouldTimeOutLongRun() {
            jobConfig.setMaxDuration(Duration.ofMinutes(5));
            stubProgress();
            when(completionClient.isEnabled()).thenReturn(true);
            when(gatherCoordinator.gather(request, SEARCH_ID)).thenReturn(Mono.never());
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull())).thenReturn(Mono.just(true));

            StepVerifier.withVirtualTime(() -> service.runJob(SEARCH_ID, request))
                    .thenAwait(Duration.ofMinutes(5))
                    .verifyComplete();

            verify(progressTracker).markFailed(SEARCH_ID, "Research timed out after 300 seconds", null);
            assertThat(meterRegistry.counter("research_jobs_failed_by_reason_total", "reason", "JOB_TIMEOUT")
                    .count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Starting jobs")
    class StartTests {

        @Test
        @DisplayName("Should reject a blank company")
        void shouldRejectBlankCompany() {
            StepVerifier.create(service.startJob(ResearchRequest.builder().company("  ").build()))
                    .expectErrorMessage("Company is required")
                    .verify();

            verify(searchRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should create a pending search and return its id")
        void shouldCreatePendingSearch() {
            when(searchRepository.save(any(Search.class))).thenAnswer(inv -> {
                Search search = inv.getArgument(0);
                search.setId(SEARCH_ID);
                return search;
            });
            stubProgress();
            when(completionClient.isEnabled()).thenReturn(false);
            when(progressTracker.markFailed(eq(SEARCH_ID), anyString(), isNull())).thenReturn(Mono.just(true));

            StepVerifier.create(service.startJob(ResearchRequest.builder()
                            .company(" Acme ")
                            .roleLinks(List.of("https://acme.com/jobs/1"))
                            .cv("secret cv text")
                            .build()))
                    .expectNext(SEARCH_ID)
                    .verifyComplete();

            verify(searchRepository).save(searchCaptor.capture());
            Search saved = searchCaptor.getValue();
            assertThat(saved.getCompany()).isEqualTo("Acme");
            assertThat(saved.getStatus()).isEqualTo(SearchStatus.PENDING);
            assertThat(saved.getProgressPercentage()).isZero();
            assertThat(saved.getRoleLinks()).containsExactly("https://acme.com/jobs/1");
            verify(progressTracker).markFailed(eq(SEARCH_ID), anyString(), isNull());
            assertThat(service.getActiveJobCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Reading results")
    class ResultsTests {

        @Test
        @DisplayName("Should group questions under their stages in order")
        void shouldGroupQuestionsByStage() {
            Search search = Search.builder().id(SEARCH_ID).company("Acme").status(SearchStatus.COMPLETED)
                    .overallFitScore(7.5).preparationPriorities(List.of("System design")).build();
            when(searchRepository.findById(SEARCH_ID)).thenReturn(Optional.of(search));
            when(artifactRepository.findBySearchId(SEARCH_ID)).thenReturn(Optional.of(SearchArtifact.builder()
                    .comparisonAnalysis(JsonNodeFactory.instance.objectNode().put("overall_fit_score", 7.5))
                    .build()));
            when(stageRepository.findBySearchIdOrderByOrderIndexAsc(SEARCH_ID)).thenReturn(List.of(
                    InterviewStage.builder().id("st1").name("Screen").orderIndex(1).build(),
                    InterviewStage.builder().id("st2").name("Technical").orderIndex(2).build()));
            when(questionRepository.findBySearchId(SEARCH_ID)).thenReturn(List.of(
                    InterviewQuestion.builder().stageId("st2").question("Design a cache").build(),
                    InterviewQuestion.builder().stageId("st1").question("Why Acme?").build(),
                    InterviewQuestion.builder().stageId("st2").question("Reverse a list").build()));

            StepVerifier.create(service.getResults(SEARCH_ID))
                    .assertNext(results -> {
                        assertThat(results.status()).isEqualTo(SearchStatus.COMPLETED);
                        assertThat(results.overallFitScore()).isEqualTo(7.5);
                        assertThat(results.stages()).hasSize(2);
                        assertThat(results.stages().get(0).questions()).hasSize(1);
                        assertThat(results.stages().get(1).questions())
                                .extracting(InterviewQuestion::getQuestion)
                                .containsExactly("Design a cache", "Reverse a list");
                        assertThat(results.comparisonAnalysis().get("overall_fit_score").asDouble()).isEqualTo(7.5);
                        assertThat(results.preparationGuidance()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should be empty for an unknown search")
        void shouldBeEmptyForUnknownSearch() {
            when(searchRepository.findById("missing")).thenReturn(Optional.empty());

            StepVerifier.create(service.getResults("missing"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should describe timeouts and unexpected errors")
        void shouldDescribeFailures() {
            assertThat(service.failureMessage(new TimeoutException())).isEqualTo("Research timed out after 300 seconds");
            assertThat(service.failureMessage(new IllegalStateException("boom"))).isEqualTo("Research failed: boom");
            assertThat(service.failureMessage(new IllegalStateException())).isEqualTo("Research failed: IllegalStateException");
        }
    }
}
