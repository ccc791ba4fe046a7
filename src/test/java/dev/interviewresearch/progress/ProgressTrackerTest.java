package dev.interviewresearch.progress;

import dev.interviewresearch.config.ProgressConfig;
import dev.interviewresearch.entity.Search;
import dev.interviewresearch.entity.SearchStatus;
import dev.interviewresearch.model.ProgressView;
import dev.interviewresearch.repository.SearchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressTrackerTest {

    @Mock
    private SearchRepository searchRepository;

    private ProgressTracker tracker;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        tracker = new ProgressTracker(searchRepository, new ProgressConfig(), clock);
    }

    private Search search(SearchStatus status, long silentSeconds) {
        return Search.builder()
                .id("s1")
                .company("Acme")
                .status(status)
                .progressStep("Research gathered")
                .progressPercentage(30)
                .createdAt(now.minusMinutes(5))
                .updatedAt(now.minusSeconds(silentSeconds))
                .build();
    }

    @Nested
    @DisplayName("Progress writes")
    class WriteTests {

        @Test
        @DisplayName("Should write the step label and percentage")
        void shouldWriteStep() {
            when(searchRepository.updateProgress("s1", "Research gathered", 30, now, SearchStatus.TERMINAL))
                    .thenReturn(1);

            StepVerifier.create(tracker.advance("s1", ProgressStep.GATHER_COMPLETE, null))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should clamp an override into 0..100")
        void shouldClampOverride() {
            when(searchRepository.updateProgress(eq("s1"), anyString(), anyInt(), any(), any())).thenReturn(1);

            StepVerifier.create(tracker.advance("s1", ProgressStep.SYNTHESIS_START, 140))
                    .expectNext(true)
                    .verifyComplete();

            verify(searchRepository).updateProgress(eq("s1"), eq("Synthesizing interview preparation"), eq(100),
                    any(), any());
            assertThat(ProgressTracker.clamp(-5)).isZero();
            assertThat(ProgressTracker.clamp(42)).isEqualTo(42);
        }

        @Test
        @DisplayName("Should report a rejected write on a terminal search as false")
        void shouldReportRejectedWrite() {
            when(searchRepository.updateProgress(eq("s1"), anyString(), anyInt(), any(), any())).thenReturn(0);

            StepVerifier.create(tracker.advance("s1", ProgressStep.PERSIST_START, null))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should not propagate progress write errors")
        void shouldSwallowWriteErrors() {
            when(searchRepository.updateProgress(eq("s1"), anyString(), anyInt(), any(), any()))
                    .thenThrow(new IllegalStateException("database is locked"));

            StepVerifier.create(tracker.advance("s1", ProgressStep.INITIALIZING, null))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should keep the current step when failing without one")
        void shouldFailWithoutStep() {
            when(searchRepository.markFailed(eq("s1"), eq("Research failed: boom"), isNull(), eq(now), any()))
                    .thenReturn(1);

            StepVerifier.create(tracker.markFailed("s1", "Research failed: boom", null))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should propagate errors from the failure write")
        void shouldPropagateFailureWriteErrors() {
            when(searchRepository.markFailed(anyString(), anyString(), any(), any(), any()))
                    .thenThrow(new IllegalStateException("database is locked"));

            StepVerifier.create(tracker.markFailed("s1", "x", ProgressStep.GATHER_START))
                    .expectError(IllegalStateException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Stall detection")
    class StallTests {

        @Test
        @DisplayName("Should flag a processing job silent for more than 30 seconds")
        void shouldDetectStall() {
            assertThat(tracker.isStalled(search(SearchStatus.PROCESSING, 31), now)).isTrue();
            assertThat(tracker.isStalled(search(SearchStatus.PROCESSING, 29), now)).isFalse();
        }

        @Test
        @DisplayName("Should never flag terminal jobs as stalled")
        void shouldIgnoreTerminalJobs() {
            assertThat(tracker.isStalled(search(SearchStatus.COMPLETED, 600), now)).isFalse();
            assertThat(tracker.isStalled(search(SearchStatus.FAILED, 600), now)).isFalse();
        }

        @Test
        @DisplayName("Should offer retry after the escalation threshold")
        void shouldOfferRetryAfterEscalation() {
            ProgressView stalled = tracker.toView(search(SearchStatus.PROCESSING, 40));
            ProgressView escalated = tracker.toView(search(SearchStatus.PROCESSING, 46));

            assertThat(stalled.stalled()).isTrue();
            assertThat(stalled.stalledSeconds()).isEqualTo(40);
            assertThat(stalled.retryOffered()).isFalse();
            assertThat(escalated.retryOffered()).isTrue();
        }

        @Test
        @DisplayName("Should offer retry for failed jobs")
        void shouldOfferRetryWhenFailed() {
            Search failed = search(SearchStatus.FAILED, 5);
            failed.setErrorMessage("Synthesis failed: empty output");

            ProgressView view = tracker.toView(failed);

            assertThat(view.retryOffered()).isTrue();
            assertThat(view.stalled()).isFalse();
            assertThat(view.error()).isEqualTo("Synthesis failed: empty output");
        }

        @Test
        @DisplayName("Should be empty for an unknown search")
        void shouldBeEmptyForUnknownSearch() {
            when(searchRepository.findById("missing")).thenReturn(Optional.empty());

            StepVerifier.create(tracker.getProgress("missing"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should expose step and percentage of a known search")
        void shouldExposeProgress() {
            when(searchRepository.findById("s1")).thenReturn(Optional.of(search(SearchStatus.PROCESSING, 2)));

            StepVerifier.create(tracker.getProgress("s1"))
                    .assertNext(view -> {
                        assertThat(view.status()).isEqualTo(SearchStatus.PROCESSING);
                        assertThat(view.step()).isEqualTo("Research gathered");
                        assertThat(view.percentage()).isEqualTo(30);
                        assertThat(view.stalled()).isFalse();
                    })
                    .verifyComplete();
        }
    }
}
