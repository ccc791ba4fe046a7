package dev.interviewresearch.progress;

import dev.interviewresearch.config.ProgressConfig;
import dev.interviewresearch.entity.Search;
import dev.interviewresearch.entity.SearchStatus;
import dev.interviewresearch.model.ProgressView;
import dev.interviewresearch.repository.SearchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Writes job progress and derives stall state for polling clients.
 * Every write is a single conditional update; once a job is terminal, later writes match no row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressTracker {

    private final SearchRepository searchRepository;
    private final ProgressConfig progressConfig;
    private final Clock clock;

    public ProgressHandle handle(String searchId) {
        return new ProgressHandle(searchId, this);
    }

    /**
     * Move a job to {@code step}. Never errors: a failed write is logged and reported as false.
     *
     * @param percentageOverride replaces the step's own percentage when not null
     */
    public Mono<Boolean> advance(String searchId, ProgressStep step, Integer percentageOverride) {
        int percentage = clamp(percentageOverride != null ? percentageOverride : step.percentage());
        return Mono.fromCallable(() -> searchRepository.updateProgress(searchId, step.label(), percentage,
                        LocalDateTime.now(clock), SearchStatus.TERMINAL))
                .subscribeOn(Schedulers.boundedElastic())
                .map(updated -> {
                    if (updated == 0) {
                        log.debug("[{}] Progress write {} rejected: search is terminal or unknown", searchId, step);
                        return false;
                    }
                    log.info("[{}] Progress: {} ({}%)", searchId, step.label(), percentage);
                    return true;
                })
                .onErrorResume(e -> {
                    log.warn("[{}] Progress write {} failed: {}", searchId, step, e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Failed with a message; the percentage stays where the job stopped. Errors propagate to the caller.
     */
    public Mono<Boolean> markFailed(String searchId, String message, ProgressStep step) {
        String label = step != null ? step.label() : null;
        return Mono.fromCallable(() -> searchRepository.markFailed(searchId, message, label,
                        LocalDateTime.now(clock), SearchStatus.TERMINAL))
                .subscribeOn(Schedulers.boundedElastic())
                .map(updated -> {
                    if (updated == 0) {
                        log.debug("[{}] Failure write rejected: search is terminal or unknown", searchId);
                    }
                    return updated > 0;
                });
    }

    /**
     * Processing and silent for longer than the stall threshold.
     */
    public boolean isStalled(Search search, LocalDateTime now) {
        return search.getStatus() == SearchStatus.PROCESSING
                && silentFor(search, now).compareTo(progressConfig.getStallThreshold()) > 0;
    }

    public Mono<ProgressView> getProgress(String searchId) {
        return Mono.fromCallable(() -> searchRepository.findById(searchId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(found -> found.map(this::toView).map(Mono::just).orElseGet(Mono::empty));
    }

    ProgressView toView(Search search) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean stalled = isStalled(search, now);
        boolean escalated = search.getStatus() == SearchStatus.PROCESSING
                && silentFor(search, now).compareTo(progressConfig.getEscalationThreshold()) > 0;

        return ProgressView.builder()
                .searchId(search.getId())
                .status(search.getStatus())
                .step(search.getProgressStep())
                .percentage(search.getProgressPercentage())
                .error(search.getErrorMessage())
                .stalled(stalled)
                .stalledSeconds(stalled ? silentFor(search, now).toSeconds() : 0)
                .retryOffered(escalated || search.getStatus() == SearchStatus.FAILED)
                .startedAt(search.getStartedAt())
                .completedAt(search.getCompletedAt())
                .updatedAt(search.getUpdatedAt())
                .build();
    }

    private static Duration silentFor(Search search, LocalDateTime now) {
        LocalDateTime last = search.getUpdatedAt() != null ? search.getUpdatedAt() : search.getCreatedAt();
        return last == null ? Duration.ZERO : Duration.between(last, now);
    }

    static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }
}
