package dev.interviewresearch.gather;

import dev.interviewresearch.config.GatherConfig;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.model.GatherOutcome;
import dev.interviewresearch.model.GatheredResearch;
import dev.interviewresearch.model.ResearchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Runs every gatherer concurrently and combines their outcomes by key. Gatherers still
 * running at the overall deadline are cancelled and count as abandoned. No retries here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatherCoordinator {

    private final List<Gatherer> gatherers;
    private final GatherConfig gatherConfig;
    private final ResearchMetrics metrics;

    /**
     * Always completes with a value, even when every gatherer failed.
     */
    public Mono<GatheredResearch> gather(ResearchRequest request, String searchId) {
        Duration deadline = gatherConfig.getOverallDeadline();
        log.info("[{}] Gathering from {} sources (deadline {}s)", searchId, gatherers.size(), deadline.toSeconds());

        return Flux.fromIterable(gatherers)
                .flatMap(gatherer -> gatherer.gather(request, searchId)
                        .timeout(deadline, Mono.fromSupplier(() -> {
                            log.warn("[{}] {} abandoned at the gather deadline", searchId,
                                    gatherer.getKey().metricName());
                            return GatherOutcome.abandoned(gatherer.getKey(), deadline);
                        }))
                        .onErrorResume(e -> Mono.just(GatherOutcome.failed(gatherer.getKey(),
                                String.valueOf(e.getMessage()), Duration.ZERO)))
                        .defaultIfEmpty(GatherOutcome.failed(gatherer.getKey(), "no outcome", Duration.ZERO)),
                        Math.max(1, gatherers.size()))
                .doOnNext(outcome -> metrics.recordGatherOutcome(outcome.key().metricName(),
                        outcome.status().metricName(), outcome.elapsed()))
                .collectMap(GatherOutcome::key)
                .map(GatheredResearch::from)
                .doOnNext(gathered -> log.info("[{}] Gathering complete: {}/{} sources available", searchId,
                        gathered.availableSources(), gatherers.size()));
    }
}
