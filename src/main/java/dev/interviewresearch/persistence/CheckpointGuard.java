package dev.interviewresearch.persistence;

import dev.interviewresearch.config.PersistenceConfig;
import dev.interviewresearch.error.CheckpointException;
import dev.interviewresearch.metrics.ResearchMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking persistence work off the event loop, bounded by the checkpoint timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckpointGuard {

    private final PersistenceConfig persistenceConfig;
    private final ResearchMetrics metrics;

    /**
     * Failures and timeouts are logged and turn into an empty result.
     */
    public <T> Mono<T> soft(String checkpoint, String searchId, Callable<T> work) {
        return run(work)
                .doOnNext(result -> log.info("[{}] Checkpoint {} saved", searchId, checkpoint))
                .onErrorResume(e -> {
                    metrics.recordCheckpointFailure(checkpoint);
                    log.warn("[{}] Checkpoint {} failed, continuing: {}", searchId, checkpoint, describe(e));
                    return Mono.empty();
                });
    }

    /**
     * Failures and timeouts propagate as {@link CheckpointException}.
     */
    public <T> Mono<T> strict(String checkpoint, String searchId, Callable<T> work) {
        return run(work)
                .doOnNext(result -> log.info("[{}] Checkpoint {} saved", searchId, checkpoint))
                .onErrorMap(e -> !(e instanceof CheckpointException), e -> {
                    metrics.recordCheckpointFailure(checkpoint);
                    return new CheckpointException(checkpoint,
                            "Checkpoint " + checkpoint + " failed: " + describe(e), e);
                });
    }

    private <T> Mono<T> run(Callable<T> work) {
        return Mono.fromCallable(work)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(persistenceConfig.getCheckpointTimeout());
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out after checkpoint timeout";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
