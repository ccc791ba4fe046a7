package dev.interviewresearch.progress;

import reactor.core.publisher.Mono;

/**
 * Progress reporting for one search, passed into each phase of a run.
 */
public record ProgressHandle(String searchId, ProgressTracker tracker) {

    public Mono<Boolean> advance(ProgressStep step) {
        return tracker.advance(searchId, step, null);
    }
}
