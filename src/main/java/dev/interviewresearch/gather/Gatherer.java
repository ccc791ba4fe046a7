package dev.interviewresearch.gather;

import dev.interviewresearch.model.GatherOutcome;
import dev.interviewresearch.model.GathererKey;
import dev.interviewresearch.model.ResearchRequest;
import reactor.core.publisher.Mono;

/**
 * Interface for the independent research gatherers.
 */
public interface Gatherer {

    GathererKey getKey();

    /**
     * Gather and analyze material for one search. The returned Mono never errors;
     * failures are reported as a failed outcome.
     */
    Mono<GatherOutcome> gather(ResearchRequest request, String searchId);
}
