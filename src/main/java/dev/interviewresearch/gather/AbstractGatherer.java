package dev.interviewresearch.gather;

import com.fasterxml.jackson.databind.JsonNode;
import dev.interviewresearch.ai.CompletionClient;
import dev.interviewresearch.ai.CompletionRequest;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.error.ConfigurationMissingException;
import dev.interviewresearch.error.MalformedResponseException;
import dev.interviewresearch.model.GatherOutcome;
import dev.interviewresearch.model.ResearchRequest;
import dev.interviewresearch.support.JsonResponseParser;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Slf4j
public abstract class AbstractGatherer implements Gatherer {

    protected final CompletionClient completionClient;
    protected final CompletionConfig completionConfig;
    protected final JsonResponseParser jsonParser;

    protected AbstractGatherer(CompletionClient completionClient, CompletionConfig completionConfig,
                               JsonResponseParser jsonParser) {
        this.completionClient = completionClient;
        this.completionConfig = completionConfig;
        this.jsonParser = jsonParser;
    }

    /**
     * Per-gatherer deadline.
     */
    protected abstract Duration getTimeout();

    /**
     * Whether the request carries the input this gatherer needs.
     */
    protected abstract boolean appliesTo(ResearchRequest request);

    /**
     * Produce the gatherer's JSON result.
     */
    protected abstract Mono<JsonNode> doGather(ResearchRequest request, String searchId);

    @Override
    public Mono<GatherOutcome> gather(ResearchRequest request, String searchId) {
        if (!appliesTo(request)) {
            log.info("[{}] {} skipped: no input", searchId, getKey().metricName());
            return Mono.just(GatherOutcome.skipped(getKey()));
        }

        long start = System.currentTimeMillis();
        return Mono.defer(() -> doGather(request, searchId))
                .timeout(getTimeout())
                .map(result -> GatherOutcome.ok(getKey(), result, elapsedSince(start)))
                .switchIfEmpty(Mono.fromSupplier(() ->
                        GatherOutcome.failed(getKey(), "no result produced", elapsedSince(start))))
                .doOnNext(outcome -> log.info("[{}] {} finished: {} in {}ms", searchId, getKey().metricName(),
                        outcome.status().metricName(), outcome.elapsed().toMillis()))
                .onErrorResume(e -> {
                    log.warn("[{}] {} failed: {}", searchId, getKey().metricName(), describe(e));
                    return Mono.just(GatherOutcome.failed(getKey(), describe(e), elapsedSince(start)));
                });
    }

    /**
     * One completion call whose answer must be a JSON object.
     */
    protected Mono<JsonNode> analyze(String operation, String systemPrompt, String userPrompt, int maxTokens) {
        if (!completionClient.isEnabled()) {
            return Mono.error(new ConfigurationMissingException("Completion credential is not configured"));
        }
        CompletionRequest request = new CompletionRequest(
                operation,
                null,
                systemPrompt,
                userPrompt,
                maxTokens,
                completionConfig.isJsonMode(),
                completionConfig.getCallTimeout());

        return completionClient.complete(request)
                .map(content -> jsonParser.parse(content)
                        .orElseThrow(() -> new MalformedResponseException(operation + " returned unreadable JSON")));
    }

    protected void logPhase(String searchId, String phase, String detail) {
        log.info("[{}] {} -> {}: {}", searchId, getKey().metricName(), phase, detail);
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofMillis(System.currentTimeMillis() - start);
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
