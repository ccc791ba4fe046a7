package dev.interviewresearch.ai;

import reactor.core.publisher.Mono;

/**
 * Interface for completion (LLM) services.
 * One implementation is active, selected by {@code research.completion.provider}.
 */
public interface CompletionClient {

    /**
     * Issue one completion call, retried on transient failures.
     *
     * @param request The request
     * @return Mono with the completion text; errors with
     *         {@link dev.interviewresearch.error.ConfigurationMissingException} when no credential is set
     *         and {@link dev.interviewresearch.error.MalformedResponseException} when the answer has no text
     */
    Mono<String> complete(CompletionRequest request);

    /**
     * Model used when the request does not name one.
     */
    String getDefaultModel();

    /**
     * Check if the client has a credential.
     */
    boolean isEnabled();
}
