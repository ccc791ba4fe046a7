package dev.interviewresearch.support;

import dev.interviewresearch.config.RetryConfig;
import dev.interviewresearch.error.TransientNetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;

/**
 * Exponential backoff shared by every component that calls an external service.
 * Delay before retry n (0-based) is {@code initialDelay * 2^n}; only transient failures are retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final RetryConfig retryConfig;

    /**
     * Apply the policy to a call. The call must be lazy (re-subscribable) for retries to re-issue it.
     */
    public <T> Mono<T> apply(Mono<T> call, String operation) {
        return call.retryWhen(backoff(operation));
    }

    public Retry backoff(String operation) {
        int maxRetries = retryConfig.getMaxRetries();
        return Retry.backoff(maxRetries, retryConfig.getInitialDelay())
                .jitter(0)
                .filter(RetryPolicy::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}/{}): {}",
                        operation, signal.totalRetries() + 1, maxRetries, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isTransient(Throwable e) {
        if (e instanceof TransientNetworkException || e instanceof TimeoutException
                || e instanceof WebClientRequestException) {
            return true;
        }
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }
}
