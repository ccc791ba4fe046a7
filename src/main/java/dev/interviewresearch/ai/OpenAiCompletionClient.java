package dev.interviewresearch.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.error.ConfigurationMissingException;
import dev.interviewresearch.error.MalformedResponseException;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.support.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * CompletionClient backed by the OpenAI chat completions REST API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "research.completion.provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiCompletionClient implements CompletionClient {

    private static final String SERVICE = "openai";
    private static final String CHAT_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final CompletionConfig config;
    private final RetryPolicy retryPolicy;
    private final ResearchMetrics metrics;

    public OpenAiCompletionClient(WebClient.Builder webClientBuilder, CompletionConfig config,
                                  RetryPolicy retryPolicy, ResearchMetrics metrics) {
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.webClient = webClientBuilder.clone()
                .baseUrl(Objects.requireNonNull(config.getBaseUrl()))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        if (!isEnabled()) {
            log.warn("OpenAI API key is missing! Research jobs will fail until it is configured.");
        } else {
            log.info("OpenAI completion client enabled with model: {}", config.getModel());
        }
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        if (!isEnabled()) {
            return Mono.error(new ConfigurationMissingException("OpenAI API key is not configured"));
        }

        String model = request.model() != null ? request.model() : config.getModel();
        ChatRequest body = new ChatRequest(
                model,
                List.of(new ChatRequest.Message("system", request.systemPrompt()),
                        new ChatRequest.Message("user", request.userPrompt())),
                request.maxTokens(),
                request.jsonMode() ? new ChatRequest.ResponseFormat("json_object") : null);

        Mono<ChatResponse> call = Mono.defer(() -> {
            metrics.recordExternalCall(SERVICE);
            return webClient.post()
                    .uri(CHAT_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ChatResponse.class)
                    .timeout(request.timeout());
        });

        return retryPolicy.apply(call, "OpenAI " + request.operation())
                .doOnError(e -> {
                    metrics.recordExternalError(SERVICE);
                    log.warn("OpenAI call '{}' failed: {}", request.operation(), e.getMessage());
                })
                .map(response -> extractContent(response, request.operation()));
    }

    private String extractContent(ChatResponse response, String operation) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            throw new MalformedResponseException("OpenAI returned no choices for " + operation);
        }
        ChatResponse.Choice choice = response.choices().get(0);
        if (choice.finishReason() != null && !"stop".equals(choice.finishReason())) {
            log.warn("OpenAI finish reason for {}: {}", operation, choice.finishReason());
        }
        if (choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            throw new MalformedResponseException("OpenAI returned empty content for " + operation);
        }
        return choice.message().content();
    }

    @Override
    public String getDefaultModel() {
        return config.getModel();
    }

    @Override
    public boolean isEnabled() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatRequest(
            String model,
            List<Message> messages,
            @JsonProperty("max_tokens") int maxTokens,
            @JsonProperty("response_format") ResponseFormat responseFormat) {
        record Message(String role, String content) {
        }

        record ResponseFormat(String type) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(
                Message message,
                @JsonProperty("finish_reason") String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
