package dev.interviewresearch.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.interviewresearch.config.CompletionConfig;
import dev.interviewresearch.error.ConfigurationMissingException;
import dev.interviewresearch.error.MalformedResponseException;
import dev.interviewresearch.metrics.ResearchMetrics;
import dev.interviewresearch.support.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * CompletionClient that uses Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication - no service account required.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "research.completion.provider", havingValue = "gemini")
public class GeminiCompletionClient implements CompletionClient {

    private static final String SERVICE = "gemini";

    private final WebClient webClient;
    private final CompletionConfig.Gemini gemini;
    private final String model;
    private final RetryPolicy retryPolicy;
    private final ResearchMetrics metrics;

    public GeminiCompletionClient(WebClient.Builder webClientBuilder, CompletionConfig config,
                                  RetryPolicy retryPolicy, ResearchMetrics metrics) {
        this.gemini = config.getGemini();
        // gemini-1.5-flash answers 404 in several regions; the alias follows the current flash model
        this.model = "gemini-1.5-flash".equals(gemini.getModel()) ? "gemini-flash-latest" : gemini.getModel();
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;

        this.webClient = webClientBuilder.clone()
                .baseUrl(Objects.requireNonNull(gemini.getBaseUrl()))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (!isEnabled()) {
            log.warn("Gemini API Key is missing! Research jobs will fail until it is configured.");
        } else {
            log.info("Gemini completion client enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        if (!isEnabled()) {
            return Mono.error(new ConfigurationMissingException("Gemini API key is not configured"));
        }

        String requestModel = request.model() != null ? request.model() : model;
        String uri = String.format(gemini.getPath(), requestModel) + "?key=" + gemini.getApiKey();
        GeminiRequest body = buildRequest(request);

        Mono<GeminiResponse> call = Mono.defer(() -> {
            metrics.recordExternalCall(SERVICE);
            return webClient.post()
                    .uri(uri)
                    .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(GeminiResponse.class)
                    .timeout(request.timeout());
        });

        return retryPolicy.apply(call, "Gemini " + request.operation())
                .doOnError(e -> {
                    metrics.recordExternalError(SERVICE);
                    log.warn("Gemini call '{}' failed: {}", request.operation(), e.getMessage());
                })
                .map(response -> extractContent(response, request.operation()));
    }

    private GeminiRequest buildRequest(CompletionRequest request) {
        return new GeminiRequest(
                new GeminiRequest.Content(null, List.of(new GeminiRequest.Part(request.systemPrompt()))),
                List.of(new GeminiRequest.Content("user", List.of(new GeminiRequest.Part(request.userPrompt())))),
                new GeminiRequest.GenerationConfig(0.3, request.maxTokens(),
                        request.jsonMode() ? "application/json" : null));
    }

    private String extractContent(GeminiResponse response, String operation) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new MalformedResponseException("Gemini returned no candidates for " + operation);
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason for {}: {}", operation, candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new MalformedResponseException("Gemini candidate has no content parts for " + operation);
        }

        String text = candidate.content().parts().get(0).text();
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Gemini returned empty text for " + operation);
        }
        return text;
    }

    @Override
    public String getDefaultModel() {
        return model;
    }

    @Override
    public boolean isEnabled() {
        return gemini.getApiKey() != null && !gemini.getApiKey().isBlank();
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GeminiRequest(
            Content systemInstruction,
            List<Content> contents,
            GenerationConfig generationConfig) {
        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Content(String role, List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(double temperature, int maxOutputTokens, String responseMimeType) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
