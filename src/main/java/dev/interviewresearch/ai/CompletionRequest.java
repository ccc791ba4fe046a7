package dev.interviewresearch.ai;

import java.time.Duration;

/**
 * One request to the completion service.
 *
 * @param operation    label used in logs and retry messages
 * @param model        model override, or null for the client default
 * @param systemPrompt instructions
 * @param userPrompt   material to work on
 * @param maxTokens    output token budget
 * @param jsonMode     require a JSON object answer
 * @param timeout      deadline for each attempt
 */
public record CompletionRequest(
        String operation,
        String model,
        String systemPrompt,
        String userPrompt,
        int maxTokens,
        boolean jsonMode,
        Duration timeout) {
}
