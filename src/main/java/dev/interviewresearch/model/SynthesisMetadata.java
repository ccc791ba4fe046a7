package dev.interviewresearch.model;

import java.time.Instant;

public record SynthesisMetadata(
        String model,
        int maxTokens,
        Instant timestamp,
        boolean fallbackUsed) {

    public SynthesisMetadata withFallback() {
        return new SynthesisMetadata(model, maxTokens, timestamp, true);
    }
}
