package dev.interviewresearch.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Combined gatherer output. Each field is null when its gatherer was skipped, failed or abandoned.
 */
public record GatheredResearch(
        JsonNode companyResearch,
        JsonNode jobRequirements,
        JsonNode cvAnalysis) {

    public static GatheredResearch empty() {
        return new GatheredResearch(null, null, null);
    }

    public static GatheredResearch from(Map<GathererKey, GatherOutcome> outcomes) {
        return new GatheredResearch(
                valueOf(outcomes, GathererKey.COMPANY_RESEARCH),
                valueOf(outcomes, GathererKey.JOB_REQUIREMENTS),
                valueOf(outcomes, GathererKey.CV_ANALYSIS));
    }

    private static JsonNode valueOf(Map<GathererKey, GatherOutcome> outcomes, GathererKey key) {
        GatherOutcome outcome = outcomes.get(key);
        return outcome != null && outcome.hasValue() ? outcome.value() : null;
    }

    public int availableSources() {
        int count = 0;
        if (companyResearch != null) count++;
        if (jobRequirements != null) count++;
        if (cvAnalysis != null) count++;
        return count;
    }
}
