package dev.interviewresearch.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Locale;

/**
 * Settled result of one gatherer. A gatherer never errors; it reports one of these instead.
 */
public record GatherOutcome(
        GathererKey key,
        Status status,
        JsonNode value,
        String error,
        Duration elapsed) {

    public enum Status {
        OK, SKIPPED, FAILED, ABANDONED;

        public String metricName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static GatherOutcome ok(GathererKey key, JsonNode value, Duration elapsed) {
        return new GatherOutcome(key, Status.OK, value, null, elapsed);
    }

    public static GatherOutcome skipped(GathererKey key) {
        return new GatherOutcome(key, Status.SKIPPED, null, null, Duration.ZERO);
    }

    public static GatherOutcome failed(GathererKey key, String error, Duration elapsed) {
        return new GatherOutcome(key, Status.FAILED, null, error, elapsed);
    }

    public static GatherOutcome abandoned(GathererKey key, Duration elapsed) {
        return new GatherOutcome(key, Status.ABANDONED, null, "abandoned at gather deadline", elapsed);
    }

    public boolean hasValue() {
        return status == Status.OK && value != null;
    }
}
