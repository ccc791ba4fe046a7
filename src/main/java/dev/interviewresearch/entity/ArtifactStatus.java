package dev.interviewresearch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How far the artifact bundle of a search has been written.
 */
public enum ArtifactStatus {
    RAW_DATA_SAVED,
    COMPLETE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
