package dev.interviewresearch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum SearchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<SearchStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
