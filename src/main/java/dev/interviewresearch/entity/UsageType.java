package dev.interviewresearch.entity;

public enum UsageType {
    REUSED,
    FRESH_SCRAPE
}
