package com.dailybrief.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a content item. Items only move forward through these states.
 */
public enum ProcessingStatus {
    PENDING_ENRICHMENT,
    ENRICHED,
    RANKED,
    PUBLISHED;

    public boolean canAdvanceTo(ProcessingStatus next) {
        return next.ordinal() >= ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
