package com.dailybrief.curation.api;

import com.dailybrief.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record CurationContext(EventBus eventBus, ItemStore itemStore, Clock clock) {
    public CurationContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(itemStore, "itemStore is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
