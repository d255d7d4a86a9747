package com.dailybrief.core.events;

import java.time.Instant;

public record RunCompleted(
        Instant timestamp,
        long runId,
        boolean success,
        int itemsIngested,
        int itemsEnriched,
        int itemsSelected,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
