package com.dailybrief.core.events;

import java.time.Instant;

public record SourceIngested(Instant timestamp, String source, int fetched, int newItems, long durationMillis)
        implements Event {
    @Override
    public String type() {
        return "SourceIngested";
    }
}
