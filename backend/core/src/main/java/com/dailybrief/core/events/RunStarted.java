package com.dailybrief.core.events;

import java.time.Instant;
import java.time.LocalDate;

public record RunStarted(Instant timestamp, long runId, LocalDate runDate, String profile) implements Event {
    @Override
    public String type() {
        return "RunStarted";
    }
}
