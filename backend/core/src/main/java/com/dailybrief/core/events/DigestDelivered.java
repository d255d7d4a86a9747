package com.dailybrief.core.events;

import java.time.Instant;
import java.time.LocalDate;

public record DigestDelivered(Instant timestamp, LocalDate runDate, String path, int clusterCount, int itemCount)
        implements Event {
    @Override
    public String type() {
        return "DigestDelivered";
    }
}
