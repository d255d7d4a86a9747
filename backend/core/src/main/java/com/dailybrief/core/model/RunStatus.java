package com.dailybrief.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
