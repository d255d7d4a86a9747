package com.dailybrief.core.model;

public record EntityRef(String name, String type) {
    public static final String UNKNOWN_TYPE = "unknown";
}
