package com.dailybrief.curation.config;

public record SelectionConfig(int targetDigestSize, int maxItemsPerLane) {
    public static SelectionConfig defaults() {
        return new SelectionConfig(20, 3);
    }
}
