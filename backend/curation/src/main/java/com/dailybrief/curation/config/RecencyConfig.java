package com.dailybrief.curation.config;

public record RecencyConfig(double halfLifeHours) {
    public static final double DEFAULT_HALF_LIFE_HOURS = 48.0;

    public RecencyConfig {
        if (halfLifeHours <= 0) {
            throw new IllegalArgumentException("halfLifeHours must be positive, got " + halfLifeHours);
        }
    }

    public static RecencyConfig defaults() {
        return new RecencyConfig(DEFAULT_HALF_LIFE_HOURS);
    }
}
