package com.dailybrief.curation.config;

import java.util.List;

public record SourceConfig(
        String id,
        String name,
        String category,
        Double trustWeight,
        boolean enabled,
        List<String> domains
) {
    public static final double DEFAULT_TRUST = 0.5;

    public SourceConfig {
        name = name == null ? id : name;
        trustWeight = trustWeight == null ? DEFAULT_TRUST : trustWeight;
        domains = domains == null ? List.of() : List.copyOf(domains);
    }
}
