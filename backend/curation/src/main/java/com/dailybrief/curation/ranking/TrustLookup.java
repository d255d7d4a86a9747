package com.dailybrief.curation.ranking;

import com.dailybrief.curation.config.SourceConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class TrustLookup {
    private final Map<String, Double> weights;

    public TrustLookup(Map<String, Double> weights) {
        this.weights = Map.copyOf(weights);
    }

    public static TrustLookup fromSources(List<SourceConfig> sources) {
        Map<String, Double> weights = new HashMap<>();
        for (SourceConfig source : sources) {
            weights.put(source.id(), source.trustWeight());
        }
        return new TrustLookup(weights);
    }

    public double trustFor(String sourceId) {
        if (sourceId == null) {
            return SourceConfig.DEFAULT_TRUST;
        }
        return weights.getOrDefault(sourceId, SourceConfig.DEFAULT_TRUST);
    }
}
