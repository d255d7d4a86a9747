package com.dailybrief.curation.config;

import com.dailybrief.core.model.Lanes;

import java.util.List;

/**
 * Everything the ranking stage needs from configuration. Absent sections fall
 * back to their defaults.
 */
public record RankingConfig(
        ScoringWeights weights,
        RecencyConfig recency,
        SelectionConfig selection,
        Integer minClusterSize,
        List<String> lanes
) {
    public static final int DEFAULT_MIN_CLUSTER_SIZE = 3;

    public RankingConfig {
        weights = weights == null ? ScoringWeights.defaults() : weights;
        recency = recency == null ? RecencyConfig.defaults() : recency;
        selection = selection == null ? SelectionConfig.defaults() : selection;
        minClusterSize = minClusterSize == null || minClusterSize < 1 ? DEFAULT_MIN_CLUSTER_SIZE : minClusterSize;
        lanes = lanes == null || lanes.isEmpty() ? Lanes.DEFAULT : List.copyOf(lanes);
    }

    public static RankingConfig defaults() {
        return new RankingConfig(null, null, null, null, null);
    }
}
