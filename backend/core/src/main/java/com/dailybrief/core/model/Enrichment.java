package com.dailybrief.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated model annotation of a content item. Lane scores keep the order of
 * the configured lanes.
 */
public record Enrichment(
        String summaryShort,
        String summaryLong,
        List<String> topics,
        List<EntityRef> entities,
        Map<String, Double> laneScores
) {
    public Enrichment {
        summaryShort = summaryShort == null ? "" : summaryShort;
        summaryLong = summaryLong == null ? "" : summaryLong;
        topics = topics == null ? List.of() : List.copyOf(topics);
        entities = entities == null ? List.of() : List.copyOf(entities);
        laneScores = laneScores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(laneScores));
    }

    public double laneScore(String lane) {
        Double score = laneScores.get(lane);
        return score == null ? 0.0 : score;
    }

    public double maxLaneScore() {
        return laneScores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
