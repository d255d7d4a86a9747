package com.dailybrief.curation.config;

/**
 * Weights of the five relevance components. They are expected to sum to 1.0
 * but are used as given.
 */
public record ScoringWeights(
        double recency,
        double sourceTrust,
        double laneAffinity,
        double popularity,
        double novelty
) {
    public static ScoringWeights defaults() {
        return new ScoringWeights(0.3, 0.2, 0.3, 0.1, 0.1);
    }
}
