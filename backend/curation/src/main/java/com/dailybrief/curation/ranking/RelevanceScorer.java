package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.util.PublishedDates;
import com.dailybrief.curation.config.RecencyConfig;
import com.dailybrief.curation.config.ScoringWeights;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Composite relevance of an annotated item: a weighted sum of recency, source
 * trust, strongest lane affinity, popularity and novelty, rounded to four
 * decimals. The same item, weights and {@code now} always give the same score.
 */
public class RelevanceScorer {
    /** Used for components with no signal: missing publish dates, popularity and novelty. */
    public static final double NEUTRAL = 0.5;

    private static final double LN_2 = Math.log(2.0);

    private final ScoringWeights weights;
    private final RecencyConfig recency;
    private final TrustLookup trust;

    public RelevanceScorer(ScoringWeights weights, RecencyConfig recency, TrustLookup trust) {
        this.weights = weights;
        this.recency = recency;
        this.trust = trust;
    }

    public double score(ContentItem item, Instant now) {
        double laneAffinity = item.enrichment() == null ? 0.0 : item.enrichment().maxLaneScore();
        double composite = weights.recency() * recencyScore(item.publishedDate(), now)
                + weights.sourceTrust() * trust.trustFor(item.sourceId())
                + weights.laneAffinity() * laneAffinity
                + weights.popularity() * popularityScore(item)
                + weights.novelty() * noveltyScore(item);
        return round4(composite);
    }

    /**
     * Exponential decay with the configured half-life; {@link #NEUTRAL} when the
     * date is missing or unparseable, or so far ahead that the decay overflows.
     */
    public double recencyScore(String publishedDate, Instant now) {
        Optional<Instant> published = PublishedDates.parse(publishedDate);
        if (published.isEmpty()) {
            return NEUTRAL;
        }
        Duration age = Duration.between(published.get(), now);
        double hoursAgo = (age.getSeconds() + age.getNano() / 1_000_000_000.0) / 3600.0;
        double decay = Math.exp(-LN_2 * hoursAgo / recency.halfLifeHours());
        return Double.isFinite(decay) ? decay : NEUTRAL;
    }

    // No popularity or history signal is collected yet; both stay neutral.
    double popularityScore(ContentItem item) {
        return NEUTRAL;
    }

    double noveltyScore(ContentItem item) {
        return NEUTRAL;
    }

    static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
