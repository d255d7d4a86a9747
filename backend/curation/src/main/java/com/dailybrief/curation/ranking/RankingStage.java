package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.ProcessingStatus;
import com.dailybrief.curation.api.CurationContext;
import com.dailybrief.curation.config.RankingConfig;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Scores, clusters and selects the items enriched on a run date, persisting
 * each item's ranking before selection.
 */
public class RankingStage {
    private static final Logger LOGGER = Logger.getLogger(RankingStage.class.getName());

    private final CurationContext ctx;
    private final RankingConfig config;
    private final RelevanceScorer scorer;
    private final TopicClusterer clusterer;
    private final DigestSelector selector;

    public RankingStage(CurationContext ctx, RankingConfig config, TrustLookup trust) {
        this(ctx, config,
                new RelevanceScorer(config.weights(), config.recency(), trust),
                new TopicClusterer(config.minClusterSize()),
                new DigestSelector(config.lanes()));
    }

    RankingStage(
            CurationContext ctx,
            RankingConfig config,
            RelevanceScorer scorer,
            TopicClusterer clusterer,
            DigestSelector selector
    ) {
        this.ctx = ctx;
        this.config = config;
        this.scorer = scorer;
        this.clusterer = clusterer;
        this.selector = selector;
    }

    public RankingOutcome rank(LocalDate runDate) {
        List<ContentItem> candidates = ctx.itemStore().findByStatus(ProcessingStatus.ENRICHED).stream()
                .filter(item -> runDate.equals(LocalDate.ofInstant(item.fetchedAt(), ctx.clock().getZone())))
                .toList();
        if (candidates.isEmpty()) {
            LOGGER.info("No enriched items to rank for " + runDate);
            return RankingOutcome.empty();
        }

        RankingOutcome outcome = rankItems(candidates, ctx.clock().instant());
        outcome.ranked().forEach(ctx.itemStore()::update);
        LOGGER.info("Selected " + outcome.selectedCount() + " of " + candidates.size()
                + " items across " + outcome.clusters().size() + " clusters");
        return outcome;
    }

    /**
     * Pure ranking of an in-memory item set against a fixed reference time.
     */
    public RankingOutcome rankItems(List<ContentItem> items, Instant now) {
        List<ContentItem> scored = new ArrayList<>(items.size());
        for (ContentItem item : items) {
            scored.add(item.withRelevanceScore(scorer.score(item, now)));
        }

        List<ContentItem> ranked = clusterer.cluster(scored).stream()
                .map(item -> item.ranked(item.relevanceScore(), item.clusterId(), item.clusterTopic(), false))
                .toList();

        List<ClusterSelection> clusters = selector.select(
                ranked,
                config.selection().targetDigestSize(),
                config.selection().maxItemsPerLane()
        );
        return new RankingOutcome(ranked, clusters);
    }
}
