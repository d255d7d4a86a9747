package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.model.ContentItem;

import java.util.List;

/**
 * @param ranked   every item of the run with score and cluster assigned
 * @param clusters the selected shortlist, in presentation order
 */
public record RankingOutcome(List<ContentItem> ranked, List<ClusterSelection> clusters) {
    public RankingOutcome {
        ranked = List.copyOf(ranked);
        clusters = List.copyOf(clusters);
    }

    public static RankingOutcome empty() {
        return new RankingOutcome(List.of(), List.of());
    }

    public int selectedCount() {
        return clusters.stream().mapToInt(cluster -> cluster.allItems().size()).sum();
    }

    public List<ContentItem> selectedItems() {
        return clusters.stream().flatMap(cluster -> cluster.allItems().stream()).toList();
    }
}
