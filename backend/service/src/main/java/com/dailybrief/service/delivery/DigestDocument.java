package com.dailybrief.service.delivery;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.model.ContentItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendering contract handed to whatever turns the digest into a readable page.
 */
public record DigestDocument(
        String profile,
        LocalDate runDate,
        Instant generatedAt,
        int itemCount,
        List<ClusterView> clusters
) {
    public static DigestDocument from(String profile, LocalDate runDate, Instant generatedAt, List<ClusterSelection> selections) {
        List<ClusterView> clusters = selections.stream().map(ClusterView::from).toList();
        int itemCount = clusters.stream().mapToInt(cluster -> cluster.items().size()).sum();
        return new DigestDocument(profile, runDate, generatedAt, itemCount, clusters);
    }

    public record ClusterView(
            int clusterId,
            String topic,
            double meanScore,
            Map<String, List<ItemView>> lanes,
            List<ItemView> items
    ) {
        static ClusterView from(ClusterSelection selection) {
            Map<String, List<ItemView>> lanes = new LinkedHashMap<>();
            selection.lanes().forEach((lane, items) -> lanes.put(lane, items.stream().map(ItemView::from).toList()));
            return new ClusterView(
                    selection.clusterId(),
                    selection.topic(),
                    Math.round(selection.meanScore() * 10_000.0) / 10_000.0,
                    lanes,
                    selection.allItems().stream().map(ItemView::from).toList()
            );
        }
    }

    public record ItemView(
            String title,
            String url,
            String source,
            String summary,
            Double relevanceScore,
            List<String> topics
    ) {
        static ItemView from(ContentItem item) {
            return new ItemView(
                    item.title(),
                    item.url(),
                    item.sourceName(),
                    item.enrichment() == null ? null : item.enrichment().summaryShort(),
                    item.relevanceScore(),
                    item.topics()
            );
        }
    }
}
