package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.model.ContentItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Greedy budgeted selection. Clusters are visited in ascending id (largest
 * first), items within a cluster by descending relevance. An item joins every
 * lane it has affinity for, up to the per-lane cap; an item with no such lane
 * is placed in its strongest lane if that lane has room. Each placed item costs
 * one unit of the global budget however many lanes it joined.
 */
public class DigestSelector {
    public static final double LANE_THRESHOLD = 0.3;

    private final List<String> lanes;

    public DigestSelector(List<String> lanes) {
        if (lanes.isEmpty()) {
            throw new IllegalArgumentException("at least one lane is required");
        }
        this.lanes = List.copyOf(lanes);
    }

    /**
     * @return non-empty cluster selections, best mean relevance first
     */
    public List<ClusterSelection> select(List<ContentItem> items, int targetTotal, int maxPerLane) {
        Map<Integer, List<ContentItem>> byCluster = new TreeMap<>();
        Map<Integer, String> topics = new HashMap<>();
        for (ContentItem item : items) {
            int clusterId = item.clusterId() == null ? 0 : item.clusterId();
            byCluster.computeIfAbsent(clusterId, ignored -> new ArrayList<>()).add(item);
            topics.putIfAbsent(clusterId, item.clusterTopic() == null ? TopicClusterer.UNCATEGORIZED : item.clusterTopic());
        }

        SelectionBudget budget = new SelectionBudget(targetTotal);
        List<ClusterSelection> result = new ArrayList<>();
        for (Map.Entry<Integer, List<ContentItem>> cluster : byCluster.entrySet()) {
            ClusterSelection selection = selectCluster(
                    cluster.getKey(), topics.get(cluster.getKey()), cluster.getValue(), maxPerLane, budget);
            if (selection.hasLaneItems()) {
                result.add(selection);
            }
        }

        result.sort(Comparator.comparingDouble(ClusterSelection::meanScore).reversed());
        return result;
    }

    ClusterSelection selectCluster(
            int clusterId,
            String topic,
            List<ContentItem> members,
            int maxPerLane,
            SelectionBudget budget
    ) {
        List<ContentItem> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparingDouble(ContentItem::scoreOrZero).reversed());

        Map<String, List<ContentItem>> laneItems = new LinkedHashMap<>();
        lanes.forEach(lane -> laneItems.put(lane, new ArrayList<>()));
        List<ContentItem> allItems = new ArrayList<>();

        for (ContentItem item : ordered) {
            if (budget.exhausted()) {
                break;
            }
            boolean placed = false;
            for (String lane : lanes) {
                List<ContentItem> bucket = laneItems.get(lane);
                if (item.laneScore(lane) >= LANE_THRESHOLD && bucket.size() < maxPerLane) {
                    bucket.add(item);
                    placed = true;
                }
            }
            if (!placed) {
                List<ContentItem> strongest = laneItems.get(strongestLane(item));
                if (strongest.size() < maxPerLane) {
                    strongest.add(item);
                    placed = true;
                }
            }
            if (placed) {
                allItems.add(item);
                budget.consume();
            }
        }
        return new ClusterSelection(clusterId, topic, laneItems, allItems);
    }

    /**
     * Highest-affinity lane; the earliest configured lane wins ties.
     */
    String strongestLane(ContentItem item) {
        String best = lanes.get(0);
        for (String lane : lanes) {
            if (item.laneScore(lane) > item.laneScore(best)) {
                best = lane;
            }
        }
        return best;
    }
}
