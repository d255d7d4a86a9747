package com.dailybrief.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Items chosen for one cluster: per-lane lists plus the combined list in which
 * every selected item appears exactly once.
 */
public record ClusterSelection(
        int clusterId,
        String topic,
        Map<String, List<ContentItem>> lanes,
        List<ContentItem> allItems
) {
    public ClusterSelection {
        Map<String, List<ContentItem>> copied = new LinkedHashMap<>();
        lanes.forEach((lane, items) -> copied.put(lane, List.copyOf(items)));
        lanes = Collections.unmodifiableMap(copied);
        allItems = List.copyOf(allItems);
    }

    public List<ContentItem> lane(String lane) {
        return lanes.getOrDefault(lane, List.of());
    }

    public boolean hasLaneItems() {
        return lanes.values().stream().anyMatch(items -> !items.isEmpty());
    }

    public double meanScore() {
        double total = allItems.stream().mapToDouble(ContentItem::scoreOrZero).sum();
        return total / Math.max(allItems.size(), 1);
    }
}
