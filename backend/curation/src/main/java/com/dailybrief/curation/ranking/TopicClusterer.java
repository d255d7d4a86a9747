package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ContentItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups items by their first topic tag, then folds groups smaller than the
 * minimum size into their parent category ({@code "agents > memory"} into
 * {@code "agents"}). Cluster ids follow descending group size, ties in
 * encounter order, so id 0 is always the largest group.
 */
public class TopicClusterer {
    public static final String UNCATEGORIZED = "uncategorized";
    public static final String SEPARATOR = " > ";

    private final int minClusterSize;

    public TopicClusterer(int minClusterSize) {
        if (minClusterSize < 1) {
            throw new IllegalArgumentException("minClusterSize must be at least 1, got " + minClusterSize);
        }
        this.minClusterSize = minClusterSize;
    }

    /**
     * @return the items in input order, each carrying its cluster id and topic
     */
    public List<ContentItem> cluster(List<ContentItem> items) {
        if (items.isEmpty()) {
            return items;
        }

        Map<String, List<Integer>> fineGroups = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            fineGroups.computeIfAbsent(primaryTopic(items.get(i)), ignored -> new ArrayList<>()).add(i);
        }

        Map<String, List<Integer>> finalGroups = new LinkedHashMap<>();
        fineGroups.forEach((topic, members) -> {
            String key = members.size() >= minClusterSize ? topic : parentCategory(topic);
            finalGroups.computeIfAbsent(key, ignored -> new ArrayList<>()).addAll(members);
        });

        List<String> ordered = new ArrayList<>(finalGroups.keySet());
        ordered.sort(Comparator.comparingInt((String key) -> finalGroups.get(key).size()).reversed());

        List<ContentItem> clustered = new ArrayList<>(items);
        for (int clusterId = 0; clusterId < ordered.size(); clusterId++) {
            String topic = ordered.get(clusterId);
            for (int index : finalGroups.get(topic)) {
                clustered.set(index, clustered.get(index).withCluster(clusterId, topic));
            }
        }
        return clustered;
    }

    static String primaryTopic(ContentItem item) {
        List<String> topics = item.topics();
        return topics.isEmpty() ? UNCATEGORIZED : topics.get(0);
    }

    static String parentCategory(String topic) {
        int separator = topic.indexOf(SEPARATOR);
        return separator < 0 ? topic : topic.substring(0, separator);
    }
}
