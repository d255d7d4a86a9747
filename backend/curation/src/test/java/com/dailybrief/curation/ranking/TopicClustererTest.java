package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.curation.support.Items;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicClustererTest {
    private final TopicClusterer clusterer = new TopicClusterer(3);

    @Test
    void smallGroupsFoldIntoParentCategory() {
        List<ContentItem> clustered = clusterer.cluster(List.of(
                item("a1", "AI > Agents"),
                item("m1", "AI > Models"),
                item("a2", "AI > Agents"),
                item("s1", "Security > Breach"),
                item("a3", "AI > Agents")
        ));

        assertEquals(List.of("a1", "m1", "a2", "s1", "a3"), urls(clustered));
        assertEquals(List.of("AI > Agents", "AI", "AI > Agents", "Security", "AI > Agents"),
                clustered.stream().map(ContentItem::clusterTopic).toList());
        assertEquals(List.of(0, 1, 0, 2, 0), clustered.stream().map(ContentItem::clusterId).toList());
    }

    @Test
    void foldedGroupsJoinAnExistingParentGroup() {
        List<ContentItem> clustered = clusterer.cluster(List.of(
                item("s1", "Security > Breach"),
                item("c1", "Cloud"),
                item("c2", "Cloud > Pricing"),
                item("c3", "Cloud > Outages")
        ));

        assertEquals(List.of("Security", "Cloud", "Cloud", "Cloud"),
                clustered.stream().map(ContentItem::clusterTopic).toList());
        assertEquals(List.of(1, 0, 0, 0), clustered.stream().map(ContentItem::clusterId).toList());
    }

    @Test
    void equalSizedClustersKeepEncounterOrder() {
        List<ContentItem> clustered = new TopicClusterer(1).cluster(List.of(
                item("b1", "Business"),
                item("r1", "Rust"),
                item("r2", "Rust"),
                item("g1", "Go")
        ));

        assertEquals(List.of(1, 0, 0, 2), clustered.stream().map(ContentItem::clusterId).toList());
    }

    @Test
    void itemsWithoutTopicsAreUncategorized() {
        List<ContentItem> clustered = clusterer.cluster(List.of(item("x", null)));

        assertEquals(TopicClusterer.UNCATEGORIZED, clustered.get(0).clusterTopic());
        assertEquals(0, clustered.get(0).clusterId());
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertTrue(clusterer.cluster(List.of()).isEmpty());
    }

    @Test
    void parentCategoryIsTextBeforeFirstSeparator() {
        assertEquals("AI", TopicClusterer.parentCategory("AI > Agents > Memory"));
        assertEquals("Cloud", TopicClusterer.parentCategory("Cloud"));
    }

    @Test
    void minimumSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TopicClusterer(0));
    }

    private static ContentItem item(String url, String topic) {
        return Items.enriched(url, "src", null, topic, 0.5, 0.0, 0.0);
    }

    private static List<String> urls(List<ContentItem> items) {
        return items.stream().map(ContentItem::url).toList();
    }
}
