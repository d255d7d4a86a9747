package com.dailybrief.curation.ranking;

import com.dailybrief.core.model.ClusterSelection;
import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.Lanes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.dailybrief.curation.support.Items.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestSelectorTest {
    private final DigestSelector selector = new DigestSelector(Lanes.DEFAULT);

    @Test
    void globalBudgetStopsSelectionAcrossClusters() {
        List<ContentItem> items = List.of(
                scored("a", 0.9, 0, 0.8, 0.0, 0.0),
                scored("b", 0.8, 0, 0.8, 0.0, 0.0),
                scored("c", 0.7, 0, 0.0, 0.8, 0.0),
                scored("d", 0.95, 1, 0.0, 0.0, 0.8),
                scored("e", 0.94, 1, 0.0, 0.0, 0.8)
        );

        List<ClusterSelection> selected = selector.select(items, 2, 3);

        assertEquals(1, selected.size());
        assertEquals(0, selected.get(0).clusterId());
        assertEquals(List.of("a", "b"), urls(selected.get(0).allItems()));
    }

    @Test
    void laneCapLimitsEachLane() {
        List<ContentItem> items = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            items.add(scored("b" + i, 0.9 - i * 0.1, 0, 0.9, 0.0, 0.0));
        }

        ClusterSelection cluster = selector.select(items, 10, 3).get(0);

        assertEquals(List.of("b0", "b1", "b2"), urls(cluster.lane(Lanes.BUILDERS)));
        assertEquals(List.of("b0", "b1", "b2"), urls(cluster.allItems()));
    }

    @Test
    void itemInSeveralLanesCostsOneBudgetUnit() {
        List<ContentItem> items = List.of(
                scored("both", 0.9, 0, 0.5, 0.5, 0.0),
                scored("next", 0.8, 0, 0.0, 0.0, 0.6)
        );

        ClusterSelection cluster = selector.select(items, 2, 3).get(0);

        assertEquals(List.of("both"), urls(cluster.lane(Lanes.BUILDERS)));
        assertEquals(List.of("both"), urls(cluster.lane(Lanes.SECURITY)));
        assertEquals(List.of("next"), urls(cluster.lane(Lanes.BUSINESS)));
        assertEquals(List.of("both", "next"), urls(cluster.allItems()));
    }

    @Test
    void itemBelowThresholdEverywhereFallsBackToStrongestLane() {
        List<ContentItem> items = List.of(
                scored("weak", 0.5, 0, 0.1, 0.2, 0.25),
                scored("flat", 0.4, 0, 0.0, 0.0, 0.0)
        );

        ClusterSelection cluster = selector.select(items, 10, 3).get(0);

        assertEquals(List.of("weak"), urls(cluster.lane(Lanes.BUSINESS)));
        assertEquals(List.of("flat"), urls(cluster.lane(Lanes.BUILDERS)));
        assertEquals(List.of(), cluster.lane(Lanes.SECURITY));
    }

    @Test
    void fallbackIsSkippedWhenStrongestLaneIsFull() {
        List<ContentItem> items = List.of(
                scored("s1", 0.9, 0, 0.0, 0.9, 0.0),
                scored("weak", 0.5, 0, 0.0, 0.2, 0.0)
        );

        ClusterSelection cluster = selector.select(items, 10, 1).get(0);

        assertEquals(List.of("s1"), urls(cluster.allItems()));
    }

    @Test
    void clustersWithoutPlacedItemsAreDropped() {
        List<ContentItem> items = List.of(
                scored("a", 0.9, 0, 0.9, 0.0, 0.0),
                scored("b", 0.8, 1, 0.9, 0.0, 0.0)
        );

        assertTrue(selector.select(items, 10, 0).isEmpty());
        assertEquals(1, selector.select(items, 1, 3).size());
    }

    @Test
    void resultIsOrderedByMeanRelevance() {
        List<ContentItem> items = List.of(
                scored("big1", 0.4, 0, 0.9, 0.0, 0.0),
                scored("big2", 0.3, 0, 0.9, 0.0, 0.0),
                scored("big3", 0.2, 0, 0.9, 0.0, 0.0),
                scored("small", 0.8, 1, 0.0, 0.9, 0.0)
        );

        List<ClusterSelection> selected = selector.select(items, 10, 3);

        assertEquals(List.of(1, 0), selected.stream().map(ClusterSelection::clusterId).toList());
        assertEquals(0.3, selected.get(1).meanScore(), 1e-9);
    }

    @Test
    void itemsAreVisitedByDescendingScoreWithinCluster() {
        List<ContentItem> items = List.of(
                scored("low", 0.2, 0, 0.9, 0.0, 0.0),
                scored("high", 0.9, 0, 0.9, 0.0, 0.0),
                scored("mid", 0.5, 0, 0.9, 0.0, 0.0)
        );

        ClusterSelection cluster = selector.select(items, 2, 3).get(0);

        assertEquals(List.of("high", "mid"), urls(cluster.allItems()));
    }

    @Test
    void emptyInputSelectsNothing() {
        assertTrue(selector.select(List.of(), 10, 3).isEmpty());
    }

    @Test
    void requiresAtLeastOneLane() {
        assertThrows(IllegalArgumentException.class, () -> new DigestSelector(List.of()));
    }

    private static List<String> urls(List<ContentItem> items) {
        return items.stream().map(ContentItem::url).toList();
    }
}
