package com.dailybrief.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentItemTest {
    private static final Instant FETCHED = Instant.parse("2026-03-02T06:00:00Z");

    @Test
    void fetchedItemStartsPendingWithoutRankingFields() {
        ContentItem item = item();

        assertEquals(ProcessingStatus.PENDING_ENRICHMENT, item.status());
        assertNull(item.enrichment());
        assertNull(item.relevanceScore());
        assertEquals(0.0, item.scoreOrZero());
        assertEquals(0.0, item.laneScore(Lanes.SECURITY));
        assertEquals(List.of(), item.topics());
    }

    @Test
    void statusOnlyMovesForward() {
        ContentItem enriched = item().withEnrichment(enrichment());
        ContentItem ranked = enriched.ranked(0.61, 2, "AI", false);
        ContentItem published = ranked.withStatus(ProcessingStatus.PUBLISHED);

        assertEquals(ProcessingStatus.ENRICHED, enriched.status());
        assertEquals(ProcessingStatus.RANKED, ranked.status());
        assertEquals(ProcessingStatus.PUBLISHED, published.status());
        assertEquals(0.61, published.relevanceScore());
        assertEquals(2, published.clusterId());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ranked.withEnrichment(enrichment()));
        assertTrue(ex.getMessage().contains("cannot move from"));
        assertThrows(IllegalStateException.class, () -> published.withStatus(ProcessingStatus.RANKED));
    }

    @Test
    void canAdvanceToIsMonotonic() {
        for (ProcessingStatus from : ProcessingStatus.values()) {
            for (ProcessingStatus to : ProcessingStatus.values()) {
                assertEquals(to.ordinal() >= from.ordinal(), from.canAdvanceTo(to), from + " -> " + to);
            }
        }
    }

    @Test
    void requiredIdentityFieldsAreChecked() {
        assertThrows(NullPointerException.class, () -> ContentItem.fetched(
                null, "t", "hn", "HN", "community", null, FETCHED, "article", "x"));
        assertThrows(NullPointerException.class, () -> ContentItem.fetched(
                "https://a.example", "t", "hn", "HN", "community", null, null, "article", "x"));
    }

    @Test
    void enrichmentDefaultsAndLaneLookups() {
        Enrichment empty = new Enrichment(null, null, null, null, null);
        assertEquals("", empty.summaryShort());
        assertEquals(List.of(), empty.topics());
        assertEquals(0.0, empty.maxLaneScore());

        ContentItem item = item().withEnrichment(enrichment());
        assertEquals(0.9, item.laneScore(Lanes.SECURITY));
        assertEquals(0.0, item.laneScore("unknown-lane"));
        assertEquals(0.9, item.enrichment().maxLaneScore());
        assertFalse(item.noveltyFlag());
    }

    private static ContentItem item() {
        return ContentItem.fetched("https://krebsonsecurity.com/a", "Breach", "krebs", "Krebs on Security",
                "security", "2026-03-01T08:00:00Z", FETCHED, "article", "text");
    }

    private static Enrichment enrichment() {
        return new Enrichment("short", "long", List.of("Security > Breach"), List.of(),
                Map.of(Lanes.BUILDERS, 0.1, Lanes.SECURITY, 0.9, Lanes.BUSINESS, 0.2));
    }
}
