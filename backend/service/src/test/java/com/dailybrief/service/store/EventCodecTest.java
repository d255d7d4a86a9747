package com.dailybrief.service.store;

import com.dailybrief.core.bus.EventBus;
import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.events.ContentFlagged;
import com.dailybrief.core.events.DigestDelivered;
import com.dailybrief.core.events.Event;
import com.dailybrief.core.events.RunCompleted;
import com.dailybrief.core.events.RunStarted;
import com.dailybrief.core.events.SourceIngested;
import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventCodecTest {
    private static final Instant NOW = Instant.parse("2026-03-02T06:00:00Z");
    private static final LocalDate DATE = LocalDate.of(2026, 3, 2);

    @Test
    void everyEventTypeSurvivesTheEnvelope() {
        List<Event> events = List.of(
                new RunStarted(NOW, 1, DATE, "technical"),
                new RunCompleted(NOW, 1, true, 4, 3, 3, 1200),
                new SourceIngested(NOW, "krebs", 3, 1, 40),
                new ContentFlagged(NOW, "krebs", "https://krebsonsecurity.com/a", 1),
                new DigestDelivered(NOW, DATE, "briefs/brief-2026-03-02.json", 2, 3),
                new AlertRaised(NOW, "ingestion", "Fetch failed for hn", Map.of("source", "hn"))
        );
        assertEquals(events.size(), EventCodec.allEventTypes().size());

        for (Event event : events) {
            assertEquals(event, EventCodec.fromJsonLine(EventCodec.toJsonLine(event)));
        }
    }

    @Test
    void envelopeCarriesTypeAndTimestamp() throws Exception {
        JsonNode node = JsonUtils.objectMapper().readTree(
                EventCodec.toJsonLine(new RunStarted(NOW, 7, DATE, "team")));

        assertEquals("RunStarted", node.path("type").asText());
        assertEquals("2026-03-02T06:00:00Z", node.path("timestamp").asText());
        assertEquals("2026-03-02", node.path("event").path("runDate").asText());
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EventCodec.fromJsonLine("{\"type\":\"Mystery\",\"event\":{}}"));
    }

    @Test
    void subscribeAllForwardsEveryPublishedEvent() {
        EventBus bus = new EventBus();
        List<String> forwarded = new ArrayList<>();
        EventCodec.subscribeAll(bus, event -> forwarded.add(event.type()));

        bus.publish(new RunStarted(NOW, 1, DATE, "technical"));
        bus.publish(new SourceIngested(NOW, "hn", 0, 0, 1));
        bus.publish(new RunCompleted(NOW, 1, false, 0, 0, 0, 5));

        assertEquals(List.of("RunStarted", "SourceIngested", "RunCompleted"), forwarded);
    }
}
