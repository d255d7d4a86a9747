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
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One-line JSON envelope for events: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "RunStarted", RunStarted.class,
            "RunCompleted", RunCompleted.class,
            "SourceIngested", SourceIngested.class,
            "ContentFlagged", ContentFlagged.class,
            "DigestDelivered", DigestDelivered.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    /**
     * Routes every known event type published on {@code bus} to {@code consumer}.
     */
    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribe(Event.class, event -> {
            if (TYPES.containsKey(event.type())) {
                consumer.accept(event);
            }
        });
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
