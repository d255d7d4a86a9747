package com.dailybrief.core.util;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.Enrichment;
import com.dailybrief.core.model.EntityRef;
import com.dailybrief.core.model.ProcessingStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        String json = first.writeValueAsString(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z")));
        assertTrue(json.contains("\"name\":\"ok\""));
        assertTrue(json.contains("\"createdAt\":\"2026-02-01T00:00:00Z\""));
        assertFalse(json.contains("optional"));
    }

    @Test
    void contentItemSurvivesJsonWithStatusAsLowercaseName() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        ContentItem item = ContentItem.fetched(
                        "https://infoq.com/a", "A", "infoq", "InfoQ", "engineering",
                        "2026-03-01T08:00:00Z", Instant.parse("2026-03-02T06:00:00Z"), "article", "body")
                .withEnrichment(new Enrichment("short", "long", List.of("AI"),
                        List.of(new EntityRef("OpenAI", "org")), Map.of("builders", 0.8)));

        String json = mapper.writeValueAsString(item);
        JsonNode tree = mapper.readTree(json);
        assertEquals("enriched", tree.get("status").asText());
        assertFalse(tree.has("relevanceScore"));

        ContentItem parsed = mapper.readValue(json, ContentItem.class);
        assertEquals(item, parsed);
        assertEquals(ProcessingStatus.ENRICHED, parsed.status());
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
