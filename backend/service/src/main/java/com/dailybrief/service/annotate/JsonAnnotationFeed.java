package com.dailybrief.service.annotate;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.util.JsonUtils;
import com.dailybrief.curation.api.Annotator;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Serves model annotations captured to disk as one JSON object keyed by item
 * URL. The file is read on first use. Values that are not JSON objects are
 * treated as unusable model output.
 */
public class JsonAnnotationFeed implements Annotator {
    private final Path file;
    private Map<String, Object> annotations;

    public JsonAnnotationFeed(Path file) {
        this.file = file;
    }

    @Override
    public Optional<Map<String, Object>> annotate(ContentItem item, String sanitizedText) {
        Object raw = annotations().get(item.url());
        if (!(raw instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        Map<String, Object> annotation = new HashMap<>();
        map.forEach((key, value) -> annotation.put(String.valueOf(key), value));
        return Optional.of(annotation);
    }

    private Map<String, Object> annotations() {
        if (annotations == null) {
            annotations = load();
        }
        return annotations;
    }

    private Map<String, Object> load() {
        if (!Files.exists(file)) {
            return Map.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, Object> loaded = JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
            return loaded == null ? Map.of() : loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading annotations from " + file, e);
        }
    }
}
