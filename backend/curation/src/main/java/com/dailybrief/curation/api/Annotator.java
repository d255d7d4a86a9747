package com.dailybrief.curation.api;

import com.dailybrief.core.model.ContentItem;

import java.util.Map;
import java.util.Optional;

/**
 * Model-annotation layer. Returns the model's raw, untrusted annotation for an
 * item, or empty when the model produced nothing usable.
 */
public interface Annotator {
    Optional<Map<String, Object>> annotate(ContentItem item, String sanitizedText);
}
