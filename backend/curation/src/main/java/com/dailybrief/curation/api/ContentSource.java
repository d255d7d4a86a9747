package com.dailybrief.curation.api;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.curation.config.SourceConfig;

import java.time.Instant;
import java.util.List;

/**
 * Fetch layer: turns one configured source into normalized, not yet stored items.
 * Implementations signal an unreachable or unreadable source by throwing.
 */
public interface ContentSource {
    List<ContentItem> fetch(SourceConfig source, Instant fetchedAt);
}
