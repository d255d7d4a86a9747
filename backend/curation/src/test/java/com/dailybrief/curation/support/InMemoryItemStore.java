package com.dailybrief.curation.support;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.ProcessingStatus;
import com.dailybrief.curation.api.ItemStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryItemStore implements ItemStore {
    private final Map<String, ContentItem> items = new LinkedHashMap<>();

    @Override
    public synchronized boolean insert(ContentItem item) {
        return items.putIfAbsent(item.url(), item) == null;
    }

    @Override
    public synchronized Optional<ContentItem> find(String url) {
        return Optional.ofNullable(items.get(url));
    }

    @Override
    public synchronized List<ContentItem> findByStatus(ProcessingStatus status) {
        return items.values().stream().filter(item -> item.status() == status).toList();
    }

    @Override
    public synchronized void update(ContentItem item) {
        ContentItem existing = items.get(item.url());
        if (existing == null) {
            throw new IllegalStateException("Unknown item " + item.url());
        }
        if (!existing.status().canAdvanceTo(item.status())) {
            throw new IllegalStateException("Item " + item.url() + " cannot move from "
                    + existing.status() + " to " + item.status());
        }
        items.put(item.url(), item);
    }

    public synchronized List<ContentItem> all() {
        return List.copyOf(items.values());
    }
}
