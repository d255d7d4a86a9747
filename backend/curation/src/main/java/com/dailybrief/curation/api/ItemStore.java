package com.dailybrief.curation.api;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.ProcessingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of content items, keyed by URL.
 */
public interface ItemStore {
    /**
     * Stores a newly fetched item.
     *
     * @return {@code false} when an item with the same URL is already stored
     */
    boolean insert(ContentItem item);

    Optional<ContentItem> find(String url);

    /**
     * Items in {@code status}, in insertion order.
     */
    List<ContentItem> findByStatus(ProcessingStatus status);

    /**
     * Replaces the stored record with the same URL.
     *
     * @throws IllegalStateException when the item is unknown or its status would move backwards
     */
    void update(ContentItem item);
}
