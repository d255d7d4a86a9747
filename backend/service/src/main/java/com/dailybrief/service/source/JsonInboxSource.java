package com.dailybrief.service.source;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.util.JsonUtils;
import com.dailybrief.curation.api.ContentSource;
import com.dailybrief.curation.config.SourceConfig;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads already-fetched entries for a source from {@code <inboxDir>/<sourceId>.json},
 * a JSON array written by whatever fetches the feeds. Entries without a link are
 * skipped; a missing file means the source had nothing new.
 */
public class JsonInboxSource implements ContentSource {
    private static final Logger LOGGER = Logger.getLogger(JsonInboxSource.class.getName());

    private final Path inboxDir;

    public JsonInboxSource(Path inboxDir) {
        this.inboxDir = inboxDir;
    }

    @Override
    public List<ContentItem> fetch(SourceConfig source, Instant fetchedAt) {
        Path file = inboxDir.resolve(source.id() + ".json");
        if (!Files.exists(file)) {
            LOGGER.info("No inbox file for " + source.id() + " at " + file);
            return List.of();
        }

        List<InboxEntry> entries;
        try (InputStream in = Files.newInputStream(file)) {
            entries = JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading inbox " + file, e);
        }

        List<ContentItem> items = new ArrayList<>();
        for (InboxEntry entry : entries) {
            if (entry == null || entry.url() == null || entry.url().isBlank()) {
                continue;
            }
            items.add(ContentItem.fetched(
                    entry.url().trim(),
                    entry.title() == null || entry.title().isBlank() ? "(untitled)" : entry.title().trim(),
                    source.id(),
                    source.name(),
                    source.category(),
                    entry.published(),
                    fetchedAt,
                    entry.contentType() == null ? "article" : entry.contentType(),
                    entry.text()
            ));
        }
        return items;
    }

    record InboxEntry(String title, String url, String published, String contentType, String text) {
    }
}
