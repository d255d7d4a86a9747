package com.dailybrief.curation.ingest;

import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.events.ContentFlagged;
import com.dailybrief.core.events.SourceIngested;
import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.util.PublishedDates;
import com.dailybrief.curation.api.ContentSource;
import com.dailybrief.curation.api.CurationContext;
import com.dailybrief.curation.api.StageResult;
import com.dailybrief.curation.config.SourceConfig;
import com.dailybrief.curation.security.ContentSanitizer;
import com.dailybrief.curation.security.SanitizedText;
import com.dailybrief.curation.security.UrlVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls every enabled source through the fetch layer and stores what is new.
 * Links that do not belong to their source, items older than the age limit and
 * URLs already stored are skipped; text is sanitized before it is stored. A
 * failing source raises an alert and does not stop the others.
 */
public class IngestionStage {
    private static final Logger LOGGER = Logger.getLogger(IngestionStage.class.getName());

    private final CurationContext ctx;
    private final ContentSource contentSource;
    private final ContentSanitizer sanitizer;
    private final UrlVerifier urlVerifier;
    private final Duration maxAge;

    public IngestionStage(
            CurationContext ctx,
            ContentSource contentSource,
            ContentSanitizer sanitizer,
            UrlVerifier urlVerifier,
            int maxAgeDays
    ) {
        this.ctx = ctx;
        this.contentSource = contentSource;
        this.sanitizer = sanitizer;
        this.urlVerifier = urlVerifier;
        this.maxAge = Duration.ofDays(maxAgeDays);
    }

    public StageResult ingest(List<SourceConfig> sources) {
        List<String> polled = new ArrayList<>();
        int newItems = 0;
        int failures = 0;
        for (SourceConfig source : sources) {
            if (!source.enabled()) {
                continue;
            }
            polled.add(source.id());
            Optional<Integer> added = ingestSource(source);
            if (added.isPresent()) {
                newItems += added.get();
            } else {
                failures++;
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", polled);
        stats.put("failures", failures);
        stats.put("newItems", newItems);
        if (failures == 0) {
            return StageResult.success("Ingestion completed", stats);
        }
        return StageResult.failure("Ingestion had failures", stats);
    }

    private Optional<Integer> ingestSource(SourceConfig source) {
        Instant startedAt = ctx.clock().instant();
        List<ContentItem> fetched;
        try {
            fetched = contentSource.fetch(source, startedAt);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to ingest " + source.id(), e);
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "ingestion",
                    "Fetch failed for " + source.id() + ": " + rootMessage(e),
                    Map.of("source", source.id())
            ));
            return Optional.empty();
        }

        Instant cutoff = startedAt.minus(maxAge);
        int newCount = 0;
        for (ContentItem item : fetched) {
            if (!urlVerifier.verify(item.url(), source.id())) {
                continue;
            }
            Optional<Instant> published = PublishedDates.parse(item.publishedDate());
            if (published.isPresent() && published.get().isBefore(cutoff)) {
                continue;
            }
            SanitizedText sanitized = sanitizer.sanitize(item.rawText(), source.id());
            if (sanitized.flagged()) {
                ctx.eventBus().publish(new ContentFlagged(
                        ctx.clock().instant(), source.id(), item.url(), sanitized.flags().size()));
            }
            if (ctx.itemStore().insert(item.withRawText(sanitized.text()).withFetchedAt(startedAt))) {
                newCount++;
            }
        }

        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new SourceIngested(
                ctx.clock().instant(), source.id(), fetched.size(), newCount, durationMillis));
        LOGGER.info("Ingested " + newCount + " new items from " + source.id() + " (" + durationMillis + "ms)");
        return Optional.of(newCount);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
