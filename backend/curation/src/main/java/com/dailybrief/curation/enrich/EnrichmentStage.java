package com.dailybrief.curation.enrich;

import com.dailybrief.core.events.AlertRaised;
import com.dailybrief.core.events.ContentFlagged;
import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.ProcessingStatus;
import com.dailybrief.curation.api.Annotator;
import com.dailybrief.curation.api.CurationContext;
import com.dailybrief.curation.api.StageResult;
import com.dailybrief.curation.security.ContentSanitizer;
import com.dailybrief.curation.security.EnrichmentValidator;
import com.dailybrief.curation.security.SanitizedText;
import com.dailybrief.curation.security.ValidationResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Annotates pending items. Text is sanitized before it reaches the annotator and
 * the annotation is validated before it is stored. An item whose annotation
 * fails stays pending; the rest of the batch continues.
 */
public class EnrichmentStage {
    private static final Logger LOGGER = Logger.getLogger(EnrichmentStage.class.getName());

    private final CurationContext ctx;
    private final Annotator annotator;
    private final ContentSanitizer sanitizer;
    private final EnrichmentValidator validator;

    public EnrichmentStage(
            CurationContext ctx,
            Annotator annotator,
            ContentSanitizer sanitizer,
            EnrichmentValidator validator
    ) {
        this.ctx = ctx;
        this.annotator = annotator;
        this.sanitizer = sanitizer;
        this.validator = validator;
    }

    public StageResult enrichPending() {
        List<ContentItem> pending = ctx.itemStore().findByStatus(ProcessingStatus.PENDING_ENRICHMENT);
        if (pending.isEmpty()) {
            LOGGER.info("No items pending enrichment");
        }

        int enriched = 0;
        int failed = 0;
        int repaired = 0;
        for (ContentItem item : pending) {
            try {
                Optional<ValidationResult> result = enrich(item);
                if (result.isEmpty()) {
                    failed++;
                    continue;
                }
                if (!result.get().valid()) {
                    repaired++;
                }
                enriched++;
            } catch (RuntimeException e) {
                failed++;
                LOGGER.log(Level.WARNING, "Failed to enrich " + item.url(), e);
                alert("Annotation failed for " + item.url(), item);
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("pending", pending.size());
        stats.put("enriched", enriched);
        stats.put("repaired", repaired);
        stats.put("failed", failed);
        if (failed == 0) {
            return StageResult.success("Enrichment completed", stats);
        }
        return StageResult.failure("Enrichment had failures", stats);
    }

    private Optional<ValidationResult> enrich(ContentItem item) {
        SanitizedText sanitized = sanitizer.sanitize(item.rawText(), item.sourceId());
        if (sanitized.flagged()) {
            ctx.eventBus().publish(new ContentFlagged(
                    ctx.clock().instant(), item.sourceId(), item.url(), sanitized.flags().size()));
        }

        Optional<Map<String, Object>> raw = annotator.annotate(item, sanitized.text() == null ? "" : sanitized.text());
        if (raw.isEmpty()) {
            LOGGER.warning("No usable annotation for " + item.url());
            alert("No usable annotation for " + item.url(), item);
            return Optional.empty();
        }

        ValidationResult result = validator.validate(raw.get());
        if (!result.valid()) {
            LOGGER.warning("Enrichment validation issues for " + item.url() + ": " + result.errors());
        }
        ctx.itemStore().update(item.withEnrichment(result.cleaned()));
        return Optional.of(result);
    }

    private void alert(String message, ContentItem item) {
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "enrichment",
                message,
                Map.of("source", item.sourceId(), "url", item.url())
        ));
    }
}
