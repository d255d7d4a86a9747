package com.dailybrief.service.runtime;

import com.dailybrief.core.events.DigestDelivered;
import com.dailybrief.core.events.RunCompleted;
import com.dailybrief.core.events.RunStarted;
import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.PipelineRun;
import com.dailybrief.core.model.ProcessingStatus;
import com.dailybrief.core.model.RunStatus;
import com.dailybrief.curation.api.CurationContext;
import com.dailybrief.curation.api.StageResult;
import com.dailybrief.curation.config.SourceConfig;
import com.dailybrief.curation.enrich.EnrichmentStage;
import com.dailybrief.curation.ingest.IngestionStage;
import com.dailybrief.curation.ranking.RankingOutcome;
import com.dailybrief.curation.ranking.RankingStage;
import com.dailybrief.service.delivery.DigestWriter;
import com.dailybrief.service.store.ServiceItemStore;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One end-to-end run for a date: ingest, enrich, rank, deliver. Selected items
 * are marked published once the digest is written. Any failure marks the run
 * failed and leaves an error document in place of the digest.
 */
public class DigestPipeline {
    private static final Logger LOGGER = Logger.getLogger(DigestPipeline.class.getName());

    private final String profile;
    private final CurationContext ctx;
    private final ServiceItemStore store;
    private final List<SourceConfig> sources;
    private final IngestionStage ingestion;
    private final EnrichmentStage enrichment;
    private final RankingStage ranking;
    private final DigestWriter writer;

    public DigestPipeline(
            String profile,
            CurationContext ctx,
            ServiceItemStore store,
            List<SourceConfig> sources,
            IngestionStage ingestion,
            EnrichmentStage enrichment,
            RankingStage ranking,
            DigestWriter writer
    ) {
        if (ctx.itemStore() != store) {
            throw new IllegalArgumentException("context must use the pipeline's store");
        }
        this.profile = profile;
        this.ctx = ctx;
        this.store = store;
        this.sources = List.copyOf(sources);
        this.ingestion = ingestion;
        this.enrichment = enrichment;
        this.ranking = ranking;
        this.writer = writer;
    }

    public PipelineRun run(LocalDate runDate) {
        Instant startedAt = ctx.clock().instant();
        PipelineRun run = store.startRun(runDate, startedAt);
        ctx.eventBus().publish(new RunStarted(startedAt, run.id(), runDate, profile));
        LOGGER.info("=== " + profile + " pipeline starting for " + runDate + " ===");

        try {
            long enabled = sources.stream().filter(SourceConfig::enabled).count();
            LOGGER.info("Sources: " + sources.size() + " total, " + enabled + " enabled");
            if (enabled == 0) {
                LOGGER.warning("No sources enabled; nothing to ingest");
                return finish(run.completed(ctx.clock().instant()), startedAt);
            }

            LOGGER.info("--- Step 1: Ingestion ---");
            StageResult ingested = ingestion.ingest(sources);
            run = progress(run.withCounts(ingested.intStat("newItems"), 0, 0));

            LOGGER.info("--- Step 2: Enrichment ---");
            StageResult enriched = enrichment.enrichPending();
            run = progress(run.withCounts(run.itemsIngested(), enriched.intStat("enriched"), 0));

            LOGGER.info("--- Step 3: Ranking and selection ---");
            RankingOutcome outcome = ranking.rank(runDate);
            run = progress(run.withCounts(run.itemsIngested(), run.itemsEnriched(), outcome.selectedCount()));

            LOGGER.info("--- Step 4: Delivery ---");
            deliver(runDate, outcome);

            run = finish(run.completed(ctx.clock().instant()), startedAt);
            LOGGER.info("=== " + profile + " pipeline completed ===");
            return run;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Pipeline failed", e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            writeErrorDocument(runDate, message, e);
            return finish(run.failed(ctx.clock().instant(), message), startedAt);
        }
    }

    private void deliver(LocalDate runDate, RankingOutcome outcome) {
        if (store.isDelivered(runDate)) {
            LOGGER.info("Digest already delivered for " + runDate + ", skipping");
            return;
        }
        Path file = writer.write(outcome.clusters(), runDate);
        store.recordDelivery(runDate, file, ctx.clock().instant());
        for (ContentItem item : outcome.selectedItems()) {
            store.update(item.withStatus(ProcessingStatus.PUBLISHED));
        }
        ctx.eventBus().publish(new DigestDelivered(
                ctx.clock().instant(), runDate, file.toString(), outcome.clusters().size(), outcome.selectedCount()));
    }

    private void writeErrorDocument(LocalDate runDate, String message, RuntimeException cause) {
        try {
            writer.writeError(runDate, message);
        } catch (RuntimeException writeFailure) {
            cause.addSuppressed(writeFailure);
            LOGGER.log(Level.SEVERE, "Could not write error digest for " + runDate, writeFailure);
        }
    }

    private PipelineRun progress(PipelineRun run) {
        store.updateRun(run);
        return run;
    }

    private PipelineRun finish(PipelineRun run, Instant startedAt) {
        store.updateRun(run);
        ctx.eventBus().publish(new RunCompleted(
                ctx.clock().instant(),
                run.id(),
                run.status() == RunStatus.COMPLETED,
                run.itemsIngested(),
                run.itemsEnriched(),
                run.itemsSelected(),
                Duration.between(startedAt, ctx.clock().instant()).toMillis()
        ));
        return run;
    }
}
