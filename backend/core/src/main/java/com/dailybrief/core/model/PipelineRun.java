package com.dailybrief.core.model;

import java.time.Instant;
import java.time.LocalDate;

public record PipelineRun(
        long id,
        LocalDate runDate,
        Instant startedAt,
        Instant completedAt,
        RunStatus status,
        int itemsIngested,
        int itemsEnriched,
        int itemsSelected,
        String errorMessage
) {
    public static PipelineRun started(long id, LocalDate runDate, Instant startedAt) {
        return new PipelineRun(id, runDate, startedAt, null, RunStatus.RUNNING, 0, 0, 0, null);
    }

    public PipelineRun withCounts(int ingested, int enriched, int selected) {
        return new PipelineRun(id, runDate, startedAt, completedAt, status, ingested, enriched, selected, errorMessage);
    }

    public PipelineRun completed(Instant at) {
        return finish(at, RunStatus.COMPLETED, null);
    }

    public PipelineRun failed(Instant at, String message) {
        return finish(at, RunStatus.FAILED, message);
    }

    private PipelineRun finish(Instant at, RunStatus terminal, String message) {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + id + " already finished as " + status);
        }
        return new PipelineRun(id, runDate, startedAt, at, terminal, itemsIngested, itemsEnriched, itemsSelected, message);
    }
}
