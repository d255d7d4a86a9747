package com.dailybrief.service.store;

import com.dailybrief.core.model.PipelineRun;
import com.dailybrief.curation.api.ItemStore;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Item store plus the run and delivery records only the service needs.
 */
public interface ServiceItemStore extends ItemStore {
    PipelineRun startRun(LocalDate runDate, Instant startedAt);

    void updateRun(PipelineRun run);

    Optional<PipelineRun> findRun(long id);

    List<PipelineRun> runs();

    /**
     * @return {@code false} when a digest was already delivered for {@code runDate}
     */
    boolean recordDelivery(LocalDate runDate, Path file, Instant deliveredAt);

    boolean isDelivered(LocalDate runDate);
}
