package com.dailybrief.service.store;

import com.dailybrief.core.model.ContentItem;
import com.dailybrief.core.model.PipelineRun;
import com.dailybrief.core.model.ProcessingStatus;
import com.dailybrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps items, runs and deliveries in one JSON document that is rewritten on
 * every change. Items are kept in insertion order.
 */
public class JsonFileBriefStore implements ServiceItemStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ContentItem> items = new LinkedHashMap<>();
    private final Map<Long, PipelineRun> runs = new LinkedHashMap<>();
    private final Map<LocalDate, DeliveryRecord> deliveries = new LinkedHashMap<>();

    public JsonFileBriefStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public boolean insert(ContentItem item) {
        lock.lock();
        try {
            if (items.containsKey(item.url())) {
                return false;
            }
            items.put(item.url(), item);
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ContentItem> find(String url) {
        lock.lock();
        try {
            return Optional.ofNullable(items.get(url));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ContentItem> findByStatus(ProcessingStatus status) {
        lock.lock();
        try {
            return items.values().stream().filter(item -> item.status() == status).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void update(ContentItem item) {
        lock.lock();
        try {
            ContentItem existing = items.get(item.url());
            if (existing == null) {
                throw new IllegalStateException("Unknown item " + item.url());
            }
            if (!existing.status().canAdvanceTo(item.status())) {
                throw new IllegalStateException("Item " + item.url() + " cannot move from "
                        + existing.status() + " back to " + item.status());
            }
            items.put(item.url(), item);
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PipelineRun startRun(LocalDate runDate, Instant startedAt) {
        lock.lock();
        try {
            long id = runs.keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
            PipelineRun run = PipelineRun.started(id, runDate, startedAt);
            runs.put(id, run);
            persist();
            return run;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateRun(PipelineRun run) {
        lock.lock();
        try {
            if (!runs.containsKey(run.id())) {
                throw new IllegalStateException("Unknown run " + run.id());
            }
            runs.put(run.id(), run);
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PipelineRun> findRun(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(runs.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PipelineRun> runs() {
        lock.lock();
        try {
            return List.copyOf(runs.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean recordDelivery(LocalDate runDate, Path deliveredFile, Instant deliveredAt) {
        lock.lock();
        try {
            if (deliveries.containsKey(runDate)) {
                return false;
            }
            deliveries.put(runDate, new DeliveryRecord(runDate, deliveredFile.toString(), deliveredAt));
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDelivered(LocalDate runDate) {
        lock.lock();
        try {
            return deliveries.containsKey(runDate);
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                StoreFile loaded = MAPPER.readValue(in, StoreFile.class);
                if (loaded.items() != null) {
                    loaded.items().forEach(item -> items.put(item.url(), item));
                }
                if (loaded.runs() != null) {
                    loaded.runs().forEach(run -> runs.put(run.id(), run));
                }
                if (loaded.deliveries() != null) {
                    loaded.deliveries().forEach(delivery -> deliveries.put(delivery.runDate(), delivery));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading store from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                JsonUtils.prettyWriter().writeValue(out, new StoreFile(
                        new ArrayList<>(items.values()),
                        new ArrayList<>(runs.values()),
                        new ArrayList<>(deliveries.values())
                ));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing store to " + file, e);
        }
    }

    private record StoreFile(
            List<ContentItem> items,
            List<PipelineRun> runs,
            List<DeliveryRecord> deliveries
    ) {
    }
}
