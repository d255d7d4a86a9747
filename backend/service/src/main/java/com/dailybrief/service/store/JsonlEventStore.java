package com.dailybrief.service.store;

import com.dailybrief.core.events.Event;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only run log for one profile, one JSON event per line. Queries stream
 * the file and keep only the newest matches, so a long-lived log is never
 * loaded whole.
 */
public class JsonlEventStore implements EventStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event) + System.lineSeparator();
        lock.lock();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event " + event.type() + " to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Deque<Event> newest = new ArrayDeque<>(Math.min(limit, 256));
        lock.lock();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event = decode(line, lineNumber);
                if (!matches(event, since, type)) {
                    continue;
                }
                if (newest.size() == limit) {
                    newest.removeFirst();
                }
                newest.addLast(event);
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading event log " + file, e);
        } finally {
            lock.unlock();
        }
        return List.copyOf(newest);
    }

    private Event decode(String line, int lineNumber) {
        try {
            return EventCodec.fromJsonLine(line);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file, e);
        }
    }

    private static boolean matches(Event event, Instant since, Optional<String> type) {
        return !event.timestamp().isBefore(since)
                && type.map(event.type()::equals).orElse(true);
    }
}
