package com.forecastsync.service.store;

import com.forecastsync.core.events.Event;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Event> events = new ArrayList<>();
        for (Event event : readAll()) {
            if (event.timestamp().isBefore(since)) {
                continue;
            }
            if (type.isPresent() && !type.get().equals(event.type())) {
                continue;
            }
            events.add(event);
        }
        if (events.size() <= limit) {
            return events;
        }
        return List.copyOf(events.subList(events.size() - limit, events.size()));
    }

    @Override
    public int compact(int keepLast) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return 0;
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            if (lines.size() <= keepLast) {
                return 0;
            }
            List<String> kept = lines.subList(lines.size() - keepLast, lines.size());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, kept, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return lines.size() - keepLast;
        } catch (IOException e) {
            throw new IllegalStateException("Failed compacting event log " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private List<Event> readAll() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<Event> events = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(EventCodec.fromJsonLine(line));
                } catch (RuntimeException decodeError) {
                    LOGGER.warning("Skipping invalid event at " + file + ":" + lineNumber + ": " + decodeError.getMessage());
                }
            }
            return events;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
