package com.healthsentinel.service.store;

import com.healthsentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only event log, one {@link EventCodec} line per event.
 * <p>
 * When the active file grows past {@code maxBytes} it is renamed to {@code <file>.1}, older backups shift
 * up by one and the oldest beyond {@code backups} is deleted. Queries scan the backups oldest first, then
 * the active file, and return the newest {@code limit} matches in chronological order.
 */
public class JsonlEventStore implements EventStore {
    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_BACKUPS = 3;

    private final Path file;
    private final long maxBytes;
    private final int backups;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_MAX_BYTES, DEFAULT_BACKUPS);
    }

    public JsonlEventStore(Path file, long maxBytes, int backups) {
        this.file = file;
        this.maxBytes = maxBytes;
        this.backups = Math.max(0, backups);
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            if (maxBytes > 0 && Files.exists(file) && Files.size(file) >= maxBytes) {
                rotate();
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
        lock.lock();
        try {
            Deque<Event> newest = new ArrayDeque<>();
            for (int generation = backups; generation >= 0; generation--) {
                Path source = generation(generation);
                if (Files.exists(source)) {
                    scan(source, since, type, limit, newest);
                }
            }
            return new ArrayList<>(newest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void scan(Path source, Instant since, Optional<String> type, int limit, Deque<Event> newest) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid JSONL event in " + source + " at line " + lineNumber, decodeError);
                }
                if (since != null && event.timestamp().isBefore(since)) {
                    continue;
                }
                if (type.isPresent() && !type.get().equals(event.type())) {
                    continue;
                }
                newest.addLast(event);
                if (newest.size() > limit) {
                    newest.removeFirst();
                }
            }
        }
    }

    private void rotate() throws IOException {
        if (backups == 0) {
            Files.delete(file);
            return;
        }
        Files.deleteIfExists(generation(backups));
        for (int generation = backups - 1; generation >= 1; generation--) {
            Path source = generation(generation);
            if (Files.exists(source)) {
                Files.move(source, generation(generation + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.move(file, generation(1), StandardCopyOption.REPLACE_EXISTING);
    }

    private Path generation(int generation) {
        return generation == 0 ? file : file.resolveSibling(file.getFileName() + "." + generation);
    }
}
