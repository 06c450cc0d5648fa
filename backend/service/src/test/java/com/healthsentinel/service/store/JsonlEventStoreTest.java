package com.healthsentinel.service.store;

import com.healthsentinel.core.events.AlertRaised;
import com.healthsentinel.core.events.Event;
import com.healthsentinel.core.events.ProbeSkipped;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlEventStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void appendedEventsSurviveReopening() throws Exception {
        Path file = Files.createTempDirectory("event-store-reopen-").resolve("logs/events.jsonl");
        new JsonlEventStore(file).append(alert("first", T0));

        List<Event> events = new JsonlEventStore(file).query(null, Optional.empty(), 10);

        assertEquals(List.of(alert("first", T0)), events);
    }

    @Test
    void queryFiltersBySinceAndTypeAndKeepsNewestInOrder() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-query-").resolve("events.jsonl"));
        for (int i = 0; i < 5; i++) {
            store.append(alert("alert-" + i, T0.plusSeconds(i)));
            store.append(new ProbeSkipped(T0.plusSeconds(i), "cache-a", "previous probe still outstanding"));
        }

        List<Event> recentAlerts = store.query(T0.plusSeconds(2), Optional.of("AlertRaised"), 2);

        assertEquals(List.of(alert("alert-3", T0.plusSeconds(3)), alert("alert-4", T0.plusSeconds(4))), recentAlerts);
        assertEquals(10, store.query(T0, Optional.empty(), 100).size());
        assertEquals(5, store.query(null, Optional.of("ProbeSkipped"), 100).size());
        assertTrue(store.query(T0, Optional.empty(), 0).isEmpty());
    }

    @Test
    void rotationKeepsBoundedBackupsAndQueriesAcrossThem() throws Exception {
        Path dir = Files.createTempDirectory("event-store-rotate-");
        Path file = dir.resolve("events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file, 300, 2);

        for (int i = 0; i < 40; i++) {
            store.append(alert("rotating-" + i, T0.plusSeconds(i)));
        }

        assertTrue(Files.exists(dir.resolve("events.jsonl.1")));
        assertTrue(Files.exists(dir.resolve("events.jsonl.2")));
        assertFalse(Files.exists(dir.resolve("events.jsonl.3")));
        List<Event> retained = store.query(null, Optional.empty(), 1000);
        assertTrue(retained.size() < 40);
        assertEquals(alert("rotating-39", T0.plusSeconds(39)), retained.get(retained.size() - 1));
        for (int i = 1; i < retained.size(); i++) {
            assertTrue(retained.get(i - 1).timestamp().isBefore(retained.get(i).timestamp()));
        }
    }

    @Test
    void corruptLineIsReportedWithItsPosition() throws Exception {
        Path file = Files.createTempDirectory("event-store-corrupt-").resolve("events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file);
        store.append(alert("ok", T0));
        Files.writeString(file, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> store.query(null, Optional.empty(), 10));

        assertTrue(error.getMessage().endsWith("at line 2"), error.getMessage());
    }

    @Test
    void concurrentAppendsAreAllRetained() throws Exception {
        int total = 300;
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-concurrent-").resolve("events.jsonl"));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[total];
            for (int i = 0; i < total; i++) {
                int idx = i;
                futures[i] = executor.submit(() -> store.append(alert("stress-" + idx, T0)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(total, store.query(T0, Optional.empty(), total).size());
    }

    private static AlertRaised alert(String message, Instant at) {
        return new AlertRaised(at, "scheduler", message, Map.of("service", "cache-a"));
    }
}
