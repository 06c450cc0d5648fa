package com.healthsentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsentinel.core.util.JsonUtils;
import com.healthsentinel.service.runtime.StateTracker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileStateStore implements StateStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileStateStore(Path file) {
        this.file = file;
    }

    @Override
    public Optional<StateTracker.Snapshot> load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try (InputStream in = Files.newInputStream(file)) {
                return Optional.of(MAPPER.readValue(in, StateTracker.Snapshot.class));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading state from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(StateTracker.Snapshot snapshot) {
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = parent.resolve(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing state to " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
