package com.stellarcast.gateway.cron;

import com.fasterxml.jackson.databind.JsonNode;
import com.stellarcast.channel.Destination;
import com.stellarcast.channel.DestinationDecodeException;
import com.stellarcast.channel.TargetCodec;
import com.stellarcast.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable table of scheduled deliveries, at most one entry per destination.
 * <p>
 * File format: {@code {"tasks": [{"send_time": "HH:MM", "target": {...}}]}},
 * rewritten in full on every mutation. Every load-modify-save runs under one
 * lock; the {@code *Locked} variants let callers compose several steps with
 * {@link #withLock(Supplier)}.
 */
@Slf4j
public class ScheduleStore {

    static final String TASKS = "tasks";
    static final String SEND_TIME = "send_time";
    static final String TARGET = "target";

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public ScheduleStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    // --- Locking wrappers ---

    public List<ScheduleEntry> load() {
        lock.lock();
        try {
            return loadLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace the entry for {@code entry.destination()}.
     */
    public void upsert(ScheduleEntry entry) {
        lock.lock();
        try {
            upsertLocked(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if no entry existed for the destination
     */
    public boolean remove(Destination destination) {
        lock.lock();
        try {
            return removeLocked(destination);
        } finally {
            lock.unlock();
        }
    }

    public void replaceAll(List<ScheduleEntry> entries) {
        lock.lock();
        try {
            replaceAllLocked(entries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} while holding the store lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // --- Locked variants ---

    public List<ScheduleEntry> loadLocked() {
        requireLock();
        JsonNode root;
        try {
            root = JsonFile.readTree(file);
        } catch (IOException e) {
            log.error("cron: schedule file {} is unreadable, treating as empty: {}", file, e.getMessage());
            return new ArrayList<>();
        }
        if (root == null) {
            return new ArrayList<>();
        }
        JsonNode tasks = root.path(TASKS);
        if (!tasks.isArray()) {
            log.error("cron: schedule file {} has no '{}' list, treating as empty", file, TASKS);
            return new ArrayList<>();
        }
        List<ScheduleEntry> entries = new ArrayList<>();
        for (JsonNode task : tasks) {
            try {
                Destination destination = TargetCodec.fromTree(task.path(TARGET));
                String sendTime = task.path(SEND_TIME).isTextual() ? task.path(SEND_TIME).asText() : null;
                entries.add(new ScheduleEntry(destination, sendTime));
            } catch (DestinationDecodeException e) {
                log.warn("cron: skipping schedule entry with undecodable target: {}", e.getMessage());
            }
        }
        return entries;
    }

    public void upsertLocked(ScheduleEntry entry) {
        requireLock();
        List<ScheduleEntry> entries = loadLocked();
        entries.removeIf(e -> e.destination().equals(entry.destination()));
        entries.add(entry);
        save(entries);
        log.debug("cron: stored schedule {} at {}", entry.destination().label(), entry.sendTime());
    }

    public boolean removeLocked(Destination destination) {
        requireLock();
        List<ScheduleEntry> entries = loadLocked();
        if (!entries.removeIf(e -> e.destination().equals(destination))) {
            return false;
        }
        save(entries);
        log.debug("cron: removed schedule {}", destination.label());
        return true;
    }

    public void replaceAllLocked(List<ScheduleEntry> entries) {
        requireLock();
        save(entries);
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("schedule store lock is not held by the current thread");
        }
    }

    private void save(List<ScheduleEntry> entries) {
        List<Map<String, Object>> tasks = new ArrayList<>();
        for (ScheduleEntry entry : entries) {
            Map<String, Object> task = new LinkedHashMap<>();
            task.put(SEND_TIME, entry.sendTime());
            task.put(TARGET, TargetCodec.toTree(entry.destination()));
            tasks.add(task);
        }
        try {
            JsonFile.writeAtomically(file, Map.of(TASKS, tasks));
        } catch (IOException e) {
            throw new ScheduleStoreException("failed to write schedule file " + file, e);
        }
    }
}
