package io.hivememory.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-engine shared state: the database handle, the clock, payload serialization,
 * modification tracking and in-process counters. One instance per engine, handed to
 * every subsystem through its constructor.
 */
public class MemoryContext implements AutoCloseable {

    private final MemoryDatabase database;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final String nodeId;
    private final ModificationTracker modificationTracker = new ModificationTracker();
    private final Map<String, AtomicLong> sessionExperienceCounters = new ConcurrentHashMap<>();

    public MemoryContext(MemoryDatabase database, Clock clock, ObjectMapper objectMapper, String nodeId) {
        this.database = database;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.nodeId = nodeId;
    }

    /**
     * Opens a context over the database file at {@code dbPath}.
     */
    public static MemoryContext open(String dbPath, Clock clock, String nodeId) {
        var database = new MemoryDatabase(dbPath);
        database.open();
        return new MemoryContext(database, clock, new ObjectMapper(), nodeId);
    }

    public MemoryDatabase database() {
        return database;
    }

    public Clock clock() {
        return clock;
    }

    public long now() {
        return clock.millis();
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String nodeId() {
        return nodeId;
    }

    public ModificationTracker modificationTracker() {
        return modificationTracker;
    }

    /**
     * Counter of experiences recorded for {@code agentId} by this process. Starts at
     * zero on every restart.
     */
    public AtomicLong experienceCounter(String agentId) {
        return sessionExperienceCounters.computeIfAbsent(agentId, id -> new AtomicLong());
    }

    public void resetExperienceCounter(String agentId) {
        sessionExperienceCounters.remove(agentId);
    }

    /**
     * Converts a caller payload to a JSON tree; null becomes JSON null.
     */
    public JsonNode toTree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Value is not serializable: " + e.getMessage());
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Value is not serializable: " + e.getOriginalMessage());
        }
    }

    public JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt stored payload: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt stored payload: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() {
        database.close();
    }
}
