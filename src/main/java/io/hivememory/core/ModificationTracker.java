package io.hivememory.core;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records the last local modification time of each entry. The sync transport
 * reads it to decide what goes into the next outbound delta.
 */
public class ModificationTracker {

    private final Map<EntryRef, Long> lastModified = new ConcurrentHashMap<>();

    public void record(String partition, String key, long timestamp) {
        lastModified.merge(new EntryRef(partition, key), timestamp, Math::max);
    }

    public Long get(String partition, String key) {
        return lastModified.get(new EntryRef(partition, key));
    }

    public void forget(String partition, String key) {
        lastModified.remove(new EntryRef(partition, key));
    }

    /**
     * Entries modified in {@code [from, until)}.
     */
    public Map<EntryRef, Long> modifiedBetween(long from, long until) {
        Map<EntryRef, Long> result = new HashMap<>();
        lastModified.forEach((ref, ts) -> {
            if (ts >= from && ts < until) {
                result.put(ref, ts);
            }
        });
        return result;
    }

    public int size() {
        return lastModified.size();
    }
}
