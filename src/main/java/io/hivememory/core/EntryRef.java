package io.hivememory.core;

/**
 * Identity of a memory entry: the (partition, key) pair.
 */
public record EntryRef(String partition, String key) {

    public String resourceId() {
        return partition + ":" + key;
    }

    @Override
    public String toString() {
        return resourceId();
    }
}
