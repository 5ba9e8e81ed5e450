package io.hivememory.maintenance;

/**
 * Rows removed by one TTL sweep. ACL rows follow their entries and are not part of the total.
 */
public record SweepResult(int entriesRemoved, int hintsRemoved, int eventsRemoved, int proposalsRemoved,
                          int aclsRemoved, long durationMs) {

    public int total() {
        return entriesRemoved + hintsRemoved + eventsRemoved + proposalsRemoved;
    }
}
