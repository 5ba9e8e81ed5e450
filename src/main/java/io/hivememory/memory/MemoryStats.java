package io.hivememory.memory;

import java.util.List;
import java.util.Map;

/**
 * Row counts across the engine's tables.
 */
public record MemoryStats(
        long totalEntries,
        long totalHints,
        long totalEvents,
        long totalCheckpoints,
        long totalPatterns,
        long totalExperiences,
        long totalQValues,
        long totalSnapshots,
        List<String> partitions,
        Map<String, Long> accessLevels
) {
}
