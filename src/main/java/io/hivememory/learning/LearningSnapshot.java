package io.hivememory.learning;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Aggregate learning metrics persisted every {@code updateFrequency} experiences.
 */
public record LearningSnapshot(
        long id,
        String agentId,
        String snapshotType,
        JsonNode metrics,
        long totalExperiences,
        double explorationRate,
        long timestamp
) {
}
