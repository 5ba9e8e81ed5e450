package io.hivememory.learning;

/**
 * Persisted learning totals of one agent.
 */
public record LearningStatistics(
        String agentId,
        long totalExperiences,
        double averageReward,
        double maxReward,
        double minReward,
        long distinctActions,
        long qValueCount,
        long sessionExperiences
) {
}
