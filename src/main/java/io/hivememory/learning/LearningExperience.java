package io.hivememory.learning;

import java.util.Map;

/**
 * One observed transition. Immutable once recorded.
 */
public record LearningExperience(
        long id,
        String agentId,
        Map<String, Object> state,
        String action,
        double reward,
        Map<String, Object> nextState,
        long timestamp
) {
}
