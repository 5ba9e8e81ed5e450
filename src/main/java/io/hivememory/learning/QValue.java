package io.hivememory.learning;

/**
 * Learned value of taking {@code actionKey} in {@code stateKey}.
 *
 * @param updateCount number of updates applied to this pair
 */
public record QValue(
        String agentId,
        String stateKey,
        String actionKey,
        double value,
        long updateCount,
        long lastUpdated
) {
}
