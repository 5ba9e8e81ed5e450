package io.hivememory.learning;

/**
 * Best known action for a state.
 *
 * @param action        recommended action
 * @param expectedValue its Q-value
 * @param visits        how often the pair was updated
 * @param alternatives  number of other actions known for the state
 */
public record StrategyRecommendation(String action, double expectedValue, long visits, int alternatives) {
}
