package io.hivememory.learning;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent Q-learning state per agent: experiences, Q-values and periodic snapshots.
 */
public interface LearningStore {

    /**
     * Records an experience and applies the temporal-difference update
     * {@code Q(s,a) += alpha * (r + gamma * max Q(s',a') - Q(s,a))} atomically.
     * Never throws.
     *
     * @return the updated Q-value, empty if the experience could not be recorded
     */
    Optional<QValue> recordExperience(String agentId, Map<String, Object> state, String action, double reward,
                                      Map<String, Object> nextState);

    Optional<StrategyRecommendation> recommendStrategy(String agentId, Map<String, Object> state);

    /**
     * Epsilon-greedy choice among {@code actions}.
     */
    String selectAction(String agentId, Map<String, Object> state, List<String> actions);

    Optional<QValue> getQValue(String agentId, Map<String, Object> state, String action);

    List<LearningExperience> getExperiences(String agentId, int limit);

    List<LearningSnapshot> getLearningHistory(String agentId, int limit);

    LearningStatistics getStatistics(String agentId);

    /**
     * Experiences recorded for {@code agentId} by this process since start-up or reset.
     */
    long getTotalExperiences(String agentId);

    /**
     * Experiences persisted for {@code agentId}, across restarts.
     */
    long countExperiences(String agentId);

    /**
     * Loads the agent's persisted Q-table into the in-memory policy.
     *
     * @return number of Q-values restored
     */
    int restore(String agentId);

    /**
     * Deletes every experience, Q-value and snapshot of the agent.
     */
    void resetAgent(String agentId);
}
