package io.hivememory.learning;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hivememory.config.MemoryProperties;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.StorageException;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Q-learning state in SQLite.
 *
 * <p>{@link #recordExperience} runs as a single write transaction: the experience insert,
 * the max over the next state's Q-values and the Q-value upsert either all commit or
 * none do. The in-memory policy table mirrors {@code q_values}, is loaded lazily per
 * agent and is only changed while the database lock is held.</p>
 */
@Component
public class SQLiteLearningStore implements LearningStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteLearningStore.class);
    private static final TypeReference<Map<String, Object>> FEATURES_TYPE = new TypeReference<>() {
    };
    static final String PERIODIC_SNAPSHOT = "periodic";

    private final MemoryContext context;
    private final MemoryProperties.Learning config;
    private final Random random;
    private final Map<String, Map<String, Map<String, QValue>>> policies = new ConcurrentHashMap<>();

    @Autowired
    public SQLiteLearningStore(MemoryContext context, MemoryProperties properties) {
        this(context, properties, new Random());
    }

    SQLiteLearningStore(MemoryContext context, MemoryProperties properties, Random random) {
        this.context = context;
        this.config = properties.learning();
        this.random = random;
    }

    @Override
    public Optional<QValue> recordExperience(String agentId, Map<String, Object> state, String action,
                                             double reward, Map<String, Object> nextState) {
        try {
            if (agentId == null || agentId.isBlank() || action == null || action.isBlank()) {
                throw new ValidationException("agentId and action are required");
            }
            if (Double.isNaN(reward) || Double.isInfinite(reward)) {
                throw new ValidationException("reward must be finite");
            }
            ensureTables();
            String stateKey = StateDiscretizer.stateKey(state);
            String nextStateKey = StateDiscretizer.stateKey(nextState);
            String stateJson = context.toJson(state == null ? Map.of() : state);
            String nextStateJson = context.toJson(nextState == null ? Map.of() : nextState);

            QValue updated = context.database().write(conn -> {
                long now = context.now();
                try (var stmt = conn.prepareStatement("""
                        INSERT INTO learning_experiences (agent_id, state, action, reward, next_state, timestamp)
                        VALUES (?, ?, ?, ?, ?, ?)
                        """)) {
                    stmt.setString(1, agentId);
                    stmt.setString(2, stateJson);
                    stmt.setString(3, action);
                    stmt.setDouble(4, reward);
                    stmt.setString(5, nextStateJson);
                    stmt.setLong(6, now);
                    stmt.executeUpdate();
                }

                double maxNext = maxQ(conn, agentId, nextStateKey);
                Optional<QValue> current = selectQValue(conn, agentId, stateKey, action);
                double oldValue = current.map(QValue::value).orElse(0.0);
                long updateNumber = current.map(QValue::updateCount).orElse(0L) + 1;
                double alpha = config.rateSchedule().alpha(config.learningRate(), updateNumber);
                double newValue = oldValue + alpha * (reward + config.discountFactor() * maxNext - oldValue);

                try (var stmt = conn.prepareStatement("""
                        INSERT INTO q_values (agent_id, state_key, action_key, q_value, update_count, last_updated)
                        VALUES (?, ?, ?, ?, 1, ?)
                        ON CONFLICT(agent_id, state_key, action_key) DO UPDATE SET
                            q_value = excluded.q_value,
                            update_count = update_count + 1,
                            last_updated = excluded.last_updated
                        """)) {
                    stmt.setString(1, agentId);
                    stmt.setString(2, stateKey);
                    stmt.setString(3, action);
                    stmt.setDouble(4, newValue);
                    stmt.setLong(5, now);
                    stmt.executeUpdate();
                }
                var qValue = new QValue(agentId, stateKey, action, newValue, updateNumber, now);
                policyFor(agentId).computeIfAbsent(stateKey, k -> new ConcurrentHashMap<>()).put(action, qValue);
                return qValue;
            });

            long sessionCount = context.experienceCounter(agentId).incrementAndGet();
            if (sessionCount % config.updateFrequency() == 0) {
                try {
                    persistSnapshot(agentId);
                } catch (RuntimeException e) {
                    log.warn("Learning snapshot for agent {} failed: {}", agentId, e.getMessage());
                }
            }
            log.debug("Experience for {}: Q({}, {}) = {}", agentId, stateKey, action, updated.value());
            return Optional.of(updated);
        } catch (RuntimeException e) {
            log.error("Failed to record experience for agent {}", agentId, e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<StrategyRecommendation> recommendStrategy(String agentId, Map<String, Object> state) {
        Map<String, QValue> actions = policyFor(agentId).get(StateDiscretizer.stateKey(state));
        if (actions == null || actions.isEmpty()) {
            return Optional.empty();
        }
        QValue best = null;
        for (QValue candidate : actions.values()) {
            if (best == null || candidate.value() > best.value()
                    || (candidate.value() == best.value() && candidate.actionKey().compareTo(best.actionKey()) < 0)) {
                best = candidate;
            }
        }
        return Optional.of(new StrategyRecommendation(best.actionKey(), best.value(), best.updateCount(),
                actions.size() - 1));
    }

    @Override
    public String selectAction(String agentId, Map<String, Object> state, List<String> actions) {
        if (actions == null || actions.isEmpty()) {
            throw new ValidationException("at least one action is required");
        }
        if (random.nextDouble() < config.explorationRate()) {
            return actions.get(random.nextInt(actions.size()));
        }
        Map<String, QValue> known = policyFor(agentId).getOrDefault(StateDiscretizer.stateKey(state), Map.of());
        String best = actions.get(0);
        double bestValue = valueOf(known, best);
        for (String action : actions) {
            double value = valueOf(known, action);
            if (value > bestValue) {
                best = action;
                bestValue = value;
            }
        }
        return best;
    }

    @Override
    public Optional<QValue> getQValue(String agentId, Map<String, Object> state, String action) {
        ensureTables();
        String stateKey = StateDiscretizer.stateKey(state);
        return context.database().read(conn -> selectQValue(conn, agentId, stateKey, action));
    }

    @Override
    public List<LearningExperience> getExperiences(String agentId, int limit) {
        ensureTables();
        return context.database().read(conn -> {
            List<LearningExperience> experiences = new ArrayList<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT id, agent_id, state, action, reward, next_state, timestamp
                    FROM learning_experiences WHERE agent_id = ? ORDER BY id DESC LIMIT ?
                    """)) {
                stmt.setString(1, agentId);
                stmt.setInt(2, limit);
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        experiences.add(new LearningExperience(
                                rs.getLong("id"),
                                rs.getString("agent_id"),
                                readFeatures(rs.getString("state")),
                                rs.getString("action"),
                                rs.getDouble("reward"),
                                readFeatures(rs.getString("next_state")),
                                rs.getLong("timestamp")));
                    }
                }
            }
            return experiences;
        });
    }

    @Override
    public List<LearningSnapshot> getLearningHistory(String agentId, int limit) {
        ensureTables();
        return context.database().read(conn -> {
            List<LearningSnapshot> snapshots = new ArrayList<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT id, agent_id, snapshot_type, metrics, total_experiences, exploration_rate, timestamp
                    FROM learning_history WHERE agent_id = ? ORDER BY id DESC LIMIT ?
                    """)) {
                stmt.setString(1, agentId);
                stmt.setInt(2, limit);
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        snapshots.add(new LearningSnapshot(
                                rs.getLong("id"),
                                rs.getString("agent_id"),
                                rs.getString("snapshot_type"),
                                context.readJson(rs.getString("metrics")),
                                rs.getLong("total_experiences"),
                                rs.getDouble("exploration_rate"),
                                rs.getLong("timestamp")));
                    }
                }
            }
            return snapshots;
        });
    }

    @Override
    public LearningStatistics getStatistics(String agentId) {
        ensureTables();
        return context.database().read(conn -> {
            long total = 0;
            double avg = 0;
            double max = 0;
            double min = 0;
            long distinctActions = 0;
            try (var stmt = conn.prepareStatement("""
                    SELECT COUNT(*), AVG(reward), MAX(reward), MIN(reward), COUNT(DISTINCT action)
                    FROM learning_experiences WHERE agent_id = ?
                    """)) {
                stmt.setString(1, agentId);
                try (var rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        total = rs.getLong(1);
                        avg = rs.getDouble(2);
                        max = rs.getDouble(3);
                        min = rs.getDouble(4);
                        distinctActions = rs.getLong(5);
                    }
                }
            }
            long qValues;
            try (var stmt = conn.prepareStatement("SELECT COUNT(*) FROM q_values WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                try (var rs = stmt.executeQuery()) {
                    qValues = rs.next() ? rs.getLong(1) : 0;
                }
            }
            return new LearningStatistics(agentId, total, avg, max, min, distinctActions, qValues,
                    getTotalExperiences(agentId));
        });
    }

    @Override
    public long getTotalExperiences(String agentId) {
        return context.experienceCounter(agentId).get();
    }

    @Override
    public long countExperiences(String agentId) {
        ensureTables();
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT COUNT(*) FROM learning_experiences WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                try (var rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    @Override
    public int restore(String agentId) {
        ensureTables();
        int count = context.database().read(conn -> {
            Map<String, Map<String, QValue>> table = new ConcurrentHashMap<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT agent_id, state_key, action_key, q_value, update_count, last_updated
                    FROM q_values WHERE agent_id = ?
                    """)) {
                stmt.setString(1, agentId);
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        var q = new QValue(rs.getString(1), rs.getString(2), rs.getString(3),
                                rs.getDouble(4), rs.getLong(5), rs.getLong(6));
                        table.computeIfAbsent(q.stateKey(), k -> new ConcurrentHashMap<>()).put(q.actionKey(), q);
                    }
                }
            }
            policies.put(agentId, table);
            return table.values().stream().mapToInt(Map::size).sum();
        });
        log.info("Restored {} Q-values for agent {}", count, agentId);
        return count;
    }

    @Override
    public void resetAgent(String agentId) {
        ensureTables();
        int removed = context.database().write(conn -> {
            int rows = 0;
            for (String table : List.of("learning_experiences", "q_values", "learning_history")) {
                try (var stmt = conn.prepareStatement("DELETE FROM " + table + " WHERE agent_id = ?")) {
                    stmt.setString(1, agentId);
                    rows += stmt.executeUpdate();
                }
            }
            policies.remove(agentId);
            return rows;
        });
        context.resetExperienceCounter(agentId);
        log.info("Reset learning state of agent {} ({} rows removed)", agentId, removed);
    }

    private void persistSnapshot(String agentId) {
        int window = config.updateFrequency();
        context.database().write(conn -> {
            long total;
            double avgReward;
            try (var stmt = conn.prepareStatement(
                    "SELECT COUNT(*), AVG(reward) FROM learning_experiences WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                try (var rs = stmt.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                    avgReward = rs.getDouble(2);
                }
            }
            double recentReward;
            try (var stmt = conn.prepareStatement("""
                    SELECT AVG(reward) FROM (
                        SELECT reward FROM learning_experiences WHERE agent_id = ? ORDER BY id DESC LIMIT ?)
                    """)) {
                stmt.setString(1, agentId);
                stmt.setInt(2, window);
                try (var rs = stmt.executeQuery()) {
                    recentReward = rs.next() ? rs.getDouble(1) : 0;
                }
            }

            ObjectNode metrics = context.objectMapper().createObjectNode();
            metrics.put("averageReward", avgReward);
            metrics.put("recentAverageReward", recentReward);
            metrics.put("qTableSize", policyFor(agentId).values().stream().mapToInt(Map::size).sum());
            metrics.put("sessionExperiences", getTotalExperiences(agentId));

            try (var stmt = conn.prepareStatement("""
                    INSERT INTO learning_history
                    (agent_id, snapshot_type, metrics, total_experiences, exploration_rate, timestamp)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, agentId);
                stmt.setString(2, PERIODIC_SNAPSHOT);
                stmt.setString(3, context.toJson(metrics));
                stmt.setLong(4, total);
                stmt.setDouble(5, config.explorationRate());
                stmt.setLong(6, context.now());
                stmt.executeUpdate();
            }
            return null;
        });
        log.info("Learning snapshot persisted for agent {}", agentId);
    }

    /**
     * The agent's policy table, loaded on first use. Mutations of the table happen with
     * the database lock held, in the same unit of work as the matching {@code q_values}
     * change, so the table never disagrees with committed rows.
     */
    private Map<String, Map<String, QValue>> policyFor(String agentId) {
        Map<String, Map<String, QValue>> policy = policies.get(agentId);
        if (policy != null) {
            return policy;
        }
        return context.database().read(conn -> {
            if (!policies.containsKey(agentId)) {
                restore(agentId);
            }
            return policies.get(agentId);
        });
    }

    private void ensureTables() {
        context.database().ensureTable(SchemaTable.LEARNING_EXPERIENCES);
        context.database().ensureTable(SchemaTable.Q_VALUES);
        context.database().ensureTable(SchemaTable.LEARNING_HISTORY);
    }

    private static double maxQ(Connection conn, String agentId, String stateKey) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "SELECT MAX(q_value) FROM q_values WHERE agent_id = ? AND state_key = ?")) {
            stmt.setString(1, agentId);
            stmt.setString(2, stateKey);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    double max = rs.getDouble(1);
                    return rs.wasNull() ? 0.0 : max;
                }
                return 0.0;
            }
        }
    }

    private static Optional<QValue> selectQValue(Connection conn, String agentId, String stateKey, String action)
            throws SQLException {
        try (var stmt = conn.prepareStatement("""
                SELECT agent_id, state_key, action_key, q_value, update_count, last_updated
                FROM q_values WHERE agent_id = ? AND state_key = ? AND action_key = ?
                """)) {
            stmt.setString(1, agentId);
            stmt.setString(2, stateKey);
            stmt.setString(3, action);
            try (var rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new QValue(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getDouble(4), rs.getLong(5), rs.getLong(6)));
            }
        }
    }

    private Map<String, Object> readFeatures(String json) {
        try {
            return context.objectMapper().readValue(json, FEATURES_TYPE);
        } catch (Exception e) {
            throw new StorageException("Corrupt stored state: " + json, e);
        }
    }

    private static double valueOf(Map<String, QValue> known, String action) {
        QValue q = known.get(action);
        return q == null ? 0.0 : q.value();
    }
}
