package io.hivememory.planning;

import com.fasterxml.jackson.core.type.TypeReference;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.StorageException;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Goals, actions and committed plans in {@code goap_goals}, {@code goap_actions}
 * and {@code goap_plans}.
 */
@Component
public class GoapStore {

    private static final Logger log = LoggerFactory.getLogger(GoapStore.class);
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private final MemoryContext context;

    public GoapStore(MemoryContext context) {
        this.context = context;
    }

    public GoapGoal storeGoal(String id, Set<String> conditions, int cost, String priority) {
        requireId(id);
        context.database().ensureTable(SchemaTable.GOAP_GOALS);
        var goal = new GoapGoal(id, conditions, cost, priority, context.now());
        context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    INSERT OR REPLACE INTO goap_goals (id, conditions, cost, priority, created_at)
                    VALUES (?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, id);
                stmt.setString(2, sortedJson(goal.conditions()));
                stmt.setInt(3, cost);
                stmt.setString(4, priority);
                stmt.setLong(5, goal.createdAt());
                return stmt.executeUpdate();
            }
        });
        return goal;
    }

    public Optional<GoapGoal> getGoal(String id) {
        context.database().ensureTable(SchemaTable.GOAP_GOALS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement(
                    "SELECT id, conditions, cost, priority, created_at FROM goap_goals WHERE id = ?")) {
                stmt.setString(1, id);
                try (var rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<GoapGoal>empty();
                    }
                    return Optional.of(new GoapGoal(rs.getString(1), readSet(rs.getString(2)), rs.getInt(3),
                            rs.getString(4), rs.getLong(5)));
                }
            }
        });
    }

    public GoapAction storeAction(String id, Set<String> preconditions, Set<String> effects,
                                  int cost, String agentType) {
        requireId(id);
        if (cost < 0) {
            throw new ValidationException("action cost must be >= 0");
        }
        context.database().ensureTable(SchemaTable.GOAP_ACTIONS);
        var action = new GoapAction(id, preconditions, effects, cost, agentType, context.now());
        context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    INSERT OR REPLACE INTO goap_actions (id, preconditions, effects, cost, agent_type, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, id);
                stmt.setString(2, sortedJson(action.preconditions()));
                stmt.setString(3, sortedJson(action.effects()));
                stmt.setInt(4, cost);
                stmt.setString(5, agentType);
                stmt.setLong(6, action.createdAt());
                return stmt.executeUpdate();
            }
        });
        return action;
    }

    public List<GoapAction> listActions() {
        context.database().ensureTable(SchemaTable.GOAP_ACTIONS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement(
                    "SELECT id, preconditions, effects, cost, agent_type, created_at FROM goap_actions ORDER BY id")) {
                return readActions(stmt.executeQuery());
            }
        });
    }

    /**
     * Commits a new plan under a fresh id.
     */
    public GoapPlan commitPlan(String goalId, List<String> sequence, int totalCost) {
        return storePlan(new GoapPlan(UUID.randomUUID().toString(), goalId, sequence, totalCost, context.now()));
    }

    /**
     * Commits a plan.
     *
     * @throws ValidationException a plan with the same id already exists
     */
    public GoapPlan storePlan(GoapPlan plan) {
        requireId(plan.id());
        context.database().ensureTable(SchemaTable.GOAP_PLANS);
        context.database().write(conn -> {
            try (var check = conn.prepareStatement("SELECT 1 FROM goap_plans WHERE id = ?")) {
                check.setString(1, plan.id());
                try (var rs = check.executeQuery()) {
                    if (rs.next()) {
                        throw new ValidationException("Plan already committed: " + plan.id());
                    }
                }
            }
            try (var stmt = conn.prepareStatement("""
                    INSERT INTO goap_plans (id, goal_id, sequence, total_cost, created_at) VALUES (?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, plan.id());
                stmt.setString(2, plan.goalId());
                stmt.setString(3, context.toJson(plan.sequence()));
                stmt.setInt(4, plan.totalCost());
                stmt.setLong(5, plan.createdAt());
                return stmt.executeUpdate();
            }
        });
        log.info("Committed plan {} for goal {} ({} actions, cost {})",
                plan.id(), plan.goalId(), plan.sequence().size(), plan.totalCost());
        return plan;
    }

    /**
     * @throws NotFoundException no plan with that id
     */
    public GoapPlan getPlan(String id) {
        context.database().ensureTable(SchemaTable.GOAP_PLANS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement(
                    "SELECT id, goal_id, sequence, total_cost, created_at FROM goap_plans WHERE id = ?")) {
                stmt.setString(1, id);
                try (var rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new NotFoundException("Plan not found: " + id);
                    }
                    return new GoapPlan(rs.getString(1), rs.getString(2), readList(rs.getString(3)),
                            rs.getInt(4), rs.getLong(5));
                }
            }
        });
    }

    private List<GoapAction> readActions(ResultSet rs) throws SQLException {
        List<GoapAction> actions = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                actions.add(new GoapAction(rs.getString(1), readSet(rs.getString(2)), readSet(rs.getString(3)),
                        rs.getInt(4), rs.getString(5), rs.getLong(6)));
            }
        }
        return actions;
    }

    private String sortedJson(Set<String> values) {
        return context.toJson(new ArrayList<>(new TreeSet<>(values)));
    }

    private Set<String> readSet(String json) {
        return new TreeSet<>(readList(json));
    }

    private List<String> readList(String json) {
        try {
            return context.objectMapper().readValue(json, STRINGS);
        } catch (Exception e) {
            throw new StorageException("Corrupt GOAP record: " + json, e);
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id is required");
        }
    }
}
