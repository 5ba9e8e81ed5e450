package io.hivememory.coordination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.StorageException;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Agents of the hive in {@code agent_registry}: type, capabilities, lifecycle status
 * and the last performance figures each agent reported. Registrations never expire;
 * a finished agent is marked {@link AgentStatus#TERMINATED} or unregistered.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final String COLUMNS = "id, type, capabilities, status, performance, created_at, updated_at";

    private final MemoryContext context;

    public AgentRegistry(MemoryContext context) {
        this.context = context;
    }

    /**
     * Registers a new agent. A terminated agent may register again under the same id;
     * its row is replaced.
     *
     * @param performance initial metrics, or null for an empty object
     * @throws ValidationException bad arguments, or a live agent with that id is registered
     */
    public AgentRegistration register(String agentId, String type, Set<String> capabilities, AgentStatus status,
                                      Object performance) {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("agentId is required");
        }
        if (type == null || type.isBlank()) {
            throw new ValidationException("type is required");
        }
        long now = context.now();
        var registration = new AgentRegistration(agentId, type, capabilities,
                status == null ? AgentStatus.ACTIVE : status, performanceTree(performance), now, now);

        context.database().ensureTable(SchemaTable.AGENT_REGISTRY);
        context.database().write(conn -> {
            Optional<AgentRegistration> existing = find(conn, agentId);
            if (existing.isPresent() && existing.get().status() != AgentStatus.TERMINATED) {
                throw new ValidationException("Agent already registered: " + agentId);
            }
            try (var stmt = conn.prepareStatement("INSERT OR REPLACE INTO agent_registry (" + COLUMNS + ")"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                stmt.setString(1, registration.id());
                stmt.setString(2, registration.type());
                stmt.setString(3, context.toJson(new ArrayList<>(new TreeSet<>(registration.capabilities()))));
                stmt.setString(4, registration.status().tag());
                stmt.setString(5, context.toJson(registration.performance()));
                stmt.setLong(6, registration.createdAt());
                stmt.setLong(7, registration.updatedAt());
                return stmt.executeUpdate();
            }
        });
        log.info("Registered {} agent {} ({})", type, agentId, registration.status().tag());
        return registration;
    }

    /**
     * @throws NotFoundException the agent is not registered
     */
    public AgentRegistration getAgent(String agentId) {
        return findAgent(agentId).orElseThrow(() -> new NotFoundException("Agent not found: " + agentId));
    }

    public Optional<AgentRegistration> findAgent(String agentId) {
        context.database().ensureTable(SchemaTable.AGENT_REGISTRY);
        return context.database().read(conn -> find(conn, agentId));
    }

    /**
     * @throws NotFoundException the agent is not registered
     */
    public AgentRegistration updateStatus(String agentId, AgentStatus status) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        AgentRegistration updated = touch(agentId, "status = ?", stmt -> stmt.setString(1, status.tag()));
        log.info("Agent {} is now {}", agentId, status.tag());
        return updated;
    }

    /**
     * Replaces the performance figures of an agent.
     *
     * @param performance a JSON object, or a value that serializes to one
     * @throws NotFoundException the agent is not registered
     */
    public AgentRegistration updatePerformance(String agentId, Object performance) {
        JsonNode tree = performanceTree(performance);
        return touch(agentId, "performance = ?", stmt -> stmt.setString(1, context.toJson(tree)));
    }

    /**
     * Marks the agent as alive without changing anything else.
     *
     * @throws NotFoundException the agent is not registered
     */
    public AgentRegistration heartbeat(String agentId) {
        return touch(agentId, null, null);
    }

    /**
     * @return true if the agent was registered
     */
    public boolean unregister(String agentId) {
        context.database().ensureTable(SchemaTable.AGENT_REGISTRY);
        int removed = context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("DELETE FROM agent_registry WHERE id = ?")) {
                stmt.setString(1, agentId);
                return stmt.executeUpdate();
            }
        });
        if (removed > 0) {
            log.info("Unregistered agent {}", agentId);
        }
        return removed > 0;
    }

    public List<AgentRegistration> listByStatus(AgentStatus status) {
        return select("SELECT " + COLUMNS + " FROM agent_registry WHERE status = ? ORDER BY id", status.tag());
    }

    public List<AgentRegistration> listByType(String type) {
        return select("SELECT " + COLUMNS + " FROM agent_registry WHERE type = ? ORDER BY id", type);
    }

    /**
     * Non-terminated agents that declare {@code capability}.
     */
    public List<AgentRegistration> findByCapability(String capability) {
        return select("SELECT " + COLUMNS + " FROM agent_registry WHERE status != ? ORDER BY id",
                AgentStatus.TERMINATED.tag())
                .stream()
                .filter(agent -> agent.capabilities().contains(capability))
                .toList();
    }

    private AgentRegistration touch(String agentId, String assignment, Binder binder) {
        long now = context.now();
        context.database().ensureTable(SchemaTable.AGENT_REGISTRY);
        return context.database().write(conn -> {
            String sql = "UPDATE agent_registry SET "
                    + (assignment == null ? "" : assignment + ", ")
                    + "updated_at = ? WHERE id = ?";
            int offset = assignment == null ? 0 : 1;
            try (var stmt = conn.prepareStatement(sql)) {
                if (binder != null) {
                    binder.bind(stmt);
                }
                stmt.setLong(offset + 1, now);
                stmt.setString(offset + 2, agentId);
                if (stmt.executeUpdate() == 0) {
                    throw new NotFoundException("Agent not found: " + agentId);
                }
            }
            return find(conn, agentId).orElseThrow();
        });
    }

    private List<AgentRegistration> select(String sql, String parameter) {
        context.database().ensureTable(SchemaTable.AGENT_REGISTRY);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, parameter);
                List<AgentRegistration> agents = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        agents.add(readAgent(rs));
                    }
                }
                return agents;
            }
        });
    }

    private Optional<AgentRegistration> find(Connection conn, String agentId) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM agent_registry WHERE id = ?")) {
            stmt.setString(1, agentId);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readAgent(rs)) : Optional.empty();
            }
        }
    }

    private AgentRegistration readAgent(ResultSet rs) throws SQLException {
        String capabilities = rs.getString("capabilities");
        try {
            return new AgentRegistration(
                    rs.getString("id"),
                    rs.getString("type"),
                    new TreeSet<>(context.objectMapper().readValue(capabilities, STRINGS)),
                    AgentStatus.fromTag(rs.getString("status")),
                    context.readJson(rs.getString("performance")),
                    rs.getLong("created_at"),
                    rs.getLong("updated_at"));
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt agent record: " + capabilities, e);
        }
    }

    private JsonNode performanceTree(Object performance) {
        if (performance == null) {
            return context.objectMapper().createObjectNode();
        }
        JsonNode tree = context.toTree(performance);
        if (!(tree instanceof ObjectNode)) {
            throw new ValidationException("performance must be a JSON object");
        }
        return tree;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }
}
