package io.hivememory.coordination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * An agent known to the hive.
 *
 * @param performance free-form metrics reported by the agent, a JSON object
 * @param updatedAt   last status change, performance report or heartbeat
 */
public record AgentRegistration(
        String id,
        String type,
        Set<String> capabilities,
        AgentStatus status,
        JsonNode performance,
        long createdAt,
        long updatedAt
) {

    public AgentRegistration {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
