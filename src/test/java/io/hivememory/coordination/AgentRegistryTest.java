package io.hivememory.coordination;

import io.hivememory.core.MemoryContext;
import io.hivememory.core.MutableClock;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000);
        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        registry = new AgentRegistry(context);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldRegisterAndLoadAgent() {
        registry.register("coder-1", "coder", Set.of("java", "sql"), null, Map.of("tasks", 0));

        AgentRegistration agent = registry.getAgent("coder-1");

        assertEquals("coder", agent.type());
        assertEquals(Set.of("java", "sql"), agent.capabilities());
        assertEquals(AgentStatus.ACTIVE, agent.status());
        assertEquals(0, agent.performance().get("tasks").asInt());
        assertEquals(1_000, agent.createdAt());
    }

    @Test
    void liveAgentCannotRegisterTwice() {
        registry.register("coder-1", "coder", Set.of(), AgentStatus.IDLE, null);

        assertThrows(ValidationException.class, () -> registry.register("coder-1", "tester", Set.of(), null, null));
    }

    @Test
    void terminatedAgentMayRegisterAgain() {
        registry.register("coder-1", "coder", Set.of(), null, null);
        registry.updateStatus("coder-1", AgentStatus.TERMINATED);

        AgentRegistration again = registry.register("coder-1", "reviewer", Set.of("review"), null, null);

        assertEquals("reviewer", registry.getAgent("coder-1").type());
        assertEquals(AgentStatus.ACTIVE, again.status());
    }

    @Test
    void statusAndPerformanceUpdatesShouldTouchUpdatedAt() {
        registry.register("coder-1", "coder", Set.of(), null, null);
        clock.advanceMillis(50);

        registry.updateStatus("coder-1", AgentStatus.IDLE);
        clock.advanceMillis(50);
        AgentRegistration updated = registry.updatePerformance("coder-1", Map.of("successRate", 0.9));

        assertEquals(AgentStatus.IDLE, updated.status());
        assertEquals(0.9, updated.performance().get("successRate").asDouble());
        assertEquals(1_100, updated.updatedAt());
        assertEquals(1_000, updated.createdAt());
    }

    @Test
    void heartbeatShouldOnlyMoveUpdatedAt() {
        registry.register("coder-1", "coder", Set.of("java"), AgentStatus.IDLE, Map.of("tasks", 3));
        clock.advanceMillis(10);

        AgentRegistration beat = registry.heartbeat("coder-1");

        assertEquals(1_010, beat.updatedAt());
        assertEquals(AgentStatus.IDLE, beat.status());
        assertEquals(3, beat.performance().get("tasks").asInt());
    }

    @Test
    void updatesOfUnknownAgentShouldFail() {
        assertThrows(NotFoundException.class, () -> registry.getAgent("ghost"));
        assertThrows(NotFoundException.class, () -> registry.updateStatus("ghost", AgentStatus.IDLE));
        assertThrows(NotFoundException.class, () -> registry.heartbeat("ghost"));
    }

    @Test
    void performanceMustBeAnObject() {
        registry.register("coder-1", "coder", Set.of(), null, null);

        assertThrows(ValidationException.class, () -> registry.updatePerformance("coder-1", List.of(1, 2)));
        assertThrows(ValidationException.class, () -> registry.register("x", "coder", Set.of(), null, "fast"));
    }

    @Test
    void shouldListByStatusTypeAndCapability() {
        registry.register("a", "coder", Set.of("java"), AgentStatus.ACTIVE, null);
        registry.register("b", "coder", Set.of("java", "go"), AgentStatus.IDLE, null);
        registry.register("c", "tester", Set.of("java"), AgentStatus.ACTIVE, null);
        registry.updateStatus("c", AgentStatus.TERMINATED);

        assertEquals(List.of("a"), ids(registry.listByStatus(AgentStatus.ACTIVE)));
        assertEquals(List.of("a", "b"), ids(registry.listByType("coder")));
        assertEquals(List.of("a", "b"), ids(registry.findByCapability("java")));
        assertEquals(List.of("b"), ids(registry.findByCapability("go")));
    }

    @Test
    void unregisterShouldRemoveAgent() {
        registry.register("coder-1", "coder", Set.of(), null, null);

        assertTrue(registry.unregister("coder-1"));
        assertFalse(registry.unregister("coder-1"));
        assertTrue(registry.findAgent("coder-1").isEmpty());
    }

    private static List<String> ids(List<AgentRegistration> agents) {
        return agents.stream().map(AgentRegistration::id).toList();
    }
}
