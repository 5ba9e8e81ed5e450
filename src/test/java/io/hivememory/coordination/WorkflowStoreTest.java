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

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private WorkflowStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000);
        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        store = new WorkflowStore(context);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldResumeFromLatestCheckpoint() {
        store.saveCheckpoint("wf-1", "fetch", "running", Map.of("page", 1));
        clock.advanceMillis(10);
        store.saveCheckpoint("wf-1", "parse", "running", Map.of("page", 2));

        WorkflowCheckpoint resumed = store.resume("wf-1");

        assertEquals("parse", resumed.step());
        assertEquals(2, resumed.state().get("page").asInt());
        assertEquals(WorkflowStore.sha256("{\"page\":2}"), resumed.sha());
    }

    @Test
    void resumeShouldFailForUnknownWorkflow() {
        assertThrows(NotFoundException.class, () -> store.resume("ghost"));
        assertTrue(store.getLatestCheckpoint("ghost").isEmpty());
    }

    @Test
    void shouldListCheckpointsOldestFirst() {
        store.saveCheckpoint("wf-1", "a", "running", null);
        store.saveCheckpoint("wf-1", "b", "running", null);
        store.saveCheckpoint("wf-2", "x", "running", null);

        List<String> steps = store.listCheckpoints("wf-1").stream().map(WorkflowCheckpoint::step).toList();

        assertEquals(List.of("a", "b"), steps);
        assertTrue(store.listCheckpoints("wf-1").get(0).state().isNull());
    }

    @Test
    void statusQueryShouldUseLatestCheckpointOnly() {
        store.saveCheckpoint("wf-1", "a", "running", null);
        store.saveCheckpoint("wf-1", "b", "completed", null);
        store.saveCheckpoint("wf-2", "a", "running", null);

        List<WorkflowCheckpoint> running = store.queryWorkflowsByStatus("running");
        List<WorkflowCheckpoint> completed = store.queryWorkflowsByStatus("completed");

        assertEquals(List.of("wf-2"), running.stream().map(WorkflowCheckpoint::workflowId).toList());
        assertEquals(List.of("wf-1"), completed.stream().map(WorkflowCheckpoint::workflowId).toList());
    }

    @Test
    void shouldValidateIdentifiers() {
        assertThrows(ValidationException.class, () -> store.saveCheckpoint(" ", "a", "running", null));
        assertThrows(ValidationException.class, () -> store.saveCheckpoint("wf", null, "running", null));
    }

    @Test
    void checksumShouldBeHexSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", WorkflowStore.sha256(""));
    }
}
