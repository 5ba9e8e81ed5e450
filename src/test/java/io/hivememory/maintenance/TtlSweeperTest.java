package io.hivememory.maintenance;

import io.hivememory.acl.AclStore;
import io.hivememory.acl.Permission;
import io.hivememory.acl.Requester;
import io.hivememory.config.MemoryProperties;
import io.hivememory.coordination.Blackboard;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.MutableClock;
import io.hivememory.memory.SQLiteSharedMemory;
import io.hivememory.memory.StoreOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TtlSweeperTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private AclStore aclStore;
    private SQLiteSharedMemory memory;
    private Blackboard blackboard;
    private TtlSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000_000);
        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        aclStore = new AclStore(context);
        var defaults = MemoryProperties.defaults();
        var properties = new MemoryProperties(defaults.path(), defaults.ttl(), defaults.learning(),
                defaults.patterns(), new MemoryProperties.Maintenance(true, null, null, 2), defaults.sync());
        memory = new SQLiteSharedMemory(context, aclStore, properties);
        blackboard = new Blackboard(context, properties);
        sweeper = new TtlSweeper(context, aclStore, properties);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldRemoveExpiredRowsAcrossBatches() {
        for (int i = 0; i < 5; i++) {
            memory.store("short-" + i, i, StoreOptions.ownedBy("agent-1").withTtl(1));
            blackboard.postHint("coord", "hint-" + i, i, 1L);
        }
        memory.store("long", "v", StoreOptions.ownedBy("agent-1").withTtl(0));
        blackboard.postHint("coord", "keep", "v", 0L);
        clock.advance(Duration.ofSeconds(1));

        SweepResult result = sweeper.sweep();

        assertEquals(5, result.entriesRemoved());
        assertEquals(5, result.hintsRemoved());
        assertEquals(1, memory.count());
        assertEquals(1, blackboard.readHints("coord", "*").size());
        assertEquals(0, context.modificationTracker().modifiedBetween(0, Long.MAX_VALUE).keySet().stream()
                .filter(ref -> ref.key().startsWith("short-")).count());
    }

    @Test
    void shouldDropAclsOfExpiredEntries() {
        memory.store("shared", "v", StoreOptions.ownedBy("agent-1").withTtl(1));
        memory.grantPermission("shared", null, Requester.agent("agent-1"), "agent-2", Set.of(Permission.READ));
        clock.advance(Duration.ofSeconds(2));

        SweepResult result = sweeper.sweep();

        assertEquals(1, result.aclsRemoved());
        assertTrue(aclStore.getAcl("default:shared").isEmpty());
    }

    @Test
    void liveRowsShouldBeUntouched() {
        memory.store("k", "v", StoreOptions.ownedBy("agent-1").withTtl(60));

        SweepResult result = sweeper.sweep();

        assertEquals(0, result.total());
        assertEquals(1, memory.count());
    }

    @Test
    void sweepShouldNotThrowOnClosedDatabase() {
        context.close();

        SweepResult result = sweeper.sweep();

        assertEquals(0, result.total());
    }
}
