package io.hivememory.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.AccessLevel;
import io.hivememory.acl.AccessScope;
import io.hivememory.acl.AclStore;
import io.hivememory.acl.Permission;
import io.hivememory.acl.Requester;
import io.hivememory.config.MemoryProperties;
import io.hivememory.core.AccessDeniedException;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.MutableClock;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.ValidationException;
import io.hivememory.maintenance.TtlSweeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteSharedMemoryTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private AclStore aclStore;
    private SQLiteSharedMemory memory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        aclStore = new AclStore(context);
        memory = new SQLiteSharedMemory(context, aclStore, MemoryProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldStoreAndRetrieveOwnEntry() {
        memory.store("config", Map.of("retries", 3), StoreOptions.ownedBy("agent-1"));

        Optional<JsonNode> value = memory.retrieve("config", null, Requester.agent("agent-1"));

        assertTrue(value.isPresent());
        assertEquals(3, value.get().get("retries").asInt());
    }

    @Test
    void shouldApplyDefaultTtl() {
        MemoryEntry entry = memory.store("k", "v", StoreOptions.ownedBy("agent-1"));

        assertEquals(1800, entry.ttlSeconds());
        assertEquals(entry.createdAt() + 1_800_000, entry.expiresAt());
        assertEquals(StoreOptions.DEFAULT_PARTITION, entry.partition());
        assertEquals("node-a", entry.originNode());
    }

    @Test
    void shouldHideEntryOnceTtlElapses() {
        memory.store("temp", "v", StoreOptions.ownedBy("agent-1").withTtl(1));

        clock.advance(Duration.ofMillis(999));
        assertTrue(memory.retrieve("temp", null, Requester.agent("agent-1")).isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(memory.retrieve("temp", null, Requester.agent("agent-1")).isEmpty());
        assertTrue(memory.query("%", null, Requester.agent("agent-1")).isEmpty());
    }

    @Test
    void zeroTtlShouldNeverExpire() {
        memory.store("forever", "v", StoreOptions.ownedBy("agent-1").withTtl(0));

        clock.advance(Duration.ofDays(3650));

        assertTrue(memory.retrieve("forever", null, Requester.agent("agent-1")).isPresent());
    }

    @Test
    void sweepShouldRemoveExpiredRowsOnce() {
        memory.store("a", 1, StoreOptions.ownedBy("agent-1").withTtl(1));
        memory.store("b", 2, StoreOptions.ownedBy("agent-1").withTtl(0));
        clock.advance(Duration.ofSeconds(2));

        var sweeper = new TtlSweeper(context, aclStore, MemoryProperties.defaults());
        assertEquals(1, sweeper.sweep().entriesRemoved());
        assertEquals(0, sweeper.sweep().entriesRemoved());
        assertEquals(1, memory.count());
        assertTrue(memory.getLastModified("a", null).isEmpty());
    }

    @Test
    void shouldRejectNegativeTtlAndMissingOwner() {
        assertThrows(ValidationException.class,
                () -> memory.store("k", "v", StoreOptions.ownedBy("agent-1").withTtl(-5)));
        assertThrows(ValidationException.class,
                () -> memory.store("k", "v", StoreOptions.ownedBy(" ")));
        assertThrows(ValidationException.class,
                () -> memory.store("k", "v", new StoreOptions(null, null, AccessLevel.TEAM, "agent-1", null, null)));
    }

    @Test
    void privateEntryShouldBeDeniedToOthers() {
        memory.store("secret", "v", StoreOptions.ownedBy("agent-1"));

        assertThrows(AccessDeniedException.class,
                () -> memory.retrieve("secret", null, Requester.agent("agent-2")));
        assertTrue(memory.query("%", null, Requester.agent("agent-2")).isEmpty());
    }

    @Test
    void missingEntryShouldBeEmptyForAnyone() {
        assertTrue(memory.retrieve("nothing", null, Requester.agent("agent-2")).isEmpty());
    }

    @Test
    void teamEntryShouldBeVisibleToTeamOnly() {
        memory.store("plan", "v", StoreOptions.ownedBy("agent-1").forTeam("red"));

        assertTrue(memory.retrieve("plan", null, Requester.member("agent-2", "red", null)).isPresent());
        assertThrows(AccessDeniedException.class,
                () -> memory.retrieve("plan", null, Requester.member("agent-3", "blue", null)));
    }

    @Test
    void swarmEntryShouldBeVisibleToSwarm() {
        memory.store("map", "v", StoreOptions.ownedBy("agent-1").forSwarm("hive-1"));

        assertTrue(memory.retrieve("map", null, Requester.member("agent-2", null, "hive-1")).isPresent());
        assertThrows(AccessDeniedException.class,
                () -> memory.retrieve("map", null, Requester.member("agent-2", null, "hive-2")));
    }

    @Test
    void grantShouldOpenPrivateEntry() {
        memory.store("secret", "v", StoreOptions.ownedBy("agent-1"));

        memory.grantPermission("secret", null, Requester.agent("agent-1"), "agent-2", Set.of(Permission.READ));

        assertTrue(memory.retrieve("secret", null, Requester.agent("agent-2")).isPresent());
    }

    @Test
    void blockShouldOverridePublicAccess() {
        memory.store("news", "v", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));
        memory.blockAgent("news", null, Requester.agent("agent-1"), "agent-2");

        assertThrows(AccessDeniedException.class,
                () -> memory.retrieve("news", null, Requester.agent("agent-2")));
        assertTrue(memory.retrieve("news", null, Requester.agent("agent-3")).isPresent());

        memory.unblockAgent("news", null, Requester.agent("agent-1"), "agent-2");
        assertTrue(memory.retrieve("news", null, Requester.agent("agent-2")).isPresent());
    }

    @Test
    void onlyOwnerMayChangeAcl() {
        memory.store("news", "v", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));

        assertThrows(AccessDeniedException.class, () -> memory.grantPermission("news", null,
                Requester.agent("agent-2"), "agent-2", Set.of(Permission.WRITE)));
        assertThrows(NotFoundException.class, () -> memory.blockAgent("missing", null,
                Requester.agent("agent-1"), "agent-2"));
    }

    @Test
    void nonOwnerWriteNeedsWritePermission() {
        memory.store("doc", "v1", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));

        assertThrows(AccessDeniedException.class,
                () -> memory.store("doc", "v2", StoreOptions.ownedBy("agent-2")));

        memory.grantPermission("doc", null, Requester.agent("agent-1"), "agent-2", Set.of(Permission.WRITE));
        MemoryEntry updated = memory.store("doc", "v2", StoreOptions.ownedBy("agent-2"));

        assertEquals("agent-1", updated.owner());
        assertEquals(AccessLevel.PUBLIC, updated.accessLevel());
        assertEquals("v2", memory.retrieve("doc", null, Requester.agent("agent-3")).orElseThrow().asText());
    }

    @Test
    void teamMemberMayUpdateTeamEntry() {
        memory.store("plan", "v1", StoreOptions.ownedBy("agent-1").forTeam("red"));

        MemoryEntry updated = memory.store("plan", "v2", StoreOptions.ownedBy("agent-2").forTeam("red"));

        assertEquals("agent-1", updated.owner());
        assertEquals(AccessScope.team("red"), updated.scope());
    }

    @Test
    void updateShouldKeepCreatedAt() {
        MemoryEntry first = memory.store("k", "v1", StoreOptions.ownedBy("agent-1"));
        clock.advance(Duration.ofSeconds(5));
        MemoryEntry second = memory.store("k", "v2", StoreOptions.ownedBy("agent-1"));

        assertEquals(first.createdAt(), second.createdAt());
        assertEquals(first.updatedAt() + 5_000, second.updatedAt());
    }

    @Test
    void deleteShouldBeLimitedToOwnerAndSystem() {
        memory.store("a", "v", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));
        memory.store("b", "v", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));

        assertThrows(AccessDeniedException.class, () -> memory.delete("a", null, Requester.agent("agent-2")));
        assertTrue(memory.delete("a", null, Requester.agent("agent-1")));
        assertTrue(memory.delete("b", null, Requester.system("janitor")));
        assertFalse(memory.delete("b", null, Requester.agent("agent-1")));
        assertEquals(0, memory.count());
    }

    @Test
    void deleteShouldDropAcl() {
        memory.store("a", "v", StoreOptions.ownedBy("agent-1"));
        memory.grantPermission("a", null, Requester.agent("agent-1"), "agent-2", Set.of(Permission.READ));

        memory.delete("a", null, Requester.agent("agent-1"));

        assertTrue(aclStore.getAcl("default:a").isEmpty());
    }

    @Test
    void queryShouldMatchLikePatternWithinPartition() {
        var opts = StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC).inPartition("tasks");
        memory.store("task:1", "a", opts);
        memory.store("task:2", "b", opts);
        memory.store("note:1", "c", opts);
        memory.store("task:3", "d", StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));

        List<MemoryEntry> found = memory.query("task:%", "tasks", Requester.agent("agent-2"));

        assertEquals(List.of("task:1", "task:2"), found.stream().map(MemoryEntry::key).toList());
    }

    @Test
    void clearShouldEmptyOnePartition() {
        memory.store("a", 1, StoreOptions.ownedBy("agent-1").inPartition("p1"));
        memory.store("b", 2, StoreOptions.ownedBy("agent-1").inPartition("p2"));

        assertEquals(1, memory.clear("p1"));
        assertEquals(1, memory.count());
    }

    @Test
    void getModifiedEntriesShouldBeOrderedAndStrict() {
        MemoryEntry a = memory.store("a", 1, StoreOptions.ownedBy("agent-1"));
        clock.advance(Duration.ofMillis(10));
        memory.store("b", 2, StoreOptions.ownedBy("agent-1"));
        clock.advance(Duration.ofMillis(10));
        memory.store("c", 3, StoreOptions.ownedBy("agent-1").inPartition("other"));

        List<MemoryEntry> all = memory.getModifiedEntries(a.lastModified(), null);
        List<MemoryEntry> scoped = memory.getModifiedEntries(0, "default");

        assertEquals(List.of("b", "c"), all.stream().map(MemoryEntry::key).toList());
        assertEquals(List.of("a", "b"), scoped.stream().map(MemoryEntry::key).toList());
        assertEquals(Optional.of(a.lastModified()), memory.getLastModified("a", null));
    }

    @Test
    void grantsOfAnExpiredEntryShouldNotCarryOverToItsSuccessor() {
        memory.store("k", "A-data", StoreOptions.ownedBy("agent-a").withTtl(1));
        memory.grantPermission("k", null, Requester.agent("agent-a"), "agent-b", Set.of(Permission.READ));
        assertEquals("A-data", memory.retrieve("k", null, Requester.agent("agent-b")).orElseThrow().asText());

        clock.advance(Duration.ofSeconds(2));
        MemoryEntry successor = memory.store("k", "C-secret", StoreOptions.ownedBy("agent-c").withTtl(0));

        assertEquals("agent-c", successor.owner());
        assertTrue(aclStore.getAcl("default:k").isEmpty());
        assertThrows(AccessDeniedException.class, () -> memory.retrieve("k", null, Requester.agent("agent-b")));
        assertEquals("C-secret", memory.retrieve("k", null, Requester.agent("agent-c")).orElseThrow().asText());
    }

    @Test
    void blocksOfAnExpiredEntryShouldNotCarryOverToItsSuccessor() {
        memory.store("k", "old", StoreOptions.ownedBy("agent-a").withTtl(1).withAccess(AccessLevel.PUBLIC));
        memory.blockAgent("k", null, Requester.agent("agent-a"), "agent-b");

        clock.advance(Duration.ofSeconds(2));
        memory.store("k", "new", StoreOptions.ownedBy("agent-c").withTtl(0).withAccess(AccessLevel.PUBLIC));

        assertEquals("new", memory.retrieve("k", null, Requester.agent("agent-b")).orElseThrow().asText());
    }

    @Test
    void remoteVersionWithAnotherOwnerShouldDropLocalAcl() {
        MemoryEntry local = memory.store("k", "mine", StoreOptions.ownedBy("agent-a").withTtl(0));
        memory.grantPermission("k", null, Requester.agent("agent-a"), "agent-b", Set.of(Permission.READ));

        var remote = new MemoryEntry("k", "default", context.toTree("theirs"), "agent-z", AccessScope.privateScope(),
                0, 0, local.createdAt(), local.lastModified() + 1, local.lastModified() + 1, "node-b");
        assertTrue(memory.applyRemote(remote));

        assertTrue(aclStore.getAcl("default:k").isEmpty());
        assertThrows(AccessDeniedException.class, () -> memory.retrieve("k", null, Requester.agent("agent-b")));
    }

    @Test
    void remoteVersionWithSameOwnerShouldKeepLocalAcl() {
        MemoryEntry local = memory.store("k", "mine", StoreOptions.ownedBy("agent-a").withTtl(0));
        memory.grantPermission("k", null, Requester.agent("agent-a"), "agent-b", Set.of(Permission.READ));

        assertTrue(memory.applyRemote(copy(local, "updated", local.lastModified() + 1, "node-b")));

        assertEquals("updated", memory.retrieve("k", null, Requester.agent("agent-b")).orElseThrow().asText());
    }

    @Test
    void storesRunningDuringSweepShouldSurviveIt() throws Exception {
        for (int i = 0; i < 200; i++) {
            memory.store("old-" + i, i, StoreOptions.ownedBy("agent-1").withTtl(1));
        }
        clock.advance(Duration.ofSeconds(2));
        var defaults = MemoryProperties.defaults();
        var sweeper = new TtlSweeper(context, aclStore, new MemoryProperties(defaults.path(), defaults.ttl(),
                defaults.learning(), defaults.patterns(), new MemoryProperties.Maintenance(true, null, null, 7),
                defaults.sync()));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    memory.store("new-" + i, i, StoreOptions.ownedBy("agent-1").withTtl(0));
                    memory.store("old-" + (i % 20), "revived", StoreOptions.ownedBy("agent-1").withTtl(0));
                }
            });
            sweeper.sweep();
            writer.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        sweeper.sweep();

        assertEquals(200, memory.query("new-%", null, Requester.agent("agent-1")).size());
        for (int i = 0; i < 20; i++) {
            assertEquals("revived", memory.retrieve("old-" + i, null, Requester.agent("agent-1")).orElseThrow().asText());
        }
        assertEquals(220, memory.count());
    }

    @Test
    void applyRemoteShouldKeepNewerVersion() {
        MemoryEntry local = memory.store("k", "local", StoreOptions.ownedBy("agent-1").withTtl(0));

        assertFalse(memory.applyRemote(copy(local, "older", local.lastModified() - 1, "node-z")));
        assertTrue(memory.applyRemote(copy(local, "newer", local.lastModified() + 1, "node-b")));

        assertEquals("newer", memory.getEntry("k", null).orElseThrow().value().asText());
        assertEquals("node-b", memory.getEntry("k", null).orElseThrow().originNode());
    }

    @Test
    void applyRemoteTieShouldGoToLargerNodeId() {
        MemoryEntry local = memory.store("k", "local", StoreOptions.ownedBy("agent-1").withTtl(0));

        assertFalse(memory.applyRemote(copy(local, "from-0", local.lastModified(), "node-0")));
        assertTrue(memory.applyRemote(copy(local, "from-b", local.lastModified(), "node-b")));
        assertEquals("from-b", memory.getEntry("k", null).orElseThrow().value().asText());
    }

    @Test
    void applyRemoteShouldSkipExpiredEntriesAndNotTrack() {
        var remote = new MemoryEntry("r", "default", context.toTree("x"), "agent-9", AccessScope.publicScope(),
                1, clock.millis() - 1, 0, 0, 0, "node-b");
        assertFalse(memory.applyRemote(remote));

        var live = new MemoryEntry("s", "default", context.toTree("y"), "agent-9", AccessScope.publicScope(),
                0, 0, 5, 5, 5, "node-b");
        assertTrue(memory.applyRemote(live));
        assertTrue(memory.getLastModified("s", null).isEmpty());
    }

    @Test
    void statsShouldSummarizeEntries() {
        memory.store("a", 1, StoreOptions.ownedBy("agent-1").withAccess(AccessLevel.PUBLIC));
        memory.store("b", 2, StoreOptions.ownedBy("agent-1").inPartition("p2"));

        MemoryStats stats = memory.stats();

        assertEquals(2, stats.totalEntries());
        assertEquals(0, stats.totalPatterns());
        assertEquals(List.of("default", "p2"), stats.partitions());
        assertEquals(1L, stats.accessLevels().get("public"));
        assertTrue(memory.healthCheck());
    }

    @Test
    void shouldPersistAcrossReopen() {
        memory.store("durable", "v", StoreOptions.ownedBy("agent-1").withTtl(0));
        context.close();

        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        memory = new SQLiteSharedMemory(context, new AclStore(context), MemoryProperties.defaults());

        assertEquals("v", memory.retrieve("durable", null, Requester.agent("agent-1")).orElseThrow().asText());
    }

    private MemoryEntry copy(MemoryEntry entry, String value, long lastModified, String node) {
        return new MemoryEntry(entry.key(), entry.partition(), context.toTree(value), entry.owner(), entry.scope(),
                entry.ttlSeconds(), entry.expiresAt(), entry.createdAt(), lastModified, lastModified, node);
    }
}
