package io.hivememory.pattern;

import io.hivememory.config.MemoryProperties;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.MutableClock;
import io.hivememory.core.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLitePatternBankTest {

    private static final String BACKOFF = "retry the request with exponential backoff";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private SQLitePatternBank bank;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000_000);
        context = MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
        bank = new SQLitePatternBank(context, MemoryProperties.defaults());
        bank.init();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldMergeDuplicateContentWithUsageWeightedConfidence() {
        PatternStoreResult first = bank.storePattern(BACKOFF, 0.90, "agent-1", "networking");
        PatternStoreResult second = bank.storePattern(BACKOFF, 0.92, "agent-1", "networking");

        assertFalse(first.merged());
        assertTrue(second.merged());
        assertEquals(first.pattern().id(), second.pattern().id());
        assertEquals(2, second.pattern().usageCount());
        assertEquals(0.91, second.pattern().confidence(), 1e-9);
        assertEquals(1, bank.countPatterns());
    }

    @Test
    void shouldNotMergeAcrossScopes() {
        bank.storePattern(BACKOFF, 0.9, "agent-1", "networking");
        bank.storePattern(BACKOFF, 0.9, "agent-2", "networking");
        bank.storePattern(BACKOFF, 0.9, "agent-1", "storage");

        assertEquals(3, bank.countPatterns());
    }

    @Test
    void shouldKeepDistinctContentApart() {
        bank.storePattern(BACKOFF, 0.9, "agent-1", "ops");
        PatternStoreResult other = bank.storePattern("parse invoice totals from scanned pdf documents", 0.9,
                "agent-1", "ops");

        assertFalse(other.merged());
        assertEquals(2, bank.countPatterns());
    }

    @Test
    void shouldMergeSuccessRates() {
        bank.storePattern(BACKOFF, 0.8, "agent-1", "net", 1.0);
        PatternStoreResult merged = bank.storePattern(BACKOFF, 0.8, "agent-1", "net", 0.0);

        assertEquals(0.5, merged.pattern().successRate(), 1e-9);
    }

    @Test
    void shouldRejectOutOfRangeInput() {
        assertThrows(ValidationException.class, () -> bank.storePattern(BACKOFF, 1.5, "agent-1", "net"));
        assertThrows(ValidationException.class, () -> bank.storePattern(BACKOFF, 0.5, "agent-1", "net", -0.1));
        assertThrows(ValidationException.class, () -> bank.storePattern(" ", 0.5, "agent-1", "net"));
        assertEquals(0, bank.countPatterns());
    }

    @Test
    void domainQueryShouldOrderBySuccessRateThenConfidence() {
        String unknown = bank.storePattern("cache hot keys in memory", 0.99, "a", "perf").pattern().id();
        String weak = bank.storePattern("batch database writes together", 0.9, "b", "perf", 0.4).pattern().id();
        String strong = bank.storePattern("profile before optimizing anything", 0.5, "c", "perf", 0.9).pattern().id();
        String strongConfident = bank.storePattern("avoid allocation inside tight loops", 0.8, "d", "perf", 0.9)
                .pattern().id();

        List<String> ids = bank.queryPatternsByDomain("perf").stream().map(Pattern::id).toList();

        assertEquals(List.of(strongConfident, strong, weak, unknown), ids);
    }

    @Test
    void agentQueryShouldReturnOnlyThatAgent() {
        bank.storePattern("cache hot keys in memory", 0.9, "a", "perf");
        bank.storePattern("batch database writes together", 0.9, "b", "perf");

        List<Pattern> patterns = bank.queryPatternsByAgent("a");

        assertEquals(1, patterns.size());
        assertEquals("cache hot keys in memory", patterns.get(0).content());
    }

    @Test
    void searchShouldRankClosestFirst() {
        bank.storePattern(BACKOFF, 0.9, "agent-1", "net");
        bank.storePattern("parse invoice totals from scanned pdf documents", 0.9, "agent-1", "net");

        List<PatternMatch> matches = bank.searchSimilar("retry request with backoff", 2, "agent-1", "net");

        assertEquals(2, matches.size());
        assertEquals(BACKOFF, matches.get(0).pattern().content());
        assertTrue(matches.get(0).similarity() > matches.get(1).similarity());
        assertTrue(bank.searchSimilar(BACKOFF, 5, "agent-9", "net").isEmpty());
    }

    @Test
    void indexShouldBeRebuiltOnInit() {
        String id = bank.storePattern(BACKOFF, 0.9, "agent-1", "net").pattern().id();

        var reopened = new SQLitePatternBank(context, MemoryProperties.defaults());
        reopened.init();

        List<PatternMatch> matches = reopened.searchSimilar(BACKOFF, 1, "agent-1", "net");
        assertEquals(id, matches.get(0).pattern().id());
        assertTrue(reopened.storePattern(BACKOFF, 0.9, "agent-1", "net").merged());
    }

    @Test
    void embeddingShouldSurviveStorage() {
        Pattern stored = bank.storePattern(BACKOFF, 0.9, "agent-1", "net").pattern();

        Pattern loaded = bank.getPattern(stored.id()).orElseThrow();

        assertArrayEquals(stored.embedding(), loaded.embedding());
    }

    @Test
    void recordOutcomeShouldUpdateSuccessRate() {
        String id = bank.storePattern(BACKOFF, 0.9, "agent-1", "net").pattern().id();

        Pattern afterSuccess = bank.recordOutcome(id, true).orElseThrow();
        Pattern afterFailure = bank.recordOutcome(id, false).orElseThrow();

        assertEquals(1.0, afterSuccess.successRate(), 1e-9);
        assertEquals(2, afterSuccess.usageCount());
        assertEquals(2.0 / 3.0, afterFailure.successRate(), 1e-9);
        assertTrue(bank.recordOutcome("missing", true).isEmpty());
    }

    @Test
    void deleteShouldRemoveFromIndex() {
        String id = bank.storePattern(BACKOFF, 0.9, "agent-1", "net").pattern().id();

        assertTrue(bank.deletePattern(id));
        assertFalse(bank.deletePattern(id));
        assertTrue(bank.searchSimilar(BACKOFF, 1, "agent-1", "net").isEmpty());
        assertFalse(bank.storePattern(BACKOFF, 0.9, "agent-1", "net").merged());
    }

    @Test
    void shouldHandleUnscopedPatterns() {
        bank.storePattern(BACKOFF, 0.9, null, null);
        assertTrue(bank.storePattern(BACKOFF, 0.9, null, null).merged());
    }

    @Test
    void concurrentStoresInOneScopeShouldKeepRowsAndIndexInStep() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> stores = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                stores.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        // Every fifth store repeats shared content, so merges race with inserts.
                        String content = i % 5 == 0
                                ? BACKOFF
                                : "worker " + thread + " step " + i + " handles case " + (thread * 100 + i);
                        bank.storePattern(content, 0.8, "agent-1", "net");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> store : stores) {
                store.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> rowIds = new HashSet<>();
        for (Pattern pattern : bank.patternsInScope("agent-1", "net")) {
            rowIds.add(pattern.id());
        }
        assertFalse(rowIds.isEmpty());
        assertEquals(rowIds, bank.indexedIds("agent-1", "net"));
        long usage = bank.patternsInScope("agent-1", "net").stream().mapToLong(Pattern::usageCount).sum();
        assertEquals(threads * perThread, usage);
    }
}
