package io.hivememory.learning;

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
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteLearningStoreTest {

    private static final Map<String, Object> START = Map.of("position", 1);
    private static final Map<String, Object> DONE = Map.of("done", true);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryContext context;
    private SQLiteLearningStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(10_000);
        context = open();
        store = new SQLiteLearningStore(context, properties(0.5, 0.9, 0.0, RateSchedule.CONSTANT), new Random(1));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void shouldApplyTemporalDifferenceUpdate() {
        QValue terminal = store.recordExperience("agent-1", Map.of("s", 1), "go", 1.0, DONE).orElseThrow();
        assertEquals(0.5, terminal.value(), 1e-12);

        QValue chained = store.recordExperience("agent-1", Map.of("s", 0), "step", 0.0, Map.of("s", 1))
                .orElseThrow();
        assertEquals(0.5 * (0.9 * 0.5), chained.value(), 1e-12);

        QValue again = store.recordExperience("agent-1", Map.of("s", 1), "go", 1.0, DONE).orElseThrow();
        assertEquals(0.75, again.value(), 1e-12);
        assertEquals(2, again.updateCount());
        assertEquals(2, store.getQValue("agent-1", Map.of("s", 1), "go").orElseThrow().updateCount());
    }

    @Test
    void sampleAverageShouldNotDependOnOrder() {
        store = new SQLiteLearningStore(context, properties(0.1, 0.9, 0.0, RateSchedule.SAMPLE_AVERAGE),
                new Random(1));
        double[] rewards = {3.0, -1.0, 0.5, 7.25, 2.0};

        for (double reward : rewards) {
            store.recordExperience("forward", START, "act", reward, DONE);
        }
        for (int i = rewards.length - 1; i >= 0; i--) {
            store.recordExperience("backward", START, "act", rewards[i], DONE);
        }

        double forward = store.getQValue("forward", START, "act").orElseThrow().value();
        double backward = store.getQValue("backward", START, "act").orElseThrow().value();
        assertEquals(2.35, forward, 1e-12);
        assertEquals(forward, backward, 1e-12);
    }

    @Test
    void shouldPersistSnapshotEveryUpdateFrequencyExperiences() {
        for (int i = 0; i < 10; i++) {
            store.recordExperience("agent-1", START, "act", 1.0, DONE);
        }
        assertEquals(1, store.getLearningHistory("agent-1", 100).size());

        for (int i = 0; i < 15; i++) {
            store.recordExperience("agent-1", START, "act", 1.0, DONE);
        }
        List<LearningSnapshot> history = store.getLearningHistory("agent-1", 100);
        assertEquals(2, history.size());
        assertEquals(20, history.get(0).totalExperiences());
        assertEquals(SQLiteLearningStore.PERIODIC_SNAPSHOT, history.get(0).snapshotType());
        assertEquals(1.0, history.get(0).metrics().get("averageReward").asDouble(), 1e-12);
    }

    @Test
    void sessionCounterShouldRestartButPersistedCountShouldNot() {
        for (int i = 0; i < 3; i++) {
            store.recordExperience("agent-1", START, "act", 1.0, DONE);
        }
        assertEquals(3, store.getTotalExperiences("agent-1"));

        context.close();
        context = open();
        store = new SQLiteLearningStore(context, properties(0.5, 0.9, 0.0, RateSchedule.CONSTANT), new Random(1));

        assertEquals(0, store.getTotalExperiences("agent-1"));
        assertEquals(3, store.countExperiences("agent-1"));
    }

    @Test
    void shouldRestorePolicyAfterReopen() {
        store.recordExperience("agent-1", START, "left", 0.2, DONE);
        store.recordExperience("agent-1", START, "right", 0.8, DONE);
        context.close();

        context = open();
        store = new SQLiteLearningStore(context, properties(0.5, 0.9, 0.0, RateSchedule.CONSTANT), new Random(1));

        assertEquals(2, store.restore("agent-1"));
        StrategyRecommendation recommendation = store.recommendStrategy("agent-1", START).orElseThrow();
        assertEquals("right", recommendation.action());
        assertEquals(0.4, recommendation.expectedValue(), 1e-12);
        assertEquals(1, recommendation.alternatives());
    }

    @Test
    void recommendationShouldBeEmptyForUnknownState() {
        assertTrue(store.recommendStrategy("agent-1", Map.of("never", "seen")).isEmpty());
    }

    @Test
    void invalidExperienceShouldReturnEmptyWithoutThrowing() {
        assertTrue(store.recordExperience(" ", START, "act", 1.0, DONE).isEmpty());
        assertTrue(store.recordExperience("agent-1", START, null, 1.0, DONE).isEmpty());
        assertTrue(store.recordExperience("agent-1", START, "act", Double.NaN, DONE).isEmpty());
        assertEquals(0, store.countExperiences("agent-1"));
        assertEquals(0, store.getTotalExperiences("agent-1"));
    }

    @Test
    void greedySelectionShouldPickBestKnownAction() {
        store.recordExperience("agent-1", START, "b", 1.0, DONE);
        store.recordExperience("agent-1", START, "c", -1.0, DONE);

        assertEquals("b", store.selectAction("agent-1", START, List.of("a", "b", "c")));
        assertEquals("a", store.selectAction("agent-1", Map.of("other", 1), List.of("a", "b")));
    }

    @Test
    void fullExplorationShouldStayWithinCandidates() {
        store = new SQLiteLearningStore(context, properties(0.5, 0.9, 1.0, RateSchedule.CONSTANT), new Random(3));

        for (int i = 0; i < 20; i++) {
            assertTrue(List.of("x", "y").contains(store.selectAction("agent-1", START, List.of("x", "y"))));
        }
        assertThrows(ValidationException.class, () -> store.selectAction("agent-1", START, List.of()));
    }

    @Test
    void experiencesShouldBeNewestFirstWithFeatures() {
        store.recordExperience("agent-1", START, "first", 1.0, DONE);
        clock.advanceMillis(5);
        store.recordExperience("agent-1", START, "second", 2.0, DONE);

        List<LearningExperience> experiences = store.getExperiences("agent-1", 10);

        assertEquals("second", experiences.get(0).action());
        assertEquals(1, experiences.get(1).state().get("position"));
        assertEquals(1, store.getExperiences("agent-1", 1).size());
    }

    @Test
    void statisticsShouldAggregateRewards() {
        store.recordExperience("agent-1", START, "a", 1.0, DONE);
        store.recordExperience("agent-1", START, "b", 3.0, DONE);
        store.recordExperience("agent-1", Map.of("position", 2), "a", -1.0, DONE);

        LearningStatistics stats = store.getStatistics("agent-1");

        assertEquals(3, stats.totalExperiences());
        assertEquals(1.0, stats.averageReward(), 1e-12);
        assertEquals(3.0, stats.maxReward(), 1e-12);
        assertEquals(-1.0, stats.minReward(), 1e-12);
        assertEquals(2, stats.distinctActions());
        assertEquals(3, stats.qValueCount());
        assertEquals(3, stats.sessionExperiences());
    }

    @Test
    void resetShouldRemoveAgentState() {
        for (int i = 0; i < 10; i++) {
            store.recordExperience("agent-1", START, "act", 1.0, DONE);
        }
        store.recordExperience("agent-2", START, "act", 1.0, DONE);

        store.resetAgent("agent-1");

        assertEquals(0, store.countExperiences("agent-1"));
        assertEquals(0, store.getTotalExperiences("agent-1"));
        assertTrue(store.getLearningHistory("agent-1", 10).isEmpty());
        assertTrue(store.recommendStrategy("agent-1", START).isEmpty());
        assertEquals(1, store.countExperiences("agent-2"));
    }

    @Test
    void concurrentUpdatesOfOnePairShouldAllCountAndAgreeWithStoredValue() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                double reward = t % 2 == 0 ? 1.0 : -1.0;
                results.add(pool.submit(() -> {
                    start.await();
                    int recorded = 0;
                    for (int i = 0; i < perThread; i++) {
                        if (store.recordExperience("agent-1", START, "act", reward, DONE).isPresent()) {
                            recorded++;
                        }
                    }
                    return recorded;
                }));
            }
            start.countDown();
            int recorded = 0;
            for (Future<Integer> result : results) {
                recorded += result.get(30, TimeUnit.SECONDS);
            }
            assertEquals(threads * perThread, recorded);
        } finally {
            pool.shutdownNow();
        }

        QValue stored = store.getQValue("agent-1", START, "act").orElseThrow();
        StrategyRecommendation served = store.recommendStrategy("agent-1", START).orElseThrow();
        assertEquals(threads * perThread, stored.updateCount());
        assertEquals(threads * perThread, store.countExperiences("agent-1"));
        assertEquals(stored.value(), served.expectedValue(), 0.0);
        assertEquals(stored.updateCount(), served.visits());
    }

    @Test
    void restoreShouldNotLoseUpdatesRecordedMeanwhile() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 100; i++) {
                    store.recordExperience("agent-1", START, "act", 1.0, DONE);
                }
            });
            for (int i = 0; i < 20; i++) {
                store.restore("agent-1");
            }
            writer.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        QValue stored = store.getQValue("agent-1", START, "act").orElseThrow();
        StrategyRecommendation served = store.recommendStrategy("agent-1", START).orElseThrow();
        assertEquals(100, stored.updateCount());
        assertEquals(stored.value(), served.expectedValue(), 0.0);
    }

    private MemoryContext open() {
        return MemoryContext.open(tempDir.resolve("hive.db").toString(), clock, "node-a");
    }

    private static MemoryProperties properties(double rate, double discount, double exploration,
                                               RateSchedule schedule) {
        var defaults = MemoryProperties.defaults();
        return new MemoryProperties(defaults.path(), defaults.ttl(),
                new MemoryProperties.Learning(rate, discount, exploration, 10, schedule),
                defaults.patterns(), defaults.maintenance(), defaults.sync());
    }
}
