package io.hivememory.config;

import io.hivememory.learning.RateSchedule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryPropertiesTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsShouldMatchDocumentedValues() {
        var props = MemoryProperties.defaults();

        assertEquals("./data/memory", props.path());
        assertEquals(1800L, props.ttl().shared());
        assertEquals(3600L, props.ttl().hints());
        assertEquals(0.1, props.learning().learningRate());
        assertEquals(0.95, props.learning().discountFactor());
        assertEquals(10, props.learning().updateFrequency());
        assertEquals(RateSchedule.CONSTANT, props.learning().rateSchedule());
        assertEquals(0.85, props.patterns().similarityThreshold());
        assertEquals(Duration.ofMinutes(5), props.maintenance().sweepInterval());
        assertFalse(props.sync().enabled());
        assertEquals(List.of(), props.sync().peers());
    }

    @Test
    void outOfRangeValuesShouldFallBackToDefaults() {
        var learning = new MemoryProperties.Learning(2.0, -1.0, 5.0, 0, null);
        var patterns = new MemoryProperties.Patterns(2, 0.0, 1, 1, 0);

        assertEquals(0.1, learning.learningRate());
        assertEquals(0.95, learning.discountFactor());
        assertEquals(0.3, learning.explorationRate());
        assertEquals(10, learning.updateFrequency());
        assertEquals(256, patterns.dimension());
        assertEquals(0.85, patterns.similarityThreshold());
        assertEquals(16, patterns.maxConnections());
    }

    @Test
    void shouldBindFromKebabCaseProperties() {
        var source = new MapConfigurationPropertySource(Map.of(
                "hivememory.path", "/var/hive",
                "hivememory.ttl.shared", "60",
                "hivememory.learning.rate-schedule", "sample_average",
                "hivememory.maintenance.sweep-interval", "PT30S",
                "hivememory.sync.enabled", "true",
                "hivememory.sync.node-id", "node-7",
                "hivememory.sync.peers[0]", "10.0.0.2:8080"));

        MemoryProperties props = new Binder(source).bind("hivememory", MemoryProperties.class).get();

        assertEquals("/var/hive", props.path());
        assertEquals(60L, props.ttl().shared());
        assertEquals(3600L, props.ttl().hints());
        assertEquals(RateSchedule.SAMPLE_AVERAGE, props.learning().rateSchedule());
        assertEquals(Duration.ofSeconds(30), props.maintenance().sweepInterval());
        assertTrue(props.sync().enabled());
        assertEquals("node-7", props.sync().nodeId());
        assertEquals(List.of("10.0.0.2:8080"), props.sync().peers());
    }

    @Test
    void jobStoreShouldDefaultToMemoryDirectory() {
        Path dir = tempDir.resolve("memory");

        String url = JobRunrConfig.defaultUrl(dir);

        assertEquals("jdbc:sqlite:" + dir.resolve("jobrunr.db"), url);
        assertTrue(Files.isDirectory(dir));
    }
}
