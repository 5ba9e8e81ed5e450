package io.hivememory.config;

import io.hivememory.learning.RateSchedule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration of the memory engine.
 *
 * <p>Binds to {@code hivememory} in application.yml:</p>
 * <pre>
 * hivememory:
 *   path: ./data/memory
 *   ttl:
 *     shared: 1800
 *     hints: 3600
 *   learning:
 *     learning-rate: 0.1
 *     discount-factor: 0.95
 *     update-frequency: 10
 *   patterns:
 *     similarity-threshold: 0.85
 *   maintenance:
 *     sweep-interval: PT5M
 *     consolidation-cron: "0 3 * * *"
 *   sync:
 *     enabled: false
 *     port: 8080
 *     peers:
 *       - 10.0.0.2:8080
 * </pre>
 */
@ConfigurationProperties(prefix = "hivememory")
public record MemoryProperties(
        String path,
        Ttl ttl,
        Learning learning,
        Patterns patterns,
        Maintenance maintenance,
        Sync sync
) {

    public MemoryProperties {
        if (path == null || path.isBlank()) {
            path = "./data/memory";
        }
        if (ttl == null) {
            ttl = new Ttl(null, null);
        }
        if (learning == null) {
            learning = new Learning(null, null, null, null, null);
        }
        if (patterns == null) {
            patterns = new Patterns(null, null, null, null, null);
        }
        if (maintenance == null) {
            maintenance = new Maintenance(null, null, null, null);
        }
        if (sync == null) {
            sync = new Sync(null, null, null, null, null, null, null, null, null);
        }
    }

    /**
     * All defaults, for tests and embedded use.
     */
    public static MemoryProperties defaults() {
        return new MemoryProperties(null, null, null, null, null, null);
    }

    /**
     * Default TTLs in seconds for callers that do not pass one. 0 means never expires.
     *
     * @param shared memory entries
     * @param hints  blackboard hints
     */
    public record Ttl(Long shared, Long hints) {
        public Ttl {
            if (shared == null || shared < 0) {
                shared = 1800L;
            }
            if (hints == null || hints < 0) {
                hints = 3600L;
            }
        }
    }

    /**
     * Q-learning parameters.
     *
     * @param learningRate    alpha, used by the CONSTANT schedule
     * @param discountFactor  gamma
     * @param explorationRate epsilon for epsilon-greedy action selection
     * @param updateFrequency experiences per learning snapshot
     * @param rateSchedule    how alpha evolves with the visit count
     */
    public record Learning(
            Double learningRate,
            Double discountFactor,
            Double explorationRate,
            Integer updateFrequency,
            RateSchedule rateSchedule
    ) {
        public Learning {
            if (learningRate == null || learningRate <= 0 || learningRate > 1) {
                learningRate = 0.1;
            }
            if (discountFactor == null || discountFactor < 0 || discountFactor > 1) {
                discountFactor = 0.95;
            }
            if (explorationRate == null || explorationRate < 0 || explorationRate > 1) {
                explorationRate = 0.3;
            }
            if (updateFrequency == null || updateFrequency <= 0) {
                updateFrequency = 10;
            }
            if (rateSchedule == null) {
                rateSchedule = RateSchedule.CONSTANT;
            }
        }
    }

    /**
     * Pattern bank embedding and ANN index parameters.
     *
     * @param dimension           embedding dimension
     * @param similarityThreshold cosine similarity at or above which patterns merge
     * @param maxConnections      HNSW neighbours per node and layer (M)
     * @param efConstruction      beam width while inserting
     * @param efSearch            beam width while searching
     */
    public record Patterns(
            Integer dimension,
            Double similarityThreshold,
            Integer maxConnections,
            Integer efConstruction,
            Integer efSearch
    ) {
        public Patterns {
            if (dimension == null || dimension < 8) {
                dimension = 256;
            }
            if (similarityThreshold == null || similarityThreshold <= 0 || similarityThreshold > 1) {
                similarityThreshold = 0.85;
            }
            if (maxConnections == null || maxConnections < 2) {
                maxConnections = 16;
            }
            if (efConstruction == null || efConstruction < maxConnections) {
                efConstruction = 100;
            }
            if (efSearch == null || efSearch < 1) {
                efSearch = 50;
            }
        }
    }

    /**
     * Background maintenance jobs.
     *
     * @param enabled           whether the recurring jobs are registered
     * @param sweepInterval     TTL sweep period
     * @param consolidationCron pattern consolidation schedule
     * @param sweepBatchSize    rows removed per locked batch
     */
    public record Maintenance(
            Boolean enabled,
            Duration sweepInterval,
            String consolidationCron,
            Integer sweepBatchSize
    ) {
        public Maintenance {
            if (enabled == null) {
                enabled = true;
            }
            if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
                sweepInterval = Duration.ofMinutes(5);
            }
            if (consolidationCron == null || consolidationCron.isBlank()) {
                consolidationCron = "0 3 * * *";
            }
            if (sweepBatchSize == null || sweepBatchSize < 1) {
                sweepBatchSize = 500;
            }
        }
    }

    /**
     * Peer-to-peer sync. Disabled unless {@code enabled} is true.
     *
     * @param enabled          whether the transport starts with the application
     * @param nodeId           this node's id, used for last-writer-wins tie breaks
     * @param host             advertised host
     * @param port             advertised port
     * @param syncIntervalMs   tick period
     * @param maxPeers         upper bound on configured peers
     * @param connectTimeoutMs peer connect timeout
     * @param requestTimeoutMs peer request timeout
     * @param peers            initial peers as host:port
     */
    public record Sync(
            Boolean enabled,
            String nodeId,
            String host,
            Integer port,
            Long syncIntervalMs,
            Integer maxPeers,
            Long connectTimeoutMs,
            Long requestTimeoutMs,
            List<String> peers
    ) {
        public Sync {
            if (enabled == null) {
                enabled = false;
            }
            if (nodeId == null || nodeId.isBlank()) {
                nodeId = "node-local";
            }
            if (host == null || host.isBlank()) {
                host = "localhost";
            }
            if (port == null || port <= 0) {
                port = 8080;
            }
            if (syncIntervalMs == null || syncIntervalMs <= 0) {
                syncIntervalMs = 5000L;
            }
            if (maxPeers == null || maxPeers <= 0) {
                maxPeers = 10;
            }
            if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
                connectTimeoutMs = 2000L;
            }
            if (requestTimeoutMs == null || requestTimeoutMs <= 0) {
                requestTimeoutMs = 5000L;
            }
            if (peers == null) {
                peers = List.of();
            }
        }
    }
}
