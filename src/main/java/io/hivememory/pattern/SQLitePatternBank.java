package io.hivememory.pattern;

import io.hivememory.config.MemoryProperties;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.ValidationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Pattern bank over the {@code patterns} table with one in-memory HNSW index per
 * (agentId, domain) scope.
 *
 * <p>Row writes and index writes happen together under one lock, so the index never
 * holds an id without a row or the other way round. Indexes are rebuilt from the table
 * on {@link #init()}.</p>
 */
@Component
public class SQLitePatternBank implements PatternBank {

    private static final Logger log = LoggerFactory.getLogger(SQLitePatternBank.class);
    private static final String COLUMNS = """
            id, content, embedding, confidence, usage_count, success_rate, agent_id, domain, created_at, updated_at""";
    private static final String ORDER_BY_QUALITY = " ORDER BY success_rate IS NULL, success_rate DESC, confidence DESC, id";

    private final MemoryContext context;
    private final MemoryProperties.Patterns config;
    private final PatternEmbedder embedder;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, HnswIndex> indexes = new HashMap<>();

    public SQLitePatternBank(MemoryContext context, MemoryProperties properties) {
        this.context = context;
        this.config = properties.patterns();
        this.embedder = new PatternEmbedder(config.dimension());
    }

    @PostConstruct
    public void init() {
        withLock(() -> {
            context.database().ensureTable(SchemaTable.PATTERNS);
            indexes.clear();
            List<Pattern> all = context.database().read(conn -> {
                try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM patterns ORDER BY created_at, id")) {
                    return readPatterns(stmt.executeQuery());
                }
            });
            for (Pattern pattern : all) {
                indexFor(pattern.scopeKey()).add(pattern.id(), pattern.embedding());
            }
            log.info("Pattern index rebuilt: {} patterns in {} scopes", all.size(), indexes.size());
            return null;
        });
    }

    @Override
    public PatternStoreResult storePattern(String content, double confidence, String agentId, String domain,
                                           Double successRate) {
        requireUnitInterval(confidence, "confidence");
        if (successRate != null) {
            requireUnitInterval(successRate, "successRate");
        }
        float[] embedding = embedder.embed(content);
        String scopeKey = Pattern.scopeKey(agentId, domain);

        return withLock(() -> {
            context.database().ensureTable(SchemaTable.PATTERNS);
            HnswIndex index = indexFor(scopeKey);
            List<HnswIndex.Neighbor> nearest = index.search(embedding, 1, config.efSearch());
            long now = context.now();

            if (!nearest.isEmpty() && nearest.get(0).similarity() >= config.similarityThreshold()) {
                Optional<Pattern> existing = getPattern(nearest.get(0).id());
                if (existing.isPresent()) {
                    Pattern merged = mergeInto(existing.get(), confidence, successRate, now);
                    context.database().write(conn -> {
                        update(conn, merged);
                        return null;
                    });
                    log.debug("Merged pattern into {} (similarity {}, usage {})",
                            merged.id(), nearest.get(0).similarity(), merged.usageCount());
                    return new PatternStoreResult(merged, true);
                }
            }

            var pattern = new Pattern(UUID.randomUUID().toString(), content, embedding, confidence, 1,
                    successRate, agentId, domain, now, now);
            context.database().write(conn -> {
                insert(conn, pattern);
                return null;
            });
            index.add(pattern.id(), embedding);
            log.debug("Stored pattern {} (agent={}, domain={})", pattern.id(), agentId, domain);
            return new PatternStoreResult(pattern, false);
        });
    }

    @Override
    public List<Pattern> queryPatternsByDomain(String domain) {
        return queryBy("domain", domain);
    }

    @Override
    public List<Pattern> queryPatternsByAgent(String agentId) {
        return queryBy("agent_id", agentId);
    }

    @Override
    public List<PatternMatch> searchSimilar(String content, int k, String agentId, String domain) {
        float[] query = embedder.embed(content);
        return withLock(() -> {
            HnswIndex index = indexes.get(Pattern.scopeKey(agentId, domain));
            List<PatternMatch> matches = new ArrayList<>();
            if (index == null) {
                return matches;
            }
            for (HnswIndex.Neighbor neighbor : index.search(query, k, config.efSearch())) {
                getPattern(neighbor.id()).ifPresent(p -> matches.add(new PatternMatch(p, neighbor.similarity())));
            }
            return matches;
        });
    }

    @Override
    public Optional<Pattern> getPattern(String id) {
        context.database().ensureTable(SchemaTable.PATTERNS);
        return context.database().read(conn -> selectPattern(conn, id));
    }

    @Override
    public Optional<Pattern> recordOutcome(String id, boolean success) {
        return withLock(() -> getPattern(id).map(p -> {
            double outcome = success ? 1.0 : 0.0;
            double rate = p.successRate() == null
                    ? outcome
                    : (p.successRate() * p.usageCount() + outcome) / (p.usageCount() + 1);
            var updated = new Pattern(p.id(), p.content(), p.embedding(), p.confidence(), p.usageCount() + 1,
                    rate, p.agentId(), p.domain(), p.createdAt(), context.now());
            context.database().write(conn -> {
                update(conn, updated);
                return null;
            });
            return updated;
        }));
    }

    @Override
    public boolean deletePattern(String id) {
        return withLock(() -> {
            Optional<Pattern> existing = getPattern(id);
            if (existing.isEmpty()) {
                return false;
            }
            context.database().write(conn -> deleteRow(conn, id));
            HnswIndex index = indexes.get(existing.get().scopeKey());
            if (index != null) {
                index.remove(id);
            }
            return true;
        });
    }

    @Override
    public long countPatterns() {
        context.database().ensureTable(SchemaTable.PATTERNS);
        return context.database().read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM patterns")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    /**
     * Distinct (agentId, domain) scopes that hold patterns, as {@code [agentId, domain]} pairs.
     */
    List<String[]> listScopes() {
        context.database().ensureTable(SchemaTable.PATTERNS);
        return context.database().read(conn -> {
            List<String[]> scopes = new ArrayList<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT DISTINCT agent_id, domain FROM patterns")) {
                while (rs.next()) {
                    scopes.add(new String[]{rs.getString(1), rs.getString(2)});
                }
            }
            return scopes;
        });
    }

    List<Pattern> patternsInScope(String agentId, String domain) {
        context.database().ensureTable(SchemaTable.PATTERNS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM patterns"
                    + " WHERE agent_id IS ? AND domain IS ? ORDER BY created_at, id")) {
                stmt.setString(1, agentId);
                stmt.setString(2, domain);
                return readPatterns(stmt.executeQuery());
            }
        });
    }

    /**
     * Folds {@code memberIds} into {@code representativeId} and deletes them, as one
     * locked transaction. Rows that disappeared since the cluster was computed are
     * skipped.
     *
     * @return number of members merged, 0 if the representative is gone
     */
    int mergeCluster(String representativeId, List<String> memberIds) {
        return withLock(() -> {
            Optional<Pattern> representative = getPattern(representativeId);
            if (representative.isEmpty()) {
                return 0;
            }
            List<Pattern> members = new ArrayList<>();
            for (String id : memberIds) {
                getPattern(id).ifPresent(members::add);
            }
            if (members.isEmpty()) {
                return 0;
            }
            Pattern merged = aggregate(representative.get(), members, context.now());
            context.database().write(conn -> {
                update(conn, merged);
                for (Pattern member : members) {
                    deleteRow(conn, member.id());
                }
                return null;
            });
            HnswIndex index = indexFor(merged.scopeKey());
            for (Pattern member : members) {
                index.remove(member.id());
            }
            return members.size();
        });
    }

    /**
     * Usage-weighted merge of a single new observation into {@code existing}.
     */
    static Pattern mergeInto(Pattern existing, double confidence, Double successRate, long now) {
        long usage = existing.usageCount();
        double mergedConfidence = (existing.confidence() * usage + confidence) / (usage + 1);
        Double mergedRate = existing.successRate();
        if (successRate != null) {
            mergedRate = existing.successRate() == null
                    ? successRate
                    : (existing.successRate() * usage + successRate) / (usage + 1);
        }
        return new Pattern(existing.id(), existing.content(), existing.embedding(), mergedConfidence, usage + 1,
                mergedRate, existing.agentId(), existing.domain(), existing.createdAt(), now);
    }

    /**
     * Usage-weighted aggregate of a representative and its cluster members. The
     * representative keeps its id, content and embedding.
     */
    static Pattern aggregate(Pattern representative, List<Pattern> members, long now) {
        long usage = representative.usageCount();
        double confidenceSum = representative.confidence() * representative.usageCount();
        double rateSum = 0;
        long rateWeight = 0;
        if (representative.successRate() != null) {
            rateSum += representative.successRate() * representative.usageCount();
            rateWeight += representative.usageCount();
        }
        for (Pattern member : members) {
            usage += member.usageCount();
            confidenceSum += member.confidence() * member.usageCount();
            if (member.successRate() != null) {
                rateSum += member.successRate() * member.usageCount();
                rateWeight += member.usageCount();
            }
        }
        Double rate = rateWeight == 0 ? null : rateSum / rateWeight;
        return new Pattern(representative.id(), representative.content(), representative.embedding(),
                confidenceSum / usage, usage, rate, representative.agentId(), representative.domain(),
                representative.createdAt(), now);
    }

    /**
     * Ids held by the index of a scope.
     */
    Set<String> indexedIds(String agentId, String domain) {
        return withLock(() -> {
            HnswIndex index = indexes.get(Pattern.scopeKey(agentId, domain));
            return index == null ? Set.<String>of() : index.ids();
        });
    }

    double similarityThreshold() {
        return config.similarityThreshold();
    }

    private <T> T withLock(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private HnswIndex indexFor(String scopeKey) {
        return indexes.computeIfAbsent(scopeKey,
                k -> new HnswIndex(embedder.dimension(), config.maxConnections(), config.efConstruction()));
    }

    private List<Pattern> queryBy(String column, String value) {
        context.database().ensureTable(SchemaTable.PATTERNS);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM patterns WHERE " + column + " = ?"
                    + ORDER_BY_QUALITY)) {
                stmt.setString(1, value);
                return readPatterns(stmt.executeQuery());
            }
        });
    }

    private void insert(Connection conn, Pattern p) throws SQLException {
        try (var stmt = conn.prepareStatement("INSERT INTO patterns (" + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, p.id());
            stmt.setString(2, p.content());
            stmt.setBytes(3, toBytes(p.embedding()));
            stmt.setDouble(4, p.confidence());
            stmt.setLong(5, p.usageCount());
            setNullableDouble(stmt, 6, p.successRate());
            stmt.setString(7, p.agentId());
            stmt.setString(8, p.domain());
            stmt.setLong(9, p.createdAt());
            stmt.setLong(10, p.updatedAt());
            stmt.executeUpdate();
        }
    }

    private void update(Connection conn, Pattern p) throws SQLException {
        try (var stmt = conn.prepareStatement("""
                UPDATE patterns SET confidence = ?, usage_count = ?, success_rate = ?, updated_at = ?
                WHERE id = ?
                """)) {
            stmt.setDouble(1, p.confidence());
            stmt.setLong(2, p.usageCount());
            setNullableDouble(stmt, 3, p.successRate());
            stmt.setLong(4, p.updatedAt());
            stmt.setString(5, p.id());
            stmt.executeUpdate();
        }
    }

    private static boolean deleteRow(Connection conn, String id) throws SQLException {
        try (var stmt = conn.prepareStatement("DELETE FROM patterns WHERE id = ?")) {
            stmt.setString(1, id);
            return stmt.executeUpdate() > 0;
        }
    }

    private Optional<Pattern> selectPattern(Connection conn, String id) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM patterns WHERE id = ?")) {
            stmt.setString(1, id);
            List<Pattern> rows = readPatterns(stmt.executeQuery());
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<Pattern> readPatterns(ResultSet rs) throws SQLException {
        List<Pattern> patterns = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                String content = rs.getString("content");
                float[] embedding = fromBytes(rs.getBytes("embedding"));
                if (embedding.length != embedder.dimension()) {
                    embedding = embedder.embed(content);
                }
                double rate = rs.getDouble("success_rate");
                Double successRate = rs.wasNull() ? null : rate;
                patterns.add(new Pattern(
                        rs.getString("id"),
                        content,
                        embedding,
                        rs.getDouble("confidence"),
                        rs.getLong("usage_count"),
                        successRate,
                        rs.getString("agent_id"),
                        rs.getString("domain"),
                        rs.getLong("created_at"),
                        rs.getLong("updated_at")));
            }
        }
        return patterns;
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value)
            throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    static float[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    private static void requireUnitInterval(double value, String field) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new ValidationException(field + " must be within [0, 1], got " + value);
        }
    }
}
