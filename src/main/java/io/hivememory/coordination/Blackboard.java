package io.hivememory.coordination;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.config.MemoryProperties;
import io.hivememory.core.Expiry;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.ValidationException;
import io.hivememory.memory.StoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared hint board. Agents post hints to a partition and read them back by key
 * pattern; there is no per-hint owner or ACL.
 */
@Component
public class Blackboard {

    private static final Logger log = LoggerFactory.getLogger(Blackboard.class);

    private final MemoryContext context;
    private final long defaultTtlSeconds;

    public Blackboard(MemoryContext context, MemoryProperties properties) {
        this.context = context;
        this.defaultTtlSeconds = properties.ttl().hints();
    }

    /**
     * Posts a hint.
     *
     * @param ttlSeconds time to live, null for the configured default, 0 for never
     */
    public Hint postHint(String partition, String key, Object value, Long ttlSeconds) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("hint key is required");
        }
        String resolvedPartition = partition == null || partition.isBlank() ? StoreOptions.DEFAULT_PARTITION : partition;
        long ttl = ttlSeconds == null ? defaultTtlSeconds : ttlSeconds;
        long now = context.now();
        long expiresAt = Expiry.expiresAt(now, ttl);
        JsonNode payload = context.toTree(value);
        String json = context.toJson(payload);

        context.database().ensureTable(SchemaTable.HINTS);
        long id = context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    INSERT INTO hints (partition, key, value, created_at, expires_at) VALUES (?, ?, ?, ?, ?)
                    """, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setString(1, resolvedPartition);
                stmt.setString(2, key);
                stmt.setString(3, json);
                stmt.setLong(4, now);
                stmt.setLong(5, expiresAt);
                stmt.executeUpdate();
                try (var keys = stmt.getGeneratedKeys()) {
                    return keys.next() ? keys.getLong(1) : 0L;
                }
            }
        });
        log.debug("Hint {} posted to {}:{}", id, resolvedPartition, key);
        return new Hint(id, resolvedPartition, key, payload, now, expiresAt);
    }

    /**
     * Live hints of a partition whose key matches {@code keyPattern} ({@code *} matches
     * any run of characters), newest first.
     */
    public List<Hint> readHints(String partition, String keyPattern) {
        String resolvedPartition = partition == null || partition.isBlank() ? StoreOptions.DEFAULT_PARTITION : partition;
        String like = toLike(keyPattern == null ? "*" : keyPattern);
        context.database().ensureTable(SchemaTable.HINTS);
        return context.database().read(conn -> {
            List<Hint> hints = new ArrayList<>();
            try (var stmt = conn.prepareStatement("SELECT id, partition, key, value, created_at, expires_at FROM hints"
                    + " WHERE partition = ? AND key LIKE ? ESCAPE '\\' AND " + Expiry.LIVE
                    + " ORDER BY created_at DESC, id DESC")) {
                stmt.setString(1, resolvedPartition);
                stmt.setString(2, like);
                stmt.setLong(3, context.now());
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        hints.add(new Hint(
                                rs.getLong("id"),
                                rs.getString("partition"),
                                rs.getString("key"),
                                context.readJson(rs.getString("value")),
                                rs.getLong("created_at"),
                                rs.getLong("expires_at")));
                    }
                }
            }
            return hints;
        });
    }

    static String toLike(String pattern) {
        StringBuilder like = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case '*' -> like.append('%');
                case '%', '_', '\\' -> like.append('\\').append(c);
                default -> like.append(c);
            }
        }
        return like.toString();
    }
}
