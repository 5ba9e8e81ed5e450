package io.hivememory.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.AccessControl;
import io.hivememory.acl.AccessLevel;
import io.hivememory.acl.AccessScope;
import io.hivememory.acl.Acl;
import io.hivememory.acl.AclStore;
import io.hivememory.acl.Permission;
import io.hivememory.acl.Requester;
import io.hivememory.config.MemoryProperties;
import io.hivememory.core.EntryRef;
import io.hivememory.core.Expiry;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * SQLite-backed shared memory.
 *
 * <p>Schema: {@code memory_entries} keyed by (key, partition), ACLs in {@code memory_acl}.
 * Every successful local write is recorded in the context's modification tracker inside
 * its transaction, so the sync transport never sees a committed row without its
 * timestamp.</p>
 */
@Component
public class SQLiteSharedMemory implements SharedMemory {

    private static final Logger log = LoggerFactory.getLogger(SQLiteSharedMemory.class);
    private static final String COLUMNS = """
            key, partition, value, owner, access_level, team_id, swarm_id, ttl_seconds, expires_at,
            created_at, updated_at, last_modified, origin_node""";

    private final MemoryContext context;
    private final AclStore aclStore;
    private final AccessControl accessControl = new AccessControl();
    private final long defaultTtlSeconds;

    public SQLiteSharedMemory(MemoryContext context, AclStore aclStore, MemoryProperties properties) {
        this.context = context;
        this.aclStore = aclStore;
        this.defaultTtlSeconds = properties.ttl().shared();
    }

    @Override
    public MemoryEntry store(String key, Object value, StoreOptions options) {
        requireText(key, "key");
        requireText(options.owner(), "owner");
        long ttlSeconds = options.ttlSeconds() != null ? options.ttlSeconds() : defaultTtlSeconds;
        if (ttlSeconds < 0) {
            throw new ValidationException("ttlSeconds must be >= 0, got " + ttlSeconds);
        }
        AccessScope requestedScope = AccessScope.of(options.accessLevel(), options.teamId(), options.swarmId());
        JsonNode payload = context.toTree(value);
        String json = context.toJson(payload);
        String partition = options.partition();

        MemoryEntry stored = context.database().write(conn -> {
            long now = context.now();
            Optional<MemoryEntry> existing = selectEntry(conn, key, partition)
                    .filter(e -> !e.isExpired(now));

            String owner = options.owner();
            AccessScope scope = requestedScope;
            long createdAt = now;
            if (existing.isPresent()) {
                MemoryEntry current = existing.get();
                createdAt = current.createdAt();
                if (!current.owner().equals(options.owner())) {
                    Requester writer = new Requester(options.owner(), options.teamId(), options.swarmId(), false);
                    accessControl.require(writer, current.ref().resourceId(), current.owner(), current.scope(),
                            aclStore.getAcl(current.ref().resourceId()).orElse(null), Permission.WRITE);
                    owner = current.owner();
                    scope = current.scope();
                }
            } else {
                // A new lifetime of the key: grants and blocks of an expired predecessor do not carry over.
                aclStore.deleteAcl(new EntryRef(partition, key).resourceId());
            }

            var entry = new MemoryEntry(key, partition, payload, owner, scope, ttlSeconds,
                    Expiry.expiresAt(now, ttlSeconds), createdAt, now, now, context.nodeId());
            upsert(conn, entry, json);
            context.modificationTracker().record(partition, key, entry.lastModified());
            return entry;
        });

        log.debug("Stored entry '{}' (owner={}, access={}, ttl={}s)",
                stored.ref(), stored.owner(), stored.accessLevel().tag(), ttlSeconds);
        return stored;
    }

    @Override
    public Optional<JsonNode> retrieve(String key, String partition, Requester requester) {
        return retrieveEntry(key, partition, requester).map(MemoryEntry::value);
    }

    @Override
    public Optional<MemoryEntry> retrieveEntry(String key, String partition, Requester requester) {
        Optional<MemoryEntry> entry = getEntry(key, partition);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        MemoryEntry found = entry.get();
        String resourceId = found.ref().resourceId();
        accessControl.require(requester, resourceId, found.owner(), found.scope(),
                aclStore.getAcl(resourceId).orElse(null), Permission.READ);
        return entry;
    }

    @Override
    public List<MemoryEntry> query(String keyPattern, String partition, Requester requester) {
        String resolvedPartition = partitionOrDefault(partition);
        List<MemoryEntry> rows = context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM memory_entries"
                    + " WHERE partition = ? AND key LIKE ? AND " + Expiry.LIVE + " ORDER BY key")) {
                stmt.setString(1, resolvedPartition);
                stmt.setString(2, keyPattern);
                stmt.setLong(3, context.now());
                return readEntries(stmt.executeQuery());
            }
        });

        List<MemoryEntry> visible = new ArrayList<>();
        for (MemoryEntry row : rows) {
            Acl acl = aclStore.getAcl(row.ref().resourceId()).orElse(null);
            if (accessControl.check(requester, row.owner(), row.scope(), acl, Permission.READ).allowed()) {
                visible.add(row);
            }
        }
        return visible;
    }

    @Override
    public boolean delete(String key, String partition, Requester requester) {
        String resolvedPartition = partitionOrDefault(partition);
        boolean deleted = context.database().write(conn -> {
            Optional<MemoryEntry> existing = selectEntry(conn, key, resolvedPartition);
            if (existing.isEmpty()) {
                return false;
            }
            MemoryEntry entry = existing.get();
            String resourceId = entry.ref().resourceId();
            accessControl.require(requester, resourceId, entry.owner(), entry.scope(),
                    aclStore.getAcl(resourceId).orElse(null), Permission.DELETE);
            try (var stmt = conn.prepareStatement("DELETE FROM memory_entries WHERE key = ? AND partition = ?")) {
                stmt.setString(1, key);
                stmt.setString(2, resolvedPartition);
                stmt.executeUpdate();
            }
            aclStore.deleteAcl(resourceId);
            context.modificationTracker().forget(resolvedPartition, key);
            return true;
        });
        if (deleted) {
            log.debug("Deleted entry '{}:{}'", resolvedPartition, key);
        }
        return deleted;
    }

    @Override
    public int clear(String partition) {
        String resolvedPartition = partitionOrDefault(partition);
        int removed = context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("DELETE FROM memory_entries WHERE partition = ?")) {
                stmt.setString(1, resolvedPartition);
                return stmt.executeUpdate();
            }
        });
        aclStore.deleteOrphans();
        log.info("Cleared {} entries from partition '{}'", removed, resolvedPartition);
        return removed;
    }

    @Override
    public Acl grantPermission(String key, String partition, Requester requester, String agentId,
                               Set<Permission> permissions) {
        requireText(agentId, "agentId");
        return changeAcl(key, partition, requester, acl -> acl.withGrant(agentId, permissions, context.now()));
    }

    @Override
    public Acl revokePermission(String key, String partition, Requester requester, String agentId,
                                Set<Permission> permissions) {
        return changeAcl(key, partition, requester, acl -> acl.withoutGrant(agentId, permissions, context.now()));
    }

    @Override
    public Acl blockAgent(String key, String partition, Requester requester, String agentId) {
        requireText(agentId, "agentId");
        return changeAcl(key, partition, requester, acl -> acl.withBlocked(agentId, context.now()));
    }

    @Override
    public Acl unblockAgent(String key, String partition, Requester requester, String agentId) {
        return changeAcl(key, partition, requester, acl -> acl.withoutBlocked(agentId, context.now()));
    }

    @Override
    public Optional<MemoryEntry> getEntry(String key, String partition) {
        String resolvedPartition = partitionOrDefault(partition);
        long now = context.now();
        return context.database().read(conn -> selectEntry(conn, key, resolvedPartition))
                .filter(e -> !e.isExpired(now));
    }

    @Override
    public List<MemoryEntry> getModifiedEntries(long since, String partition) {
        return context.database().read(conn -> {
            String sql = "SELECT " + COLUMNS + " FROM memory_entries WHERE last_modified > ?"
                    + (partition != null ? " AND partition = ?" : "")
                    + " ORDER BY last_modified ASC";
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setLong(1, since);
                if (partition != null) {
                    stmt.setString(2, partition);
                }
                return readEntries(stmt.executeQuery());
            }
        });
    }

    @Override
    public Optional<Long> getLastModified(String key, String partition) {
        return Optional.ofNullable(context.modificationTracker().get(partitionOrDefault(partition), key));
    }

    @Override
    public boolean applyRemote(MemoryEntry entry) {
        if (entry.isExpired(context.now())) {
            return false;
        }
        boolean applied = context.database().write(conn -> {
            Optional<MemoryEntry> local = selectEntry(conn, entry.key(), entry.partition());
            if (local.isPresent() && !remoteWins(entry, local.get())) {
                return false;
            }
            if (local.isEmpty() || !local.get().owner().equals(entry.owner())) {
                aclStore.deleteAcl(entry.ref().resourceId());
            }
            upsert(conn, entry, context.toJson(entry.value()));
            return true;
        });
        if (applied) {
            log.debug("Applied replicated entry '{}' from {}", entry.ref(), entry.originNode());
        }
        return applied;
    }

    @Override
    public long count() {
        return context.database().read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM memory_entries")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    @Override
    public MemoryStats stats() {
        return context.database().read(conn -> {
            List<String> partitions = new ArrayList<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT DISTINCT partition FROM memory_entries ORDER BY partition")) {
                while (rs.next()) {
                    partitions.add(rs.getString(1));
                }
            }
            Map<String, Long> accessLevels = new LinkedHashMap<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery(
                         "SELECT access_level, COUNT(*) FROM memory_entries GROUP BY access_level ORDER BY access_level")) {
                while (rs.next()) {
                    accessLevels.put(rs.getString(1), rs.getLong(2));
                }
            }
            return new MemoryStats(
                    countRows(conn, "memory_entries"),
                    countRows(conn, "hints"),
                    countRows(conn, "events"),
                    countRows(conn, "workflow_state"),
                    countRows(conn, "patterns"),
                    countRows(conn, "learning_experiences"),
                    countRows(conn, "q_values"),
                    countRows(conn, "learning_history"),
                    partitions,
                    accessLevels);
        });
    }

    @Override
    public boolean healthCheck() {
        return context.database().healthCheck();
    }

    /**
     * Later {@code lastModified} wins; on a tie the larger origin node id wins so that
     * every node resolves the same way.
     */
    static boolean remoteWins(MemoryEntry remote, MemoryEntry local) {
        if (remote.lastModified() != local.lastModified()) {
            return remote.lastModified() > local.lastModified();
        }
        String remoteNode = remote.originNode() == null ? "" : remote.originNode();
        String localNode = local.originNode() == null ? "" : local.originNode();
        return remoteNode.compareTo(localNode) > 0;
    }

    private Acl changeAcl(String key, String partition, Requester requester,
                          UnaryOperator<Acl> change) {
        String resolvedPartition = partitionOrDefault(partition);
        return context.database().write(conn -> {
            MemoryEntry entry = getEntry(key, resolvedPartition)
                    .orElseThrow(() -> new NotFoundException(
                            "Entry not found: " + resolvedPartition + ":" + key));
            String resourceId = entry.ref().resourceId();
            Acl acl = aclStore.getAcl(resourceId)
                    .orElseGet(() -> Acl.create(resourceId, entry.owner(), entry.scope(), context.now()));
            accessControl.require(requester, resourceId, entry.owner(), entry.scope(), acl, Permission.SHARE);
            Acl updated = change.apply(acl);
            aclStore.storeAcl(updated);
            log.info("ACL of '{}' changed by {}", resourceId, requester.agentId());
            return updated;
        });
    }

    private void upsert(Connection conn, MemoryEntry entry, String json) throws SQLException {
        try (var stmt = conn.prepareStatement("INSERT OR REPLACE INTO memory_entries (" + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, entry.key());
            stmt.setString(2, entry.partition());
            stmt.setString(3, json);
            stmt.setString(4, entry.owner());
            stmt.setString(5, entry.accessLevel().tag());
            stmt.setString(6, entry.scope().teamId());
            stmt.setString(7, entry.scope().swarmId());
            stmt.setLong(8, entry.ttlSeconds());
            stmt.setLong(9, entry.expiresAt());
            stmt.setLong(10, entry.createdAt());
            stmt.setLong(11, entry.updatedAt());
            stmt.setLong(12, entry.lastModified());
            stmt.setString(13, entry.originNode());
            stmt.executeUpdate();
        }
    }

    private Optional<MemoryEntry> selectEntry(Connection conn, String key, String partition) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM memory_entries WHERE key = ? AND partition = ?")) {
            stmt.setString(1, key);
            stmt.setString(2, partition);
            List<MemoryEntry> rows = readEntries(stmt.executeQuery());
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<MemoryEntry> readEntries(ResultSet rs) throws SQLException {
        List<MemoryEntry> entries = new ArrayList<>();
        try (rs) {
            while (rs.next()) {
                entries.add(new MemoryEntry(
                        rs.getString("key"),
                        rs.getString("partition"),
                        context.readJson(rs.getString("value")),
                        rs.getString("owner"),
                        AccessScope.of(AccessLevel.fromTag(rs.getString("access_level")),
                                rs.getString("team_id"), rs.getString("swarm_id")),
                        rs.getLong("ttl_seconds"),
                        rs.getLong("expires_at"),
                        rs.getLong("created_at"),
                        rs.getLong("updated_at"),
                        rs.getLong("last_modified"),
                        rs.getString("origin_node")));
            }
        }
        return entries;
    }

    private static long countRows(Connection conn, String table) throws SQLException {
        try (var check = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            check.setString(1, table);
            try (var rs = check.executeQuery()) {
                if (!rs.next()) {
                    return 0;
                }
            }
        }
        try (var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private static String partitionOrDefault(String partition) {
        return partition == null || partition.isBlank() ? StoreOptions.DEFAULT_PARTITION : partition;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
