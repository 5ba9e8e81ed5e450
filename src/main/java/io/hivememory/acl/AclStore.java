package io.hivememory.acl;

import com.fasterxml.jackson.core.type.TypeReference;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Persists per-resource ACLs in {@code memory_acl}, with a read-through cache. The
 * cache is only filled and changed while the database lock is held.
 */
@Component
public class AclStore {

    private static final Logger log = LoggerFactory.getLogger(AclStore.class);
    private static final TypeReference<Map<String, List<String>>> GRANTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> BLOCKED_TYPE = new TypeReference<>() {
    };

    private final MemoryContext context;
    private final Map<String, Acl> cache = new ConcurrentHashMap<>();

    public AclStore(MemoryContext context) {
        this.context = context;
    }

    public void storeAcl(Acl acl) {
        context.database().ensureTable(SchemaTable.MEMORY_ACL);
        context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    INSERT OR REPLACE INTO memory_acl
                    (resource_id, owner, access_level, team_id, swarm_id, granted_permissions, blocked_agents,
                     created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, acl.resourceId());
                stmt.setString(2, acl.owner());
                stmt.setString(3, acl.scope().level().tag());
                stmt.setString(4, acl.scope().teamId());
                stmt.setString(5, acl.scope().swarmId());
                stmt.setString(6, acl.grantedPermissions().isEmpty() ? null : context.toJson(grantsToTags(acl)));
                stmt.setString(7, acl.blockedAgents().isEmpty() ? null : context.toJson(acl.blockedAgents()));
                stmt.setLong(8, acl.createdAt());
                stmt.setLong(9, acl.updatedAt());
                stmt.executeUpdate();
            }
            cache.put(acl.resourceId(), acl);
            return null;
        });
        log.debug("Stored ACL for '{}'", acl.resourceId());
    }

    public Optional<Acl> getAcl(String resourceId) {
        Acl cached = cache.get(resourceId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return context.database().read(conn -> {
            Acl current = cache.get(resourceId);
            if (current != null) {
                return Optional.of(current);
            }
            try (var stmt = conn.prepareStatement("SELECT * FROM memory_acl WHERE resource_id = ?")) {
                stmt.setString(1, resourceId);
                try (var rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Acl>empty();
                    }
                    Acl loaded = toAcl(rs);
                    cache.put(resourceId, loaded);
                    return Optional.of(loaded);
                }
            }
        });
    }

    public Acl requireAcl(String resourceId) {
        return getAcl(resourceId)
                .orElseThrow(() -> new NotFoundException("ACL not found for resource: " + resourceId));
    }

    public boolean deleteAcl(String resourceId) {
        return context.database().write(conn -> {
            cache.remove(resourceId);
            try (var stmt = conn.prepareStatement("DELETE FROM memory_acl WHERE resource_id = ?")) {
                stmt.setString(1, resourceId);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    /**
     * Removes ACL rows whose resource no longer exists in {@code memory_entries}.
     */
    public int deleteOrphans() {
        int removed = context.database().write(conn -> {
            try (var stmt = conn.prepareStatement("""
                    DELETE FROM memory_acl WHERE resource_id NOT IN
                        (SELECT partition || ':' || key FROM memory_entries)
                    """)) {
                int rows = stmt.executeUpdate();
                if (rows > 0) {
                    cache.clear();
                }
                return rows;
            }
        });
        return removed;
    }

    public Acl grantPermission(String resourceId, String agentId, Set<Permission> permissions) {
        return update(resourceId, acl -> acl.withGrant(agentId, permissions, context.now()));
    }

    public Acl revokePermission(String resourceId, String agentId, Set<Permission> permissions) {
        return update(resourceId, acl -> acl.withoutGrant(agentId, permissions, context.now()));
    }

    public Acl blockAgent(String resourceId, String agentId) {
        return update(resourceId, acl -> acl.withBlocked(agentId, context.now()));
    }

    public Acl unblockAgent(String resourceId, String agentId) {
        return update(resourceId, acl -> acl.withoutBlocked(agentId, context.now()));
    }

    /**
     * Applies {@code change} to the stored ACL as one read-modify-write.
     */
    public Acl update(String resourceId, UnaryOperator<Acl> change) {
        return context.database().write(conn -> {
            Acl updated = change.apply(requireAcl(resourceId));
            storeAcl(updated);
            return updated;
        });
    }

    private Map<String, List<String>> grantsToTags(Acl acl) {
        Map<String, List<String>> tags = new HashMap<>();
        acl.grantedPermissions().forEach((agent, perms) -> {
            List<String> names = new ArrayList<>();
            perms.forEach(p -> names.add(p.name().toLowerCase()));
            names.sort(String::compareTo);
            tags.put(agent, names);
        });
        return tags;
    }

    private Acl toAcl(ResultSet rs) throws SQLException {
        AccessScope scope = AccessScope.of(
                AccessLevel.fromTag(rs.getString("access_level")),
                rs.getString("team_id"),
                rs.getString("swarm_id"));

        Map<String, Set<Permission>> grants = new HashMap<>();
        String grantsJson = rs.getString("granted_permissions");
        if (grantsJson != null) {
            try {
                Map<String, List<String>> raw = context.objectMapper().readValue(grantsJson, GRANTS_TYPE);
                raw.forEach((agent, names) -> {
                    Set<Permission> perms = EnumSet.noneOf(Permission.class);
                    names.forEach(n -> perms.add(Permission.fromTag(n)));
                    grants.put(agent, perms);
                });
            } catch (Exception e) {
                throw new StorageException("Corrupt granted_permissions for " + rs.getString("resource_id"), e);
            }
        }

        Set<String> blocked = new HashSet<>();
        String blockedJson = rs.getString("blocked_agents");
        if (blockedJson != null) {
            try {
                blocked.addAll(context.objectMapper().readValue(blockedJson, BLOCKED_TYPE));
            } catch (Exception e) {
                throw new StorageException("Corrupt blocked_agents for " + rs.getString("resource_id"), e);
            }
        }

        return new Acl(
                rs.getString("resource_id"),
                rs.getString("owner"),
                scope,
                grants,
                blocked,
                rs.getLong("created_at"),
                rs.getLong("updated_at"));
    }
}
