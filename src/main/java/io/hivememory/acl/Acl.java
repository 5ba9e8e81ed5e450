package io.hivememory.acl;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Access control list of one resource ({@code partition:key}).
 *
 * @param resourceId         resource the list governs
 * @param owner              owning agent
 * @param scope              visibility of the resource
 * @param grantedPermissions explicit per-agent grants
 * @param blockedAgents      agents denied regardless of any other rule
 * @param createdAt          creation time, epoch millis
 * @param updatedAt          last change, epoch millis
 */
public record Acl(
        String resourceId,
        String owner,
        AccessScope scope,
        Map<String, Set<Permission>> grantedPermissions,
        Set<String> blockedAgents,
        long createdAt,
        long updatedAt
) {
    public Acl {
        grantedPermissions = grantedPermissions == null ? Map.of() : copyGrants(grantedPermissions);
        blockedAgents = blockedAgents == null ? Set.of() : Set.copyOf(blockedAgents);
    }

    public static Acl create(String resourceId, String owner, AccessScope scope, long now) {
        return new Acl(resourceId, owner, scope, Map.of(), Set.of(), now, now);
    }

    public boolean isBlocked(String agentId) {
        return blockedAgents.contains(agentId);
    }

    public boolean hasGrant(String agentId, Permission permission) {
        return grantedPermissions.getOrDefault(agentId, Set.of()).contains(permission);
    }

    public Acl withGrant(String agentId, Set<Permission> permissions, long now) {
        Map<String, Set<Permission>> grants = mutableGrants();
        grants.computeIfAbsent(agentId, id -> EnumSet.noneOf(Permission.class)).addAll(permissions);
        return new Acl(resourceId, owner, scope, grants, blockedAgents, createdAt, now);
    }

    public Acl withoutGrant(String agentId, Set<Permission> permissions, long now) {
        Map<String, Set<Permission>> grants = mutableGrants();
        Set<Permission> current = grants.get(agentId);
        if (current != null) {
            current.removeAll(permissions);
            if (current.isEmpty()) {
                grants.remove(agentId);
            }
        }
        return new Acl(resourceId, owner, scope, grants, blockedAgents, createdAt, now);
    }

    public Acl withBlocked(String agentId, long now) {
        Set<String> blocked = new HashSet<>(blockedAgents);
        blocked.add(agentId);
        return new Acl(resourceId, owner, scope, grantedPermissions, blocked, createdAt, now);
    }

    public Acl withoutBlocked(String agentId, long now) {
        Set<String> blocked = new HashSet<>(blockedAgents);
        blocked.remove(agentId);
        return new Acl(resourceId, owner, scope, grantedPermissions, blocked, createdAt, now);
    }

    private Map<String, Set<Permission>> mutableGrants() {
        Map<String, Set<Permission>> grants = new HashMap<>();
        grantedPermissions.forEach((agent, perms) -> grants.put(agent, EnumSet.copyOf(perms)));
        return grants;
    }

    private static Map<String, Set<Permission>> copyGrants(Map<String, Set<Permission>> source) {
        Map<String, Set<Permission>> copy = new HashMap<>();
        source.forEach((agent, perms) -> {
            if (perms != null && !perms.isEmpty()) {
                copy.put(agent, Set.copyOf(perms));
            }
        });
        return Map.copyOf(copy);
    }
}
