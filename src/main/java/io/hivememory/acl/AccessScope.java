package io.hivememory.acl;

import io.hivememory.core.ValidationException;

/**
 * Visibility of a resource: the access level plus the group id that level needs.
 * TEAM carries a teamId and SWARM a swarmId; the other levels carry neither.
 *
 * @param level   access level
 * @param groupId teamId for TEAM, swarmId for SWARM, otherwise null
 */
public record AccessScope(AccessLevel level, String groupId) {

    public AccessScope {
        if (level == null) {
            throw new ValidationException("accessLevel is required");
        }
        boolean needsGroup = level == AccessLevel.TEAM || level == AccessLevel.SWARM;
        if (needsGroup && (groupId == null || groupId.isBlank())) {
            throw new ValidationException(level == AccessLevel.TEAM
                    ? "teamId is required for accessLevel 'team'"
                    : "swarmId is required for accessLevel 'swarm'");
        }
        if (!needsGroup) {
            groupId = null;
        }
    }

    public static AccessScope privateScope() {
        return new AccessScope(AccessLevel.PRIVATE, null);
    }

    public static AccessScope team(String teamId) {
        return new AccessScope(AccessLevel.TEAM, teamId);
    }

    public static AccessScope swarm(String swarmId) {
        return new AccessScope(AccessLevel.SWARM, swarmId);
    }

    public static AccessScope publicScope() {
        return new AccessScope(AccessLevel.PUBLIC, null);
    }

    public static AccessScope system() {
        return new AccessScope(AccessLevel.SYSTEM, null);
    }

    /**
     * Builds a scope from loose fields, e.g. a stored row or a request body.
     */
    public static AccessScope of(AccessLevel level, String teamId, String swarmId) {
        if (level == null) {
            throw new ValidationException("accessLevel is required");
        }
        return switch (level) {
            case TEAM -> new AccessScope(level, teamId);
            case SWARM -> new AccessScope(level, swarmId);
            default -> new AccessScope(level, null);
        };
    }

    public String teamId() {
        return level == AccessLevel.TEAM ? groupId : null;
    }

    public String swarmId() {
        return level == AccessLevel.SWARM ? groupId : null;
    }
}
