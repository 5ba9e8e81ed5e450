package io.hivememory.acl;

import io.hivememory.core.AccessDeniedException;

/**
 * Evaluates whether a requester may exercise a permission on a resource.
 *
 * <p>Rules, in order:</p>
 * <ol>
 *   <li>an agent in {@code blockedAgents} is always denied;</li>
 *   <li>the owner is always allowed;</li>
 *   <li>an explicit grant of the permission allows;</li>
 *   <li>otherwise the resource's access level decides:
 *     READ is open for PUBLIC and SYSTEM, and for TEAM/SWARM members with a matching id;
 *     WRITE is open for matching TEAM/SWARM members;
 *     system agents may READ, WRITE and DELETE anything that is not PRIVATE.</li>
 * </ol>
 */
public class AccessControl {

    public AccessDecision check(Requester requester, String owner, AccessScope scope, Acl acl,
                                Permission permission) {
        String agentId = requester.agentId();
        if (agentId == null || agentId.isBlank()) {
            return AccessDecision.deny("no agent id supplied");
        }
        if (acl != null && acl.isBlocked(agentId)) {
            return AccessDecision.deny("agent is blocked");
        }
        if (agentId.equals(owner)) {
            return AccessDecision.allow("owner");
        }
        if (acl != null && acl.hasGrant(agentId, permission)) {
            return AccessDecision.allow("explicit grant");
        }
        if (requester.systemAgent() && scope.level() != AccessLevel.PRIVATE && permission != Permission.SHARE) {
            return AccessDecision.allow("system agent");
        }

        return switch (permission) {
            case READ -> checkRead(requester, scope);
            case WRITE -> checkGroupMembership(requester, scope, "write");
            case DELETE -> AccessDecision.deny("only the owner or a system agent may delete");
            case SHARE -> AccessDecision.deny("only the owner may share");
        };
    }

    /**
     * Like {@link #check} but throws on denial.
     */
    public void require(Requester requester, String resourceId, String owner, AccessScope scope, Acl acl,
                        Permission permission) {
        AccessDecision decision = check(requester, owner, scope, acl, permission);
        if (!decision.allowed()) {
            throw new AccessDeniedException(resourceId, requester.agentId(),
                    permission.name().toLowerCase() + " denied: " + decision.reason());
        }
    }

    private AccessDecision checkRead(Requester requester, AccessScope scope) {
        return switch (scope.level()) {
            case PUBLIC, SYSTEM -> AccessDecision.allow(scope.level().tag() + " resource");
            case TEAM, SWARM -> checkGroupMembership(requester, scope, "read");
            case PRIVATE -> AccessDecision.deny("private resource");
        };
    }

    private AccessDecision checkGroupMembership(Requester requester, AccessScope scope, String action) {
        if (scope.level() == AccessLevel.TEAM && scope.teamId().equals(requester.teamId())) {
            return AccessDecision.allow("team member");
        }
        if (scope.level() == AccessLevel.SWARM && scope.swarmId().equals(requester.swarmId())) {
            return AccessDecision.allow("swarm member");
        }
        return AccessDecision.deny("not permitted to " + action + " a " + scope.level().tag() + " resource");
    }
}
