package io.hivememory.core;

/**
 * The requesting agent failed the ACL check for a resource.
 */
public class AccessDeniedException extends MemoryException {

    private final String resourceId;
    private final String agentId;

    public AccessDeniedException(String resourceId, String agentId, String reason) {
        super("Access denied for agent '%s' on '%s': %s".formatted(agentId, resourceId, reason));
        this.resourceId = resourceId;
        this.agentId = agentId;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getAgentId() {
        return agentId;
    }
}
