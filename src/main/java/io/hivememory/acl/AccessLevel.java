package io.hivememory.acl;

import io.hivememory.core.ValidationException;

/**
 * Visibility levels of a memory resource, in ascending order of visibility.
 */
public enum AccessLevel {
    PRIVATE,
    TEAM,
    SWARM,
    PUBLIC,
    SYSTEM;

    public String tag() {
        return name().toLowerCase();
    }

    /**
     * Parses a stored or caller-supplied tag. Unknown tags are rejected, not defaulted.
     */
    public static AccessLevel fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("accessLevel is required");
        }
        return switch (tag.trim().toLowerCase()) {
            case "private" -> PRIVATE;
            case "team" -> TEAM;
            case "swarm" -> SWARM;
            case "public" -> PUBLIC;
            case "system" -> SYSTEM;
            default -> throw new ValidationException("Unknown accessLevel: " + tag);
        };
    }
}
