package io.hivememory.coordination;

import io.hivememory.core.ValidationException;

public enum AgentStatus {
    ACTIVE,
    IDLE,
    TERMINATED;

    public String tag() {
        return name().toLowerCase();
    }

    public static AgentStatus fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("status is required");
        }
        return switch (tag.trim().toLowerCase()) {
            case "active" -> ACTIVE;
            case "idle" -> IDLE;
            case "terminated" -> TERMINATED;
            default -> throw new ValidationException("Unknown agent status: " + tag);
        };
    }
}
