package io.hivememory.coordination;

import io.hivememory.core.ValidationException;

public enum ConsensusStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public String tag() {
        return name().toLowerCase();
    }

    public static ConsensusStatus fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("status is required");
        }
        return switch (tag.trim().toLowerCase()) {
            case "pending" -> PENDING;
            case "approved" -> APPROVED;
            case "rejected" -> REJECTED;
            default -> throw new ValidationException("Unknown consensus status: " + tag);
        };
    }
}
