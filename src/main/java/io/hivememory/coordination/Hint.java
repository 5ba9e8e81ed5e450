package io.hivememory.coordination;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Blackboard entry: a lightweight, ownerless note visible to every agent of the partition.
 */
public record Hint(
        long id,
        String partition,
        String key,
        JsonNode value,
        long createdAt,
        long expiresAt
) {
}
