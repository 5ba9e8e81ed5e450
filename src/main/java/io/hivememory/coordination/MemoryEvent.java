package io.hivememory.coordination;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Audit event. Kept for 30 days.
 */
public record MemoryEvent(
        String id,
        String type,
        JsonNode payload,
        String source,
        long timestamp,
        long expiresAt
) {
}
