package io.hivememory.coordination;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Saved state of a workflow at one step. Checkpoints never expire.
 *
 * @param sha SHA-256 of the serialized state, hex encoded
 */
public record WorkflowCheckpoint(
        long id,
        String workflowId,
        String step,
        String status,
        JsonNode state,
        String sha,
        long createdAt
) {
}
