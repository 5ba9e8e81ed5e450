package io.hivememory.sync;

/**
 * Receiver's answer to a {@link SyncDelta}.
 *
 * @param nodeId  receiving node
 * @param applied entries that replaced the local copy
 * @param skipped entries rejected by last-writer-wins, already expired or malformed
 */
public record SyncAck(String nodeId, int applied, int skipped) {
}
