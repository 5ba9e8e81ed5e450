package io.hivememory.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.AccessLevel;
import io.hivememory.acl.AccessScope;
import io.hivememory.core.EntryRef;
import io.hivememory.core.Expiry;

/**
 * A single entry of the shared key-value store.
 *
 * @param key          entry key, unique within its partition
 * @param partition    partition name
 * @param value        JSON payload
 * @param owner        owning agent
 * @param scope        visibility (access level plus team/swarm id)
 * @param ttlSeconds   time to live, 0 for never
 * @param expiresAt    epoch millis, 0 for never
 * @param createdAt    first write, epoch millis
 * @param updatedAt    last write, epoch millis
 * @param lastModified modification time used for sync ordering
 * @param originNode   node that produced the current version
 */
public record MemoryEntry(
        String key,
        String partition,
        JsonNode value,
        String owner,
        AccessScope scope,
        long ttlSeconds,
        long expiresAt,
        long createdAt,
        long updatedAt,
        long lastModified,
        String originNode
) {

    public AccessLevel accessLevel() {
        return scope.level();
    }

    public EntryRef ref() {
        return new EntryRef(partition, key);
    }

    public boolean isExpired(long nowMillis) {
        return Expiry.isExpired(expiresAt, nowMillis);
    }
}
