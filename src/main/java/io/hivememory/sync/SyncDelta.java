package io.hivememory.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.AccessLevel;
import io.hivememory.acl.AccessScope;
import io.hivememory.memory.MemoryEntry;

import java.util.List;

/**
 * Batch of entries pushed from one node to a peer.
 *
 * @param sourceNode sending node id
 * @param sentAt     tick time on the sending node; every entry has {@code lastModified < sentAt}
 * @param entries    changed entries, oldest first
 */
public record SyncDelta(String sourceNode, long sentAt, List<Entry> entries) {

    public SyncDelta {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Wire form of a {@link MemoryEntry}.
     */
    public record Entry(
            String key,
            String partition,
            JsonNode value,
            String owner,
            String accessLevel,
            String teamId,
            String swarmId,
            long ttlSeconds,
            long expiresAt,
            long createdAt,
            long updatedAt,
            long lastModified,
            String originNode
    ) {
        public static Entry from(MemoryEntry entry) {
            return new Entry(entry.key(), entry.partition(), entry.value(), entry.owner(),
                    entry.accessLevel().tag(), entry.scope().teamId(), entry.scope().swarmId(),
                    entry.ttlSeconds(), entry.expiresAt(), entry.createdAt(), entry.updatedAt(),
                    entry.lastModified(), entry.originNode());
        }

        public MemoryEntry toMemoryEntry() {
            return new MemoryEntry(key, partition, value, owner,
                    AccessScope.of(AccessLevel.fromTag(accessLevel), teamId, swarmId),
                    ttlSeconds, expiresAt, createdAt, updatedAt, lastModified, originNode);
        }
    }
}
