package io.hivememory.memory;

import io.hivememory.acl.AccessLevel;

/**
 * Options of a {@link SharedMemory#store} call.
 *
 * @param partition   target partition, "default" when blank
 * @param ttlSeconds  time to live; null applies the configured default, 0 never expires
 * @param accessLevel visibility of the entry
 * @param owner       writing agent, becomes the owner of a new entry
 * @param teamId      required for TEAM
 * @param swarmId     required for SWARM
 */
public record StoreOptions(
        String partition,
        Long ttlSeconds,
        AccessLevel accessLevel,
        String owner,
        String teamId,
        String swarmId
) {
    public static final String DEFAULT_PARTITION = "default";

    public StoreOptions {
        if (partition == null || partition.isBlank()) {
            partition = DEFAULT_PARTITION;
        }
        if (accessLevel == null) {
            accessLevel = AccessLevel.PRIVATE;
        }
    }

    /**
     * Private entry in the default partition owned by {@code owner}.
     */
    public static StoreOptions ownedBy(String owner) {
        return new StoreOptions(null, null, AccessLevel.PRIVATE, owner, null, null);
    }

    public StoreOptions inPartition(String partition) {
        return new StoreOptions(partition, ttlSeconds, accessLevel, owner, teamId, swarmId);
    }

    public StoreOptions withTtl(long ttlSeconds) {
        return new StoreOptions(partition, ttlSeconds, accessLevel, owner, teamId, swarmId);
    }

    public StoreOptions withAccess(AccessLevel accessLevel) {
        return new StoreOptions(partition, ttlSeconds, accessLevel, owner, teamId, swarmId);
    }

    public StoreOptions forTeam(String teamId) {
        return new StoreOptions(partition, ttlSeconds, AccessLevel.TEAM, owner, teamId, swarmId);
    }

    public StoreOptions forSwarm(String swarmId) {
        return new StoreOptions(partition, ttlSeconds, AccessLevel.SWARM, owner, teamId, swarmId);
    }
}
