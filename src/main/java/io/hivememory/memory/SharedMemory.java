package io.hivememory.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.Acl;
import io.hivememory.acl.Permission;
import io.hivememory.acl.Requester;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Partitioned, access-controlled key-value store shared by all agents.
 */
public interface SharedMemory {

    /**
     * Creates or updates the entry at (partition, key).
     * Updating an entry owned by another agent needs WRITE permission on it; the
     * existing owner and visibility are kept in that case.
     *
     * @return the stored entry
     * @throws io.hivememory.core.ValidationException   bad TTL, missing owner or scope id
     * @throws io.hivememory.core.AccessDeniedException the writer may not update the entry
     */
    MemoryEntry store(String key, Object value, StoreOptions options);

    /**
     * Returns the value if the entry exists, has not expired and the requester may read it.
     *
     * @throws io.hivememory.core.AccessDeniedException the entry exists but the requester may not read it
     */
    Optional<JsonNode> retrieve(String key, String partition, Requester requester);

    /**
     * Like {@link #retrieve} but returns the whole entry.
     */
    Optional<MemoryEntry> retrieveEntry(String key, String partition, Requester requester);

    /**
     * Live entries of a partition whose key matches a SQL LIKE pattern. Entries the
     * requester may not read are left out.
     */
    List<MemoryEntry> query(String keyPattern, String partition, Requester requester);

    /**
     * Deletes an entry and its ACL.
     *
     * @return true if an entry was removed
     * @throws io.hivememory.core.AccessDeniedException the requester may not delete it
     */
    boolean delete(String key, String partition, Requester requester);

    /**
     * Removes every entry of a partition.
     */
    int clear(String partition);

    Acl grantPermission(String key, String partition, Requester requester, String agentId, Set<Permission> permissions);

    Acl revokePermission(String key, String partition, Requester requester, String agentId, Set<Permission> permissions);

    Acl blockAgent(String key, String partition, Requester requester, String agentId);

    Acl unblockAgent(String key, String partition, Requester requester, String agentId);

    /**
     * Raw live entry, bypassing ACL checks. For replication and maintenance only.
     */
    Optional<MemoryEntry> getEntry(String key, String partition);

    /**
     * Entries with {@code lastModified > since}, oldest first.
     */
    List<MemoryEntry> getModifiedEntries(long since, String partition);

    Optional<Long> getLastModified(String key, String partition);

    /**
     * Applies a replicated entry with last-writer-wins on {@code lastModified}.
     *
     * @return true if the local copy was replaced
     */
    boolean applyRemote(MemoryEntry entry);

    long count();

    MemoryStats stats();

    boolean healthCheck();
}
