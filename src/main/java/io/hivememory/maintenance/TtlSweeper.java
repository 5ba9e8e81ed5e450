package io.hivememory.maintenance;

import io.hivememory.acl.AclStore;
import io.hivememory.config.MemoryProperties;
import io.hivememory.core.EntryRef;
import io.hivememory.core.Expiry;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SchemaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deletes expired rows from {@code memory_entries}, {@code hints}, {@code events} and
 * {@code consensus_state}.
 *
 * <p>Rows go in batches of {@code sweep-batch-size}, each batch its own transaction, so
 * the database lock is released between batches. Expired entries also lose their ACL
 * row and their modification timestamp. Failures are logged, never thrown.</p>
 */
@Component
public class TtlSweeper {

    private static final Logger log = LoggerFactory.getLogger(TtlSweeper.class);

    private final MemoryContext context;
    private final AclStore aclStore;
    private final int batchSize;

    public TtlSweeper(MemoryContext context, AclStore aclStore, MemoryProperties properties) {
        this.context = context;
        this.aclStore = aclStore;
        this.batchSize = properties.maintenance().sweepBatchSize();
    }

    public SweepResult sweep() {
        long start = System.currentTimeMillis();
        long now = context.now();
        int entries = 0;
        int hints = 0;
        int events = 0;
        int proposals = 0;
        int acls = 0;
        try {
            entries = sweepEntries(now);
            hints = sweepTable(SchemaTable.HINTS, now);
            events = sweepTable(SchemaTable.EVENTS, now);
            proposals = sweepTable(SchemaTable.CONSENSUS_STATE, now);
            acls = aclStore.deleteOrphans();
        } catch (RuntimeException e) {
            log.error("TTL sweep aborted", e);
        }
        var result = new SweepResult(entries, hints, events, proposals, acls, System.currentTimeMillis() - start);
        if (result.total() > 0) {
            log.info("TTL sweep removed {} entries, {} hints, {} events, {} proposals ({} ACLs) in {}ms",
                    entries, hints, events, proposals, acls, result.durationMs());
        } else {
            log.debug("TTL sweep found nothing to remove");
        }
        return result;
    }

    private int sweepEntries(long now) {
        int removed = 0;
        while (true) {
            List<EntryRef> batch = context.database().write(conn -> {
                List<EntryRef> due = new ArrayList<>();
                try (var stmt = conn.prepareStatement(
                        "SELECT partition, key FROM memory_entries WHERE " + Expiry.DUE + " LIMIT ?")) {
                    stmt.setLong(1, now);
                    stmt.setInt(2, batchSize);
                    try (var rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            due.add(new EntryRef(rs.getString(1), rs.getString(2)));
                        }
                    }
                }
                try (var stmt = conn.prepareStatement(
                        "DELETE FROM memory_entries WHERE partition = ? AND key = ? AND " + Expiry.DUE)) {
                    for (EntryRef ref : due) {
                        stmt.setString(1, ref.partition());
                        stmt.setString(2, ref.key());
                        stmt.setLong(3, now);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                for (EntryRef ref : due) {
                    context.modificationTracker().forget(ref.partition(), ref.key());
                }
                return due;
            });
            removed += batch.size();
            if (batch.size() < batchSize) {
                return removed;
            }
        }
    }

    private int sweepTable(SchemaTable table, long now) {
        context.database().ensureTable(table);
        String sql = "DELETE FROM " + table.tableName() + " WHERE rowid IN (SELECT rowid FROM "
                + table.tableName() + " WHERE " + Expiry.DUE + " LIMIT ?)";
        int removed = 0;
        while (true) {
            int batch = context.database().write(conn -> {
                try (var stmt = conn.prepareStatement(sql)) {
                    stmt.setLong(1, now);
                    stmt.setInt(2, batchSize);
                    return stmt.executeUpdate();
                }
            });
            removed += batch;
            if (batch < batchSize) {
                return removed;
            }
        }
    }
}
