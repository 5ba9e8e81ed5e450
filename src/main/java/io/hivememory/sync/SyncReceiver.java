package io.hivememory.sync;

import io.hivememory.core.MemoryContext;
import io.hivememory.core.MemoryException;
import io.hivememory.memory.SharedMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Applies inbound deltas with last-writer-wins. Applied entries keep their remote
 * {@code lastModified} and origin and are not queued for re-broadcast.
 */
@Component
@ConditionalOnProperty(name = "hivememory.sync.enabled", havingValue = "true")
public class SyncReceiver {

    private static final Logger log = LoggerFactory.getLogger(SyncReceiver.class);

    private final SharedMemory memory;
    private final MemoryContext context;

    public SyncReceiver(SharedMemory memory, MemoryContext context) {
        this.memory = memory;
        this.context = context;
    }

    public SyncAck receive(SyncDelta delta) {
        int applied = 0;
        int skipped = 0;
        for (SyncDelta.Entry entry : delta.entries()) {
            try {
                if (memory.applyRemote(entry.toMemoryEntry())) {
                    applied++;
                } else {
                    skipped++;
                }
            } catch (MemoryException e) {
                skipped++;
                log.warn("Skipped replicated entry {}:{} from {}: {}",
                        entry.partition(), entry.key(), delta.sourceNode(), e.getMessage());
            }
        }
        log.debug("Delta from {}: {} applied, {} skipped", delta.sourceNode(), applied, skipped);
        return new SyncAck(context.nodeId(), applied, skipped);
    }
}
