package io.hivememory.sync;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of outbound sync attempts.
 */
public class SyncMetrics {

    private final AtomicLong totalSyncs = new AtomicLong();
    private final AtomicLong successfulSyncs = new AtomicLong();
    private final AtomicLong failedSyncs = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private final AtomicLong bytesTransferred = new AtomicLong();
    private final AtomicLong entriesSent = new AtomicLong();

    void recordSuccess(long durationMs, long bytes, int entries) {
        totalSyncs.incrementAndGet();
        successfulSyncs.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        bytesTransferred.addAndGet(bytes);
        entriesSent.addAndGet(entries);
    }

    void recordFailure(long durationMs) {
        totalSyncs.incrementAndGet();
        failedSyncs.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
    }

    public Snapshot snapshot() {
        long total = totalSyncs.get();
        return new Snapshot(total, successfulSyncs.get(), failedSyncs.get(),
                total == 0 ? 0 : (double) totalDurationMs.get() / total,
                bytesTransferred.get(), entriesSent.get());
    }

    /**
     * Point-in-time copy of the counters.
     */
    public record Snapshot(
            long totalSyncs,
            long successfulSyncs,
            long failedSyncs,
            double averageSyncDurationMs,
            long bytesTransferred,
            long entriesSent
    ) {
    }
}
