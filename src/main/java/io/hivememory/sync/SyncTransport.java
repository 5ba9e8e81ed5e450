package io.hivememory.sync;

import io.hivememory.config.MemoryProperties;
import io.hivememory.core.EntryRef;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.SyncException;
import io.hivememory.core.ValidationException;
import io.hivememory.memory.MemoryEntry;
import io.hivememory.memory.SharedMemory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic push replication to a small set of peers.
 *
 * <p>Every tick, each peer receives the entries modified locally since its watermark
 * and before the tick time. The watermark only moves after the peer acknowledged the
 * delta, so a failed push is retried in full on the next tick. Peer failures are
 * counted and logged; they never reach local readers or writers.</p>
 *
 * <p>Configure in application.yml:</p>
 * <pre>
 * hivememory:
 *   sync:
 *     enabled: true
 *     node-id: node-a
 *     sync-interval-ms: 5000
 *     peers: [10.0.0.2:8080]
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "hivememory.sync.enabled", havingValue = "true")
public class SyncTransport {

    private static final Logger log = LoggerFactory.getLogger(SyncTransport.class);

    private final SharedMemory memory;
    private final MemoryContext context;
    private final PeerClient peerClient;
    private final MemoryProperties.Sync defaults;
    private final Map<String, SyncPeer> peers = new ConcurrentHashMap<>();
    private final SyncMetrics metrics = new SyncMetrics();
    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile boolean enabled;
    private volatile SyncConfig config;
    private ScheduledExecutorService executor;

    public SyncTransport(SharedMemory memory, MemoryContext context, PeerClient peerClient,
                         MemoryProperties properties) {
        this.memory = memory;
        this.context = context;
        this.peerClient = peerClient;
        this.defaults = properties.sync();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (defaults.enabled()) {
            enable(SyncConfig.from(defaults));
        }
    }

    public synchronized void enable(SyncConfig syncConfig) {
        if (enabled) {
            log.info("Sync already enabled on {}", context.nodeId());
            return;
        }
        this.config = syncConfig;
        for (String address : syncConfig.peers()) {
            SyncPeer peer = SyncPeer.parse(address);
            addPeer(peer.host(), peer.port());
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "hivememory-sync");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tick, syncConfig.syncIntervalMs(), syncConfig.syncIntervalMs(),
                TimeUnit.MILLISECONDS);
        enabled = true;
        log.info("Sync enabled on {} ({}:{}): {} peers, every {}ms",
                context.nodeId(), syncConfig.host(), syncConfig.port(), peers.size(), syncConfig.syncIntervalMs());
    }

    /**
     * Stops the timer and aborts an in-flight push. Local state is untouched.
     */
    @PreDestroy
    public synchronized void disable() {
        if (!enabled) {
            return;
        }
        enabled = false;
        executor.shutdownNow();
        executor = null;
        log.info("Sync disabled on {}", context.nodeId());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Adds a peer, or returns the existing one with the same id.
     *
     * @throws ValidationException when the peer limit is reached
     */
    public synchronized SyncPeer addPeer(String host, int port) {
        SyncPeer candidate = new SyncPeer(host, port);
        SyncPeer existing = peers.get(candidate.id());
        if (existing != null) {
            return existing;
        }
        int maxPeers = config != null ? config.maxPeers() : defaults.maxPeers();
        if (peers.size() >= maxPeers) {
            throw new ValidationException("Peer limit of " + maxPeers + " reached");
        }
        peers.put(candidate.id(), candidate);
        log.info("Added sync peer {}", candidate);
        return candidate;
    }

    public boolean removePeer(String peerId) {
        boolean removed = peers.remove(peerId) != null;
        if (removed) {
            log.info("Removed sync peer {}", peerId);
        }
        return removed;
    }

    public List<SyncPeer> getPeers() {
        List<SyncPeer> list = new ArrayList<>(peers.values());
        list.sort(Comparator.comparing(SyncPeer::id));
        return list;
    }

    public SyncMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    /**
     * Runs one tick on the calling thread. Does nothing while sync is disabled.
     *
     * @return entries delivered across all peers
     */
    public int syncNow() {
        if (!enabled) {
            return 0;
        }
        tickLock.lock();
        try {
            // Read under the database lock: every write committed before this point has
            // already recorded its timestamp in the tracker.
            long tickTime = context.database().read(conn -> context.now());
            int delivered = 0;
            for (SyncPeer peer : getPeers()) {
                delivered += syncPeer(peer, tickTime);
            }
            return delivered;
        } finally {
            tickLock.unlock();
        }
    }

    private void tick() {
        try {
            syncNow();
        } catch (RuntimeException e) {
            log.error("Sync tick failed", e);
        }
    }

    private int syncPeer(SyncPeer peer, long tickTime) {
        List<SyncDelta.Entry> entries = collect(peer.watermark(), tickTime);
        if (entries.isEmpty()) {
            peer.delivered(tickTime, tickTime);
            return 0;
        }
        var delta = new SyncDelta(context.nodeId(), tickTime, entries);
        long start = System.nanoTime();
        try {
            long bytes = context.toJson(delta).getBytes(StandardCharsets.UTF_8).length;
            SyncAck ack = peerClient.push(peer, delta);
            metrics.recordSuccess(elapsedMs(start), bytes, entries.size());
            peer.delivered(tickTime, context.now());
            log.debug("Synced {} entries to {} ({} applied)", entries.size(), peer, ack.applied());
            return entries.size();
        } catch (SyncException e) {
            metrics.recordFailure(elapsedMs(start));
            peer.failed();
            log.warn("Sync to {} failed: {}", e.getPeerId(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordFailure(elapsedMs(start));
            peer.failed();
            log.warn("Sync to {} failed unexpectedly: {}", peer, e.getMessage());
        }
        return 0;
    }

    /**
     * Live entries modified locally in {@code [from, until)}, oldest first.
     */
    private List<SyncDelta.Entry> collect(long from, long until) {
        List<MemoryEntry> changed = new ArrayList<>();
        for (EntryRef ref : context.modificationTracker().modifiedBetween(from, until).keySet()) {
            memory.getEntry(ref.key(), ref.partition())
                    .filter(e -> e.lastModified() >= from && e.lastModified() < until)
                    .ifPresent(changed::add);
        }
        changed.sort(Comparator.comparingLong(MemoryEntry::lastModified));
        List<SyncDelta.Entry> entries = new ArrayList<>(changed.size());
        for (MemoryEntry entry : changed) {
            entries.add(SyncDelta.Entry.from(entry));
        }
        return entries;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
