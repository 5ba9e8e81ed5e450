package io.hivememory.sync;

import io.hivememory.core.ValidationException;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A remote node and the replication watermark this node keeps for it. Entries
 * modified before the watermark have already been delivered.
 */
public class SyncPeer {

    private final String host;
    private final int port;
    private final AtomicLong watermark = new AtomicLong();
    private final AtomicLong lastSuccessAt = new AtomicLong();
    private final AtomicLong consecutiveFailures = new AtomicLong();

    public SyncPeer(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new ValidationException("peer host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new ValidationException("peer port out of range: " + port);
        }
        this.host = host;
        this.port = port;
    }

    /**
     * Parses {@code host:port}.
     */
    public static SyncPeer parse(String address) {
        if (address == null) {
            throw new ValidationException("peer address is required");
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new ValidationException("peer address must be host:port, got '" + address + "'");
        }
        try {
            return new SyncPeer(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new ValidationException("peer port is not a number: '" + address + "'");
        }
    }

    public String id() {
        return host + ":" + port;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public long watermark() {
        return watermark.get();
    }

    void delivered(long until, long now) {
        watermark.accumulateAndGet(until, Math::max);
        lastSuccessAt.set(now);
        consecutiveFailures.set(0);
    }

    void failed() {
        consecutiveFailures.incrementAndGet();
    }

    public long lastSuccessAt() {
        return lastSuccessAt.get();
    }

    public long consecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public String toString() {
        return id();
    }
}
