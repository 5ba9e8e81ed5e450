package io.hivememory.sync;

import io.hivememory.config.MemoryProperties;

import java.util.List;

/**
 * Settings of an enabled sync transport.
 */
public record SyncConfig(
        String nodeId,
        String host,
        int port,
        long syncIntervalMs,
        int maxPeers,
        long connectTimeoutMs,
        long requestTimeoutMs,
        List<String> peers
) {
    public SyncConfig {
        peers = peers == null ? List.of() : List.copyOf(peers);
    }

    public static SyncConfig from(MemoryProperties.Sync sync) {
        return new SyncConfig(sync.nodeId(), sync.host(), sync.port(), sync.syncIntervalMs(), sync.maxPeers(),
                sync.connectTimeoutMs(), sync.requestTimeoutMs(), sync.peers());
    }
}
