package io.hivememory.sync;

import io.hivememory.core.SyncException;

/**
 * Delivers deltas to a peer.
 */
public interface PeerClient {

    /**
     * Pushes {@code delta} to {@code peer} within the configured timeouts.
     *
     * @throws SyncException the peer is unreachable, timed out or rejected the delta
     */
    SyncAck push(SyncPeer peer, SyncDelta delta);
}
