package io.hivememory.core;

/**
 * Peer unreachable or timed out. Only ever thrown inside the sync transport.
 */
public class SyncException extends MemoryException {

    private final String peerId;

    public SyncException(String peerId, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
    }

    public String getPeerId() {
        return peerId;
    }
}
