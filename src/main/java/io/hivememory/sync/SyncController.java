package io.hivememory.sync;

import io.hivememory.core.ValidationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Peer-facing sync endpoint plus operator views of the transport.
 */
@RestController
@RequestMapping("/api/sync")
@ConditionalOnProperty(name = "hivememory.sync.enabled", havingValue = "true")
public class SyncController {

    private final SyncReceiver receiver;
    private final SyncTransport transport;

    public SyncController(SyncReceiver receiver, SyncTransport transport) {
        this.receiver = receiver;
        this.transport = transport;
    }

    /**
     * Applies a delta pushed by a peer.
     */
    @PostMapping("/delta")
    public ResponseEntity<SyncAck> receiveDelta(@RequestBody SyncDelta delta) {
        if (delta.sourceNode() == null || delta.sourceNode().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(receiver.receive(delta));
    }

    @GetMapping("/metrics")
    public ResponseEntity<SyncMetrics.Snapshot> metrics() {
        return ResponseEntity.ok(transport.getMetrics());
    }

    @GetMapping("/peers")
    public ResponseEntity<List<PeerView>> peers() {
        return ResponseEntity.ok(transport.getPeers().stream()
                .map(p -> new PeerView(p.id(), p.watermark(), p.lastSuccessAt(), p.consecutiveFailures()))
                .toList());
    }

    @PostMapping("/peers")
    public ResponseEntity<PeerView> addPeer(@RequestBody AddPeerRequest request) {
        if (request.host() == null || request.host().isBlank() || request.port() == null) {
            return ResponseEntity.badRequest().build();
        }
        try {
            SyncPeer peer = transport.addPeer(request.host(), request.port());
            return ResponseEntity.ok(new PeerView(peer.id(), peer.watermark(), peer.lastSuccessAt(),
                    peer.consecutiveFailures()));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @DeleteMapping("/peers/{peerId}")
    public ResponseEntity<Map<String, String>> removePeer(@PathVariable String peerId) {
        if (!transport.removePeer(peerId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "removed", "id", peerId));
    }

    /**
     * Triggers a sync tick immediately.
     */
    @PostMapping("/now")
    public ResponseEntity<Map<String, Integer>> syncNow() {
        return ResponseEntity.ok(Map.of("delivered", transport.syncNow()));
    }

    public record AddPeerRequest(String host, Integer port) {}

    public record PeerView(String id, long watermark, long lastSuccessAt, long consecutiveFailures) {}
}
