package io.hivememory.sync;

import io.hivememory.config.MemoryProperties;
import io.hivememory.core.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP peer client: {@code POST http://host:port/api/sync/delta}, bounded by the
 * configured connect and request timeouts.
 */
@Component
@ConditionalOnProperty(name = "hivememory.sync.enabled", havingValue = "true")
public class RestPeerClient implements PeerClient {

    private static final Logger log = LoggerFactory.getLogger(RestPeerClient.class);
    static final String DELTA_PATH = "/api/sync/delta";

    private final RestClient restClient;

    public RestPeerClient(MemoryProperties properties) {
        this(properties.sync().connectTimeoutMs(), properties.sync().requestTimeoutMs());
    }

    public RestPeerClient(long connectTimeoutMs, long requestTimeoutMs) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeoutMs);
        requestFactory.setReadTimeout((int) requestTimeoutMs);
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
    }

    @Override
    public SyncAck push(SyncPeer peer, SyncDelta delta) {
        String url = "http://" + peer.id() + DELTA_PATH;
        try {
            SyncAck ack = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(delta)
                    .retrieve()
                    .body(SyncAck.class);
            if (ack == null) {
                throw new SyncException(peer.id(), "Empty response from " + url, null);
            }
            log.debug("Pushed {} entries to {}: {} applied", delta.entries().size(), peer, ack.applied());
            return ack;
        } catch (RestClientException e) {
            throw new SyncException(peer.id(), "Push to " + url + " failed: " + e.getMessage(), e);
        }
    }
}
