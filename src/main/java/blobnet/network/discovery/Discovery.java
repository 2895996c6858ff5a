package blobnet.network.discovery;

import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;

import java.util.List;

/**
 * Best-effort local peer discovery, polled by the overlay engine on every tick.
 */
public interface Discovery extends AutoCloseable {

    /**
     * Starts announcing {@code self} at {@code listenAddress} and observing others.
     */
    void start(PeerId self, NetworkAddress listenAddress);

    /**
     * Returns the events observed since the previous poll, oldest first.
     */
    List<DiscoveryEvent> poll();

    /**
     * Whether the peer is currently considered present.
     */
    boolean isKnown(PeerId peer);

    @Override
    void close();
}
