package blobnet.network.discovery;

import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;

import java.util.Objects;

/**
 * Peer presence change reported by a {@link Discovery} source.
 */
public sealed interface DiscoveryEvent {

    PeerId peer();

    NetworkAddress address();

    record Discovered(PeerId peer, NetworkAddress address) implements DiscoveryEvent {
        public Discovered {
            Objects.requireNonNull(peer, "Peer cannot be null");
            Objects.requireNonNull(address, "Address cannot be null");
        }
    }

    /**
     * A record of the peer timed out. The peer may still be announcing itself, so
     * consumers check {@link Discovery#isKnown(PeerId)} before acting on it.
     */
    record Expired(PeerId peer, NetworkAddress address) implements DiscoveryEvent {
        public Expired {
            Objects.requireNonNull(peer, "Peer cannot be null");
            Objects.requireNonNull(address, "Address cannot be null");
        }
    }
}
