package blobnet.network.discovery;

import blobnet.messaging.NetworkAddress;

/**
 * Datagram announcing a peer and the address it listens on.
 */
public record DiscoveryAnnouncement(String peerId, NetworkAddress listenAddress) {
}
