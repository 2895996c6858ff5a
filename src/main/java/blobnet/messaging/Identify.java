package blobnet.messaging;

/**
 * Handshake payload exchanged when a peer is dialed.
 */
public record Identify(String peerId, NetworkAddress listenAddress) {
}
