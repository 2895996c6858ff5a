package blobnet.overlay;

import blobnet.network.id.PeerId;

/**
 * Handle for answering one inbound artifact request. The engine accepts at most
 * one response per channel, and none after the channel expired.
 */
public record ResponseChannel(long id, PeerId requester, String artifactId) {
}
