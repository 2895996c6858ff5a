package blobnet.overlay;

import blobnet.network.id.PeerId;
import blobnet.storage.ArtifactHash;

/**
 * Event emitted by the {@link OverlayEngine} for the application to act on.
 */
public sealed interface InboundEvent {

    /**
     * A remote peer asked for an artifact; answer through {@code channel}.
     */
    record ArtifactRequested(ArtifactHash hash, PeerId requester, ResponseChannel channel) implements InboundEvent {
    }
}
