package blobnet.messaging;

import java.util.List;

/**
 * Broadcast on a topic to advertise (or withdraw) the artifacts a peer provides.
 */
public record ProviderAnnouncement(String topic, List<String> artifactIds) {
    public ProviderAnnouncement {
        artifactIds = artifactIds == null ? List.of() : List.copyOf(artifactIds);
    }
}
