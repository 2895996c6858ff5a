package blobnet.network.discovery;

import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;

import java.util.List;

/**
 * Discovery that finds nobody; peers are only reached by dialing.
 */
public class NoDiscovery implements Discovery {

    @Override
    public void start(PeerId self, NetworkAddress listenAddress) {
    }

    @Override
    public List<DiscoveryEvent> poll() {
        return List.of();
    }

    @Override
    public boolean isKnown(PeerId peer) {
        return false;
    }

    @Override
    public void close() {
    }
}
