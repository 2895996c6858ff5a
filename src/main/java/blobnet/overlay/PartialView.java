package blobnet.overlay;

import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The peers this node currently knows how to reach. Dialed peers are pinned and
 * survive discovery expiry.
 */
class PartialView {

    private final Map<PeerId, NetworkAddress> peers = new LinkedHashMap<>();
    private final Set<PeerId> pinned = new HashSet<>();

    /**
     * @return true if the peer was not in the view before
     */
    boolean add(PeerId peer, NetworkAddress address) {
        return peers.put(peer, address) == null;
    }

    boolean pin(PeerId peer, NetworkAddress address) {
        pinned.add(peer);
        return add(peer, address);
    }

    boolean isPinned(PeerId peer) {
        return pinned.contains(peer);
    }

    boolean remove(PeerId peer) {
        pinned.remove(peer);
        return peers.remove(peer) != null;
    }

    boolean contains(PeerId peer) {
        return peers.containsKey(peer);
    }

    NetworkAddress addressOf(PeerId peer) {
        return peers.get(peer);
    }

    Collection<NetworkAddress> addresses() {
        return List.copyOf(peers.values());
    }

    Set<PeerId> peers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(peers.keySet()));
    }

    boolean isEmpty() {
        return peers.isEmpty();
    }

    int size() {
        return peers.size();
    }
}
