package blobnet.overlay;

import blobnet.network.id.PeerId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Advisory record of which peers announced which artifacts. Entries may be stale.
 */
class ProviderTable {

    private final Map<String, Set<PeerId>> providers = new HashMap<>();

    void add(String artifactId, PeerId peer) {
        providers.computeIfAbsent(artifactId, k -> new LinkedHashSet<>()).add(peer);
    }

    void remove(String artifactId, PeerId peer) {
        Set<PeerId> peers = providers.get(artifactId);
        if (peers != null && peers.remove(peer) && peers.isEmpty()) {
            providers.remove(artifactId);
        }
    }

    void removePeer(PeerId peer) {
        Iterator<Set<PeerId>> it = providers.values().iterator();
        while (it.hasNext()) {
            Set<PeerId> peers = it.next();
            if (peers.remove(peer) && peers.isEmpty()) {
                it.remove();
            }
        }
    }

    /**
     * Providers in announcement order.
     */
    Set<PeerId> providersOf(String artifactId) {
        Set<PeerId> peers = providers.get(artifactId);
        return peers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(peers));
    }
}
