package blobnet.overlay;

import blobnet.future.ListenableFuture;
import blobnet.network.id.PeerId;
import blobnet.util.Timeout;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gathers the answers to one broadcast provider query until every asked peer has
 * answered or the query window elapses.
 */
class ProviderQueryCollector {

    private final String artifactId;
    private final Set<PeerId> awaiting;
    private final Set<PeerId> providers = new LinkedHashSet<>();
    private final ListenableFuture<Set<PeerId>> reply;
    private final Timeout window;

    ProviderQueryCollector(String artifactId, Set<PeerId> asked, ListenableFuture<Set<PeerId>> reply, long windowTicks) {
        this.artifactId = artifactId;
        this.awaiting = new HashSet<>(asked);
        this.reply = reply;
        this.window = new Timeout("provider-query-" + artifactId, windowTicks);
        this.window.start();
    }

    /**
     * @return true if the peer was still awaited
     */
    boolean record(PeerId peer, boolean provides) {
        if (!awaiting.remove(peer)) {
            return false;
        }
        if (provides) {
            providers.add(peer);
        }
        return true;
    }

    void tick() {
        window.tick();
    }

    boolean isDone() {
        return awaiting.isEmpty() || window.fired();
    }

    void complete() {
        reply.complete(Collections.unmodifiableSet(new LinkedHashSet<>(providers)));
    }

    String artifactId() {
        return artifactId;
    }
}
