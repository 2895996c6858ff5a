package blobnet.cascade;

import blobnet.client.NetworkClient;
import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.future.ListenableFuture;
import blobnet.network.id.PeerId;
import blobnet.origin.OriginRegistry;
import blobnet.storage.ArtifactHash;
import blobnet.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Resolves an artifact from the local store, then from one peer that provides it,
 * then from the origin registry. Whatever is fetched is verified, stored and
 * advertised to the network before it is returned.
 * <p>
 * Failures of the local and peer tiers are absorbed; only an origin failure
 * reaches the caller. Safe for concurrent use; concurrent resolutions of the same
 * artifact are not coalesced.
 */
public class ArtifactResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtifactResolver.class);

    private final ArtifactStore store;
    private final NetworkClient client;
    private final OriginRegistry origin;
    private final Duration awaitTimeout;

    /**
     * @param awaitTimeout upper bound on waiting for any single engine reply
     */
    public ArtifactResolver(ArtifactStore store, NetworkClient client, OriginRegistry origin, Duration awaitTimeout) {
        this.store = store;
        this.client = client;
        this.origin = origin;
        this.awaitTimeout = awaitTimeout;
    }

    /**
     * @param name repository name at the origin, e.g. {@code alpine}
     * @param hashId artifact identifier, e.g. {@code sha256:<hex>}
     * @throws IllegalArgumentException if {@code hashId} is malformed
     * @throws ArtifactException if the origin tier fails or the store rejects the content
     */
    public byte[] resolve(String name, String hashId) {
        ArtifactHash hash = ArtifactHash.parse(hashId);
        Optional<byte[]> local = fromStore(hash);
        if (local.isPresent()) {
            log.debug("{} served from local store", hash);
            return local.get();
        }
        if (!fetchFromPeers(hash)) {
            fetchFromOrigin(name, hash);
        }
        advertise(hash);
        return store.get(hash);
    }

    private Optional<byte[]> fromStore(ArtifactHash hash) {
        if (!store.contains(hash)) {
            return Optional.empty();
        }
        try {
            return Optional.of(store.get(hash));
        } catch (ArtifactException e) {
            if (e.kind() != ErrorKind.NOT_FOUND_LOCALLY) {
                throw e;
            }
            return Optional.empty();
        }
    }

    /**
     * @return true if the artifact was fetched from a peer and stored
     */
    private boolean fetchFromPeers(ArtifactHash hash) {
        try {
            Set<PeerId> providers = await(client.listProviders(hash));
            if (providers.isEmpty()) {
                throw new ArtifactException(ErrorKind.NO_PROVIDERS, "No providers for " + hash);
            }
            PeerId peer = providers.iterator().next();
            byte[] content = await(client.requestArtifact(peer, hash));
            storeVerified(hash, content);
            log.info("{} fetched from peer {}", hash, peer.shortId());
            return true;
        } catch (ArtifactException e) {
            if (!e.kind().isRecoverable()) {
                throw e;
            }
            log.info("Peer fetch of {} failed, falling back to origin: {}", hash, e.getMessage());
            return false;
        }
    }

    private void fetchFromOrigin(String name, ArtifactHash hash) {
        byte[] content = origin.fetchBlob(name, hash);
        storeVerified(hash, content);
        log.info("{} fetched from origin", hash);
    }

    private void storeVerified(ArtifactHash hash, byte[] content) {
        if (!store.put(hash, new ByteArrayInputStream(content))) {
            log.debug("{} was already stored", hash);
        }
    }

    private void advertise(ArtifactHash hash) {
        try {
            await(client.provide(hash));
        } catch (ArtifactException e) {
            log.warn("Could not advertise {}: {}", hash, e.getMessage());
        }
    }

    private <T> T await(ListenableFuture<T> future) {
        try {
            return future.await(awaitTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ArtifactException artifactException) {
                throw artifactException;
            }
            throw new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED, String.valueOf(cause.getMessage()), cause);
        } catch (TimeoutException e) {
            throw new ArtifactException(ErrorKind.PEER_TIMEOUT, "No reply from overlay engine within " + awaitTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED, "Interrupted while waiting for overlay engine", e);
        }
    }
}
