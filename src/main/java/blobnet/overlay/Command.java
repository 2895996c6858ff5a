package blobnet.overlay;

import blobnet.future.ListenableFuture;
import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;
import blobnet.storage.ArtifactHash;

import java.util.Objects;
import java.util.Set;

/**
 * Instruction submitted to the {@link OverlayEngine}. Every command carries the
 * reply slot the engine completes exactly once.
 */
public sealed interface Command {

    ListenableFuture<?> reply();

    record Listen(NetworkAddress address, ListenableFuture<NetworkAddress> reply) implements Command {
        public Listen {
            Objects.requireNonNull(address, "Address cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    /**
     * @param expectedPeer the peer expected at {@code address}, or null to accept any
     */
    record Dial(PeerId expectedPeer, NetworkAddress address, ListenableFuture<PeerId> reply) implements Command {
        public Dial {
            Objects.requireNonNull(address, "Address cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    record StartProviding(ArtifactHash hash, ListenableFuture<Void> reply) implements Command {
        public StartProviding {
            Objects.requireNonNull(hash, "Hash cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    record StopProviding(ArtifactHash hash, ListenableFuture<Void> reply) implements Command {
        public StopProviding {
            Objects.requireNonNull(hash, "Hash cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    record GetProviders(ArtifactHash hash, ListenableFuture<Set<PeerId>> reply) implements Command {
        public GetProviders {
            Objects.requireNonNull(hash, "Hash cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    record RequestArtifact(PeerId peer, ArtifactHash hash, ListenableFuture<byte[]> reply) implements Command {
        public RequestArtifact {
            Objects.requireNonNull(peer, "Peer cannot be null");
            Objects.requireNonNull(hash, "Hash cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    /**
     * @param content the artifact bytes, or null to answer not-found
     */
    record RespondArtifact(ResponseChannel channel, byte[] content, ListenableFuture<Void> reply) implements Command {
        public RespondArtifact {
            Objects.requireNonNull(channel, "Channel cannot be null");
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }

    record ListPeers(ListenableFuture<Set<PeerId>> reply) implements Command {
        public ListPeers {
            Objects.requireNonNull(reply, "Reply cannot be null");
        }
    }
}
