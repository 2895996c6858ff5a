package blobnet.client;

import blobnet.future.ListenableFuture;
import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;
import blobnet.overlay.Command;
import blobnet.overlay.ResponseChannel;
import blobnet.storage.ArtifactHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe handle to an overlay engine. Every method enqueues one command and
 * returns its reply future without waiting for the engine; use
 * {@link ListenableFuture#await(Duration)} to block with a deadline.
 * <p>
 * Commands submitted from one thread are handled in submission order. If the
 * command queue stays full for longer than the submit timeout the returned future
 * fails with {@link IllegalStateException}.
 */
public class NetworkClient {

    private static final Logger log = LoggerFactory.getLogger(NetworkClient.class);

    private final BlockingQueue<Command> commands;
    private final Duration submitTimeout;

    public NetworkClient(BlockingQueue<Command> commands, Duration submitTimeout) {
        if (commands == null) {
            throw new IllegalArgumentException("Command queue cannot be null");
        }
        if (submitTimeout == null || submitTimeout.isNegative()) {
            throw new IllegalArgumentException("Submit timeout must not be negative");
        }
        this.commands = commands;
        this.submitTimeout = submitTimeout;
    }

    public ListenableFuture<NetworkAddress> listen(NetworkAddress address) {
        ListenableFuture<NetworkAddress> reply = new ListenableFuture<>();
        return submit(new Command.Listen(address, reply), reply);
    }

    public ListenableFuture<PeerId> dial(NetworkAddress address) {
        return dial(null, address);
    }

    /**
     * Dials {@code address}; fails if the peer found there is not {@code expectedPeer}.
     */
    public ListenableFuture<PeerId> dial(PeerId expectedPeer, NetworkAddress address) {
        ListenableFuture<PeerId> reply = new ListenableFuture<>();
        return submit(new Command.Dial(expectedPeer, address, reply), reply);
    }

    public ListenableFuture<Void> provide(ArtifactHash hash) {
        ListenableFuture<Void> reply = new ListenableFuture<>();
        return submit(new Command.StartProviding(hash, reply), reply);
    }

    public ListenableFuture<Void> stopProviding(ArtifactHash hash) {
        ListenableFuture<Void> reply = new ListenableFuture<>();
        return submit(new Command.StopProviding(hash, reply), reply);
    }

    public ListenableFuture<Set<PeerId>> listProviders(ArtifactHash hash) {
        ListenableFuture<Set<PeerId>> reply = new ListenableFuture<>();
        return submit(new Command.GetProviders(hash, reply), reply);
    }

    public ListenableFuture<Set<PeerId>> listPeers() {
        ListenableFuture<Set<PeerId>> reply = new ListenableFuture<>();
        return submit(new Command.ListPeers(reply), reply);
    }

    public ListenableFuture<byte[]> requestArtifact(PeerId peer, ArtifactHash hash) {
        ListenableFuture<byte[]> reply = new ListenableFuture<>();
        return submit(new Command.RequestArtifact(peer, hash, reply), reply);
    }

    public ListenableFuture<Void> respondArtifact(ResponseChannel channel, byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null, use respondNotFound");
        }
        ListenableFuture<Void> reply = new ListenableFuture<>();
        return submit(new Command.RespondArtifact(channel, content, reply), reply);
    }

    public ListenableFuture<Void> respondNotFound(ResponseChannel channel) {
        ListenableFuture<Void> reply = new ListenableFuture<>();
        return submit(new Command.RespondArtifact(channel, null, reply), reply);
    }

    private <T> ListenableFuture<T> submit(Command command, ListenableFuture<T> reply) {
        try {
            if (!commands.offer(command, submitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command queue full, rejecting {}", command.getClass().getSimpleName());
                reply.fail(new IllegalStateException("Command queue full"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply.fail(e);
        }
        return reply;
    }
}
