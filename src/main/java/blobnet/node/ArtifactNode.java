package blobnet.node;

import blobnet.cascade.ArtifactResolver;
import blobnet.cascade.InboundRequestHandler;
import blobnet.client.NetworkClient;
import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.future.ListenableFuture;
import blobnet.messaging.JsonMessageCodec;
import blobnet.messaging.MessageCodec;
import blobnet.messaging.NetworkAddress;
import blobnet.network.Network;
import blobnet.network.NioNetwork;
import blobnet.network.discovery.Discovery;
import blobnet.network.discovery.MulticastDiscovery;
import blobnet.network.discovery.NoDiscovery;
import blobnet.network.id.NodeIdentity;
import blobnet.network.id.PeerId;
import blobnet.origin.DockerHubRegistry;
import blobnet.origin.OriginRegistry;
import blobnet.overlay.OverlayEngine;
import blobnet.storage.ArtifactStore;
import blobnet.storage.FileSystemArtifactStore;
import blobnet.storage.RocksDbArtifactIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * A complete node: overlay engine, artifact store, origin gateway and the
 * retrieval cascade wired together behind {@link #resolve}, {@link #listPeers}
 * and {@link #status}.
 */
public class ArtifactNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArtifactNode.class);

    private final NodeConfig config;
    private final OverlayEngine engine;
    private final NetworkClient client;
    private final ArtifactStore store;
    private final ArtifactResolver resolver;
    private final InboundRequestHandler inboundHandler;
    private NetworkAddress listenAddress;

    public ArtifactNode(NodeConfig config, NodeIdentity identity, Network network, Discovery discovery,
                        MessageCodec codec, ArtifactStore store, OriginRegistry origin) {
        this.config = config;
        this.store = store;
        this.engine = new OverlayEngine(identity, network, discovery, codec, config.networkConfig());
        this.client = engine.newClient();
        this.resolver = new ArtifactResolver(store, client, origin, config.awaitTimeout());
        this.inboundHandler = new InboundRequestHandler(engine.inboundEvents(), store, engine.newClient());
    }

    /**
     * Production wiring: TCP transport, multicast discovery, a RocksDB-indexed
     * store under the storage directory and Docker Hub as origin.
     */
    public static ArtifactNode create(NodeConfig config) {
        MessageCodec codec = new JsonMessageCodec();
        try {
            Files.createDirectories(config.storageDir());
        } catch (IOException e) {
            throw ArtifactException.ioError("Cannot create storage directory " + config.storageDir(), e);
        }
        RocksDbArtifactIndex index = new RocksDbArtifactIndex(config.storageDir().resolve("index").toString(), codec);
        ArtifactStore store = new FileSystemArtifactStore(config.storageDir().resolve("blobs"), config.quotaBytes(), index);
        Discovery discovery = config.multicastDiscovery() ? new MulticastDiscovery(codec) : new NoDiscovery();
        OriginRegistry origin = new DockerHubRegistry(config.originAuthUrl(), config.originRegistryUrl(),
                config.originService(), config.originTimeout(), Clock.systemUTC());
        return new ArtifactNode(config, NodeIdentity.generate(), new NioNetwork(codec, config.networkConfig()),
                discovery, codec, store, origin);
    }

    /**
     * Starts the engine, binds the listen address, dials the bootstrap peers and
     * starts answering inbound requests. A bootstrap peer that cannot be dialed is
     * logged and skipped.
     */
    public void start() {
        engine.start();
        listenAddress = await(client.listen(config.listenAddress()));
        for (NetworkAddress peer : config.bootstrapPeers()) {
            try {
                PeerId remote = await(client.dial(peer));
                log.info("Connected to bootstrap peer {} at {}", remote.shortId(), peer);
            } catch (ArtifactException e) {
                log.warn("Could not dial bootstrap peer {}: {}", peer, e.getMessage());
            }
        }
        inboundHandler.start();
        log.info("Node {} started on {}", engine.peerId().shortId(), listenAddress);
    }

    public byte[] resolve(String name, String hashId) {
        return resolver.resolve(name, hashId);
    }

    public Set<PeerId> listPeers() {
        return await(client.listPeers());
    }

    public NodeStatus status() {
        return new NodeStatus(store.artifactCount(), listPeers().size(), store.allocatedSpace(), store.diskUsage());
    }

    public PeerId peerId() {
        return engine.peerId();
    }

    public NetworkAddress listenAddress() {
        return listenAddress;
    }

    public NetworkClient client() {
        return client;
    }

    private <T> T await(ListenableFuture<T> future) {
        Duration timeout = config.awaitTimeout();
        try {
            return future.await(timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ArtifactException artifactException) {
                throw artifactException;
            }
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(e.getCause());
        } catch (TimeoutException e) {
            throw new ArtifactException(ErrorKind.PEER_TIMEOUT, "No reply from overlay engine within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for overlay engine", e);
        }
    }

    @Override
    public void close() {
        inboundHandler.close();
        engine.close();
        store.close();
        log.info("Node {} stopped", engine.peerId().shortId());
    }
}
