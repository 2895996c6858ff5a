package blobnet.overlay;

import blobnet.client.NetworkClient;
import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.future.ListenableFuture;
import blobnet.messaging.ArtifactRequest;
import blobnet.messaging.ArtifactResponse;
import blobnet.messaging.Identify;
import blobnet.messaging.Message;
import blobnet.messaging.MessageBus;
import blobnet.messaging.MessageCodec;
import blobnet.messaging.MessageType;
import blobnet.messaging.NetworkAddress;
import blobnet.messaging.ProviderAnnouncement;
import blobnet.messaging.ProviderQuery;
import blobnet.messaging.ProviderQueryResponse;
import blobnet.messaging.RequestCallback;
import blobnet.messaging.RequestWaitingList;
import blobnet.network.Network;
import blobnet.network.NetworkConfig;
import blobnet.network.discovery.Discovery;
import blobnet.network.discovery.DiscoveryEvent;
import blobnet.network.id.NodeIdentity;
import blobnet.network.id.PeerId;
import blobnet.storage.ArtifactHash;
import blobnet.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeoutException;

/**
 * Owns all peer-to-peer state of a node: the listen address, the partial view of
 * reachable peers, provider records, outstanding requests and open response
 * channels. The only way in is the command queue, through a {@link NetworkClient};
 * the only way out is reply slots and the {@link InboundEvent} queue.
 * <p>
 * Driven by {@link #tick()}. Each tick handles, with bounded work: queued commands,
 * network input, discovery events, and expiry of requests, provider queries and
 * response channels. {@link #start()} ticks on a dedicated thread; tests may
 * instead call {@code tick()} directly from a single thread.
 */
public class OverlayEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OverlayEngine.class);

    private final PeerId self;
    private final Network network;
    private final Discovery discovery;
    private final NetworkConfig config;
    private final MessageBus messageBus;

    private final BlockingQueue<Command> commands;
    private final BlockingQueue<InboundEvent> events;

    private final PartialView view = new PartialView();
    private final ProviderTable providers = new ProviderTable();
    private final Set<String> provided = new LinkedHashSet<>();
    private final RequestWaitingList<String, ArtifactResponse> pendingArtifactRequests;
    private final RequestWaitingList<String, Identify> pendingDials;
    private final Map<String, ProviderQueryCollector> providerQueries = new LinkedHashMap<>();
    private final Map<Long, OpenChannel> openChannels = new LinkedHashMap<>();
    private long nextChannelId = 1;
    private NetworkAddress listenAddress;

    private volatile boolean running;
    private Thread eventLoop;

    public OverlayEngine(NodeIdentity identity, Network network, Discovery discovery,
                         MessageCodec codec, NetworkConfig config) {
        this.self = identity.peerId();
        this.network = network;
        this.discovery = discovery;
        this.config = config;
        this.messageBus = new MessageBus(network, codec);
        this.commands = new ArrayBlockingQueue<>(config.commandQueueCapacity());
        this.events = new ArrayBlockingQueue<>(config.eventQueueCapacity());
        this.pendingArtifactRequests = new RequestWaitingList<>(config.requestTimeoutTicks());
        this.pendingDials = new RequestWaitingList<>(config.requestTimeoutTicks());
    }

    public NetworkClient newClient() {
        return new NetworkClient(commands, config.submitTimeout());
    }

    /**
     * Inbound artifact requests waiting for the application.
     */
    public BlockingQueue<InboundEvent> inboundEvents() {
        return events;
    }

    public PeerId peerId() {
        return self;
    }

    public void start() {
        if (eventLoop != null) {
            throw new IllegalStateException("Engine already started");
        }
        running = true;
        eventLoop = new Thread(this::runEventLoop, "overlay-" + self.shortId());
        eventLoop.setDaemon(true);
        eventLoop.start();
        log.info("Overlay engine {} started", self.shortId());
    }

    private void runEventLoop() {
        while (running) {
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Overlay engine tick failed", e);
            }
            try {
                Thread.sleep(config.tickIntervalMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    public void tick() {
        processCommands();
        network.tick();
        processDiscoveryEvents();
        expireOutstanding();
    }

    // ---- commands ----

    private void processCommands() {
        for (int i = 0; i < config.maxCommandsPerTick(); i++) {
            Command command = commands.poll();
            if (command == null) {
                return;
            }
            try {
                handle(command);
            } catch (RuntimeException e) {
                log.warn("Command {} failed: {}", command.getClass().getSimpleName(), e.getMessage());
                failIfPending(command.reply(), e);
            }
        }
    }

    private void handle(Command command) {
        if (command instanceof Command.Listen listen) {
            handleListen(listen);
        } else if (command instanceof Command.Dial dial) {
            handleDial(dial);
        } else if (command instanceof Command.StartProviding start) {
            handleStartProviding(start);
        } else if (command instanceof Command.StopProviding stop) {
            handleStopProviding(stop);
        } else if (command instanceof Command.GetProviders get) {
            handleGetProviders(get);
        } else if (command instanceof Command.RequestArtifact request) {
            handleRequestArtifact(request);
        } else if (command instanceof Command.RespondArtifact respond) {
            handleRespondArtifact(respond);
        } else if (command instanceof Command.ListPeers list) {
            list.reply().complete(view.peers());
        } else {
            throw new IllegalArgumentException("Unsupported command: " + command);
        }
    }

    private void handleListen(Command.Listen listen) {
        if (listenAddress != null) {
            throw new IllegalStateException("Already listening on " + listenAddress);
        }
        NetworkAddress bound = network.bind(listen.address());
        listenAddress = bound;
        messageBus.registerHandler(bound, this::onMessage);
        discovery.start(self, bound);
        log.info("Peer {} listening on {}", self.shortId(), bound);
        listen.reply().complete(bound);
    }

    private void handleDial(Command.Dial dial) {
        requireListening();
        if (dial.address().equals(listenAddress)) {
            throw new IllegalArgumentException("Cannot dial own listen address " + listenAddress);
        }
        String correlationId = MessageBus.newCorrelationId();
        pendingDials.add(correlationId, new RequestCallback<>() {
            @Override
            public void onResponse(Identify identify, NetworkAddress fromNode) {
                PeerId remote = new PeerId(identify.peerId());
                if (dial.expectedPeer() != null && !dial.expectedPeer().equals(remote)) {
                    dial.reply().fail(new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED,
                            "Expected peer " + dial.expectedPeer() + " at " + dial.address() + " but found " + remote));
                    return;
                }
                addPeer(remote, dial.address(), true);
                dial.reply().complete(remote);
            }

            @Override
            public void onError(Exception error) {
                dial.reply().fail(error instanceof TimeoutException
                        ? new ArtifactException(ErrorKind.PEER_TIMEOUT, "Dial to " + dial.address() + " timed out", error)
                        : error);
            }
        });
        log.debug("Dialing {}", dial.address());
        messageBus.send(listenAddress, self, dial.address(), MessageType.IDENTIFY_REQUEST,
                new Identify(self.value(), listenAddress), correlationId);
    }

    private void handleStartProviding(Command.StartProviding start) {
        String artifactId = start.hash().id();
        if (provided.add(artifactId)) {
            broadcastOnTopic(MessageType.PROVIDER_ANNOUNCE, new ProviderAnnouncement(config.topic(), List.of(artifactId)));
        }
        start.reply().complete(null);
    }

    private void handleStopProviding(Command.StopProviding stop) {
        String artifactId = stop.hash().id();
        if (provided.remove(artifactId)) {
            broadcastOnTopic(MessageType.PROVIDER_WITHDRAW, new ProviderAnnouncement(config.topic(), List.of(artifactId)));
        }
        stop.reply().complete(null);
    }

    private void handleGetProviders(Command.GetProviders get) {
        String artifactId = get.hash().id();
        Set<PeerId> known = providers.providersOf(artifactId);
        if (!known.isEmpty() || listenAddress == null || view.isEmpty()) {
            get.reply().complete(known);
            return;
        }
        String correlationId = MessageBus.newCorrelationId();
        providerQueries.put(correlationId,
                new ProviderQueryCollector(artifactId, view.peers(), get.reply(), config.providerQueryWindowTicks()));
        log.debug("Querying {} peers for providers of {}", view.size(), artifactId);
        messageBus.broadcast(listenAddress, self, view.addresses(), MessageType.PROVIDER_QUERY,
                new ProviderQuery(config.topic(), artifactId), correlationId);
    }

    private void handleRequestArtifact(Command.RequestArtifact request) {
        String artifactId = request.hash().id();
        NetworkAddress address = view.addressOf(request.peer());
        if (address == null || listenAddress == null) {
            throw new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED,
                    "No known address for peer " + request.peer().shortId());
        }
        String correlationId = MessageBus.newCorrelationId();
        pendingArtifactRequests.add(correlationId, new RequestCallback<>() {
            @Override
            public void onResponse(ArtifactResponse response, NetworkAddress fromNode) {
                if (response.isFound()) {
                    request.reply().complete(response.content());
                } else {
                    request.reply().fail(new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED,
                            "Peer " + request.peer().shortId() + " answered " + response.status() + " for " + artifactId
                                    + (response.error() != null ? ": " + response.error() : "")));
                }
            }

            @Override
            public void onError(Exception error) {
                request.reply().fail(error instanceof TimeoutException
                        ? ArtifactException.peerTimeout(artifactId)
                        : new ArtifactException(ErrorKind.PEER_TRANSFER_FAILED, error.getMessage(), error));
            }
        });
        log.debug("Requesting {} from {}", artifactId, request.peer().shortId());
        messageBus.send(listenAddress, self, address, MessageType.ARTIFACT_REQUEST,
                new ArtifactRequest(artifactId), correlationId);
    }

    private void handleRespondArtifact(Command.RespondArtifact respond) {
        OpenChannel open = openChannels.remove(respond.channel().id());
        if (open == null) {
            throw new IllegalStateException("Response channel " + respond.channel().id() + " already answered or expired");
        }
        String artifactId = respond.channel().artifactId();
        if (respond.content() == null) {
            sendArtifactResponse(open.request, ArtifactResponse.notFound(artifactId));
            respond.reply().complete(null);
            return;
        }
        try {
            sendArtifactResponse(open.request, ArtifactResponse.found(artifactId, respond.content()));
        } catch (IllegalArgumentException e) {
            log.warn("Cannot send {} ({} bytes) to {}: {}", artifactId, respond.content().length,
                    open.request.sourcePeer().shortId(), e.getMessage());
            sendArtifactResponse(open.request, ArtifactResponse.error(artifactId, "Artifact too large to transfer"));
            respond.reply().fail(e);
            return;
        }
        respond.reply().complete(null);
    }

    // ---- inbound protocol messages ----

    private void onMessage(Message message) {
        MessageType type = message.messageType();
        if (type == MessageType.IDENTIFY_REQUEST) {
            Identify identify = messageBus.decodePayload(message, Identify.class);
            addPeer(message.sourcePeer(), identify.listenAddress(), true);
            messageBus.reply(message, listenAddress, self, MessageType.IDENTIFY_RESPONSE,
                    new Identify(self.value(), listenAddress));
        } else if (type == MessageType.IDENTIFY_RESPONSE) {
            pendingDials.handleResponse(message.correlationId(),
                    messageBus.decodePayload(message, Identify.class), message.source());
        } else if (type == MessageType.ARTIFACT_REQUEST) {
            onArtifactRequest(message);
        } else if (type == MessageType.ARTIFACT_RESPONSE) {
            pendingArtifactRequests.handleResponse(message.correlationId(),
                    messageBus.decodePayload(message, ArtifactResponse.class), message.source());
        } else if (type == MessageType.PROVIDER_ANNOUNCE || type == MessageType.PROVIDER_WITHDRAW) {
            onProviderAnnouncement(message);
        } else if (type == MessageType.PROVIDER_QUERY) {
            ProviderQuery query = messageBus.decodePayload(message, ProviderQuery.class);
            if (isOurTopic(query.topic())) {
                messageBus.reply(message, listenAddress, self, MessageType.PROVIDER_QUERY_RESPONSE,
                        new ProviderQueryResponse(query.artifactId(), provided.contains(query.artifactId())));
            }
        } else if (type == MessageType.PROVIDER_QUERY_RESPONSE) {
            onProviderQueryResponse(message);
        } else {
            log.warn("Ignoring unexpected message type {} from {}", type, message.sourcePeer());
        }
    }

    private void onArtifactRequest(Message message) {
        ArtifactRequest request = messageBus.decodePayload(message, ArtifactRequest.class);
        ArtifactHash hash;
        try {
            hash = ArtifactHash.parse(request.artifactId());
        } catch (IllegalArgumentException e) {
            sendArtifactResponse(message, ArtifactResponse.error(request.artifactId(), e.getMessage()));
            return;
        }
        ResponseChannel channel = new ResponseChannel(nextChannelId++, message.sourcePeer(), hash.id());
        if (!events.offer(new InboundEvent.ArtifactRequested(hash, message.sourcePeer(), channel))) {
            log.warn("Inbound event queue full, answering not-found for {}", hash);
            sendArtifactResponse(message, ArtifactResponse.notFound(hash.id()));
            return;
        }
        Timeout timeout = new Timeout("response-channel-" + channel.id(), config.responseChannelTimeoutTicks());
        timeout.start();
        openChannels.put(channel.id(), new OpenChannel(message, timeout));
    }

    private void onProviderAnnouncement(Message message) {
        ProviderAnnouncement announcement = messageBus.decodePayload(message, ProviderAnnouncement.class);
        PeerId peer = message.sourcePeer();
        if (!isOurTopic(announcement.topic())) {
            return;
        }
        if (!view.contains(peer)) {
            log.debug("Ignoring announcement from {} outside the partial view", peer.shortId());
            return;
        }
        boolean announce = message.messageType() == MessageType.PROVIDER_ANNOUNCE;
        for (String artifactId : announcement.artifactIds()) {
            if (announce) {
                providers.add(artifactId, peer);
            } else {
                providers.remove(artifactId, peer);
            }
        }
    }

    private void onProviderQueryResponse(Message message) {
        ProviderQueryCollector collector = providerQueries.get(message.correlationId());
        if (collector == null) {
            return;
        }
        ProviderQueryResponse response = messageBus.decodePayload(message, ProviderQueryResponse.class);
        PeerId peer = message.sourcePeer();
        if (collector.record(peer, response.provides()) && response.provides() && view.contains(peer)) {
            providers.add(collector.artifactId(), peer);
        }
        if (collector.isDone()) {
            providerQueries.remove(message.correlationId());
            collector.complete();
        }
    }

    private boolean isOurTopic(String topic) {
        if (config.topic().equals(topic)) {
            return true;
        }
        log.debug("Ignoring message for topic {}", topic);
        return false;
    }

    // ---- discovery and membership ----

    private void processDiscoveryEvents() {
        if (listenAddress == null) {
            return;
        }
        for (DiscoveryEvent event : discovery.poll()) {
            if (event instanceof DiscoveryEvent.Discovered discovered) {
                if (discovered.address().equals(listenAddress)) {
                    log.debug("Ignoring peer {} announced at our own address {}", discovered.peer().shortId(), listenAddress);
                } else if (!discovered.peer().equals(self)) {
                    addPeer(discovered.peer(), discovered.address(), false);
                }
            } else if (event instanceof DiscoveryEvent.Expired expired) {
                onExpired(expired.peer());
            }
        }
    }

    private void onExpired(PeerId peer) {
        if (discovery.isKnown(peer)) {
            log.debug("Peer {} expired but is still announcing, keeping it", peer.shortId());
            return;
        }
        if (view.isPinned(peer)) {
            return;
        }
        if (view.remove(peer)) {
            providers.removePeer(peer);
            log.info("Peer {} left the partial view", peer.shortId());
        }
    }

    private void addPeer(PeerId peer, NetworkAddress address, boolean pinned) {
        boolean added = pinned ? view.pin(peer, address) : view.add(peer, address);
        if (added) {
            log.info("Peer {} at {} joined the partial view", peer.shortId(), address);
            if (!provided.isEmpty()) {
                messageBus.send(listenAddress, self, address, MessageType.PROVIDER_ANNOUNCE,
                        new ProviderAnnouncement(config.topic(), List.copyOf(provided)), MessageBus.newCorrelationId());
            }
        }
    }

    private void broadcastOnTopic(MessageType type, ProviderAnnouncement announcement) {
        if (listenAddress == null || view.isEmpty()) {
            return;
        }
        messageBus.broadcast(listenAddress, self, view.addresses(), type, announcement, MessageBus.newCorrelationId());
    }

    // ---- expiry ----

    private void expireOutstanding() {
        pendingArtifactRequests.tick();
        pendingDials.tick();

        Iterator<ProviderQueryCollector> queries = providerQueries.values().iterator();
        while (queries.hasNext()) {
            ProviderQueryCollector collector = queries.next();
            collector.tick();
            if (collector.isDone()) {
                queries.remove();
                collector.complete();
            }
        }

        List<OpenChannel> expired = new ArrayList<>();
        Iterator<OpenChannel> channels = openChannels.values().iterator();
        while (channels.hasNext()) {
            OpenChannel open = channels.next();
            open.timeout.tick();
            if (open.timeout.fired()) {
                channels.remove();
                expired.add(open);
            }
        }
        for (OpenChannel open : expired) {
            ArtifactRequest request = messageBus.decodePayload(open.request, ArtifactRequest.class);
            log.debug("Response channel for {} expired, answering not-found", request.artifactId());
            sendArtifactResponse(open.request, ArtifactResponse.notFound(request.artifactId()));
        }
    }

    private void sendArtifactResponse(Message request, ArtifactResponse response) {
        messageBus.reply(request, listenAddress, self, MessageType.ARTIFACT_RESPONSE, response);
    }

    private void requireListening() {
        if (listenAddress == null) {
            throw new IllegalStateException("Engine is not listening");
        }
    }

    private static void failIfPending(ListenableFuture<?> reply, Throwable error) {
        if (reply.isPending()) {
            reply.fail(error);
        }
    }

    // ---- inspection ----

    public int pendingRequestCount() {
        return pendingArtifactRequests.size();
    }

    public int openChannelCount() {
        return openChannels.size();
    }

    public NetworkAddress listenAddress() {
        return listenAddress;
    }

    @Override
    public void close() {
        running = false;
        if (eventLoop != null) {
            eventLoop.interrupt();
            try {
                eventLoop.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        IllegalStateException stopped = new IllegalStateException("Overlay engine stopped");
        Command command;
        while ((command = commands.poll()) != null) {
            failIfPending(command.reply(), stopped);
        }
        pendingArtifactRequests.failAll(stopped);
        pendingDials.failAll(stopped);
        providerQueries.values().forEach(ProviderQueryCollector::complete);
        providerQueries.clear();
        openChannels.clear();
        discovery.close();
        network.close();
        log.info("Overlay engine {} stopped", self.shortId());
    }

    private record OpenChannel(Message request, Timeout timeout) {}
}
