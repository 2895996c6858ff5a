package blobnet.overlay;

import blobnet.client.NetworkClient;
import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.future.ListenableFuture;
import blobnet.messaging.JsonMessageCodec;
import blobnet.messaging.NetworkAddress;
import blobnet.network.NetworkConfig;
import blobnet.network.SimulatedNetwork;
import blobnet.network.discovery.Discovery;
import blobnet.network.discovery.NoDiscovery;
import blobnet.network.discovery.SimulatedDiscovery;
import blobnet.network.id.NodeIdentity;
import blobnet.network.id.PeerId;
import blobnet.storage.ArtifactHash;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class OverlayEngineTest {

    private static final NetworkAddress ANY_PORT = new NetworkAddress("10.0.0.1", 0);
    private static final int MAX_TICKS = 10_000;

    private SimulatedNetwork.Hub hub;
    private SimulatedDiscovery.Registry registry;
    private final List<OverlayEngine> engines = new ArrayList<>();

    @BeforeEach
    void setUp() {
        hub = new SimulatedNetwork.Hub();
        registry = new SimulatedDiscovery.Registry();
    }

    @AfterEach
    void tearDown() {
        engines.forEach(OverlayEngine::close);
    }

    private OverlayEngine engine(NetworkConfig config) {
        return engine(config, new SimulatedDiscovery(registry));
    }

    private OverlayEngine engine(NetworkConfig config, Discovery discovery) {
        OverlayEngine engine = new OverlayEngine(NodeIdentity.generate(), new SimulatedNetwork(hub),
                discovery, new JsonMessageCodec(), config);
        engines.add(engine);
        return engine;
    }

    private OverlayEngine listeningEngine() {
        return listeningEngine(NetworkConfig.defaults());
    }

    private OverlayEngine listeningEngine(NetworkConfig config) {
        OverlayEngine engine = engine(config);
        await(engine.newClient().listen(ANY_PORT));
        return engine;
    }

    private void runUntil(Supplier<Boolean> condition) {
        int ticks = 0;
        while (!condition.get()) {
            engines.forEach(OverlayEngine::tick);
            if (++ticks > MAX_TICKS) {
                fail("Condition not met within " + MAX_TICKS + " ticks");
            }
        }
    }

    private void tick(int count) {
        for (int i = 0; i < count; i++) {
            engines.forEach(OverlayEngine::tick);
        }
    }

    private <T> T await(ListenableFuture<T> future) {
        runUntil(() -> !future.isPending());
        if (future.isFailed()) {
            fail("Expected success but failed with " + future.getException());
        }
        return future.getResult();
    }

    private ArtifactException awaitFailure(ListenableFuture<?> future) {
        runUntil(() -> !future.isPending());
        assertTrue(future.isFailed(), "Expected failure but got " + future);
        Throwable error = future.getException();
        assertInstanceOf(ArtifactException.class, error);
        return (ArtifactException) error;
    }

    private Set<PeerId> peersOf(OverlayEngine engine) {
        return await(engine.newClient().listPeers());
    }

    private void connectViaDiscovery(OverlayEngine a, OverlayEngine b) {
        runUntil(() -> peersOf(a).contains(b.peerId()) && peersOf(b).contains(a.peerId()));
    }

    private static ArtifactHash hashOf(String content) {
        return ArtifactHash.sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void listenShouldResolveEphemeralPort() {
        // Given
        OverlayEngine engine = engine(NetworkConfig.defaults());

        // When
        NetworkAddress bound = await(engine.newClient().listen(ANY_PORT));

        // Then
        assertEquals("10.0.0.1", bound.ipAddress());
        assertNotEquals(0, bound.port());
        assertEquals(bound, engine.listenAddress());
        assertTrue(hub.isAttached(bound));
    }

    @Test
    void secondListenShouldFail() {
        OverlayEngine engine = listeningEngine();

        ListenableFuture<NetworkAddress> again = engine.newClient().listen(ANY_PORT);
        runUntil(() -> !again.isPending());

        assertInstanceOf(IllegalStateException.class, again.getException());
    }

    @Test
    void peersShouldFindEachOtherThroughDiscovery() {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();

        // When/Then
        connectViaDiscovery(a, b);
        assertEquals(Set.of(b.peerId()), peersOf(a));
        assertEquals(Set.of(a.peerId()), peersOf(b));
    }

    @Test
    void peerAnnouncedAtOwnAddressShouldBeIgnored() {
        // Given
        OverlayEngine a = listeningEngine();
        PeerId impostor = new PeerId("impostor");

        // When
        registry.announce(impostor, a.listenAddress());
        tick(5);

        // Then
        assertTrue(peersOf(a).isEmpty());
        ArtifactException error = awaitFailure(a.newClient().requestArtifact(impostor, hashOf("loop")));
        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, error.kind());
        assertTrue(a.inboundEvents().isEmpty());
    }

    @Test
    void dialShouldAddPeerOnBothSides() {
        // Given
        OverlayEngine a = engine(NetworkConfig.defaults(), new NoDiscovery());
        OverlayEngine b = engine(NetworkConfig.defaults(), new NoDiscovery());
        await(a.newClient().listen(ANY_PORT));
        NetworkAddress addressB = await(b.newClient().listen(ANY_PORT));

        // When
        PeerId dialed = await(a.newClient().dial(b.peerId(), addressB));

        // Then
        assertEquals(b.peerId(), dialed);
        assertEquals(Set.of(b.peerId()), peersOf(a));
        assertEquals(Set.of(a.peerId()), peersOf(b));
    }

    @Test
    void dialShouldFailWhenAnotherPeerAnswers() {
        OverlayEngine a = engine(NetworkConfig.defaults(), new NoDiscovery());
        OverlayEngine b = engine(NetworkConfig.defaults(), new NoDiscovery());
        await(a.newClient().listen(ANY_PORT));
        NetworkAddress addressB = await(b.newClient().listen(ANY_PORT));

        ArtifactException error = awaitFailure(a.newClient().dial(new PeerId("someone-else"), addressB));

        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, error.kind());
        assertTrue(peersOf(a).isEmpty());
    }

    @Test
    void dialingOwnAddressShouldBeRejected() {
        OverlayEngine a = listeningEngine();

        ListenableFuture<PeerId> dial = a.newClient().dial(a.listenAddress());
        runUntil(() -> !dial.isPending());

        assertInstanceOf(IllegalArgumentException.class, dial.getException());
    }

    @Test
    void dialBeforeListenShouldFail() {
        OverlayEngine a = engine(NetworkConfig.defaults());

        ListenableFuture<PeerId> dial = a.newClient().dial(new NetworkAddress("10.0.0.9", 7000));
        runUntil(() -> !dial.isPending());

        assertInstanceOf(IllegalStateException.class, dial.getException());
    }

    @Test
    void providerAnnouncementShouldReachConnectedPeer() {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        ArtifactHash hash = hashOf("layer-1");

        // When
        await(a.newClient().provide(hash));

        // Then
        runUntil(() -> await(b.newClient().listProviders(hash)).contains(a.peerId()));
    }

    @Test
    void providersShouldBeFoundByQueryWhenAnnouncementWasMissed() {
        // Given: a provides before anyone else is around
        OverlayEngine a = listeningEngine();
        ArtifactHash hash = hashOf("layer-2");
        await(a.newClient().provide(hash));
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);

        // When
        Set<PeerId> providers = await(b.newClient().listProviders(hash));

        // Then
        assertEquals(Set.of(a.peerId()), providers);
    }

    @Test
    void stopProvidingShouldWithdrawRecord() {
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        ArtifactHash hash = hashOf("layer-3");
        await(a.newClient().provide(hash));
        runUntil(() -> await(b.newClient().listProviders(hash)).contains(a.peerId()));

        await(a.newClient().stopProviding(hash));

        runUntil(() -> await(b.newClient().listProviders(hash)).isEmpty());
    }

    @Test
    void providersOfUnknownArtifactShouldBeEmptyWithoutPeers() {
        OverlayEngine a = listeningEngine();

        assertTrue(await(a.newClient().listProviders(hashOf("nobody-has-this"))).isEmpty());
    }

    @Test
    void requestedArtifactShouldBeServedThroughResponseChannel() throws Exception {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        byte[] content = "blob-bytes".getBytes(StandardCharsets.UTF_8);
        ArtifactHash hash = ArtifactHash.sha256(content);

        // When
        ListenableFuture<byte[]> download = b.newClient().requestArtifact(a.peerId(), hash);
        runUntil(() -> !a.inboundEvents().isEmpty());
        InboundEvent.ArtifactRequested requested = (InboundEvent.ArtifactRequested) a.inboundEvents().take();
        a.newClient().respondArtifact(requested.channel(), content);

        // Then
        assertArrayEquals(content, await(download));
        assertEquals(hash, requested.hash());
        assertEquals(b.peerId(), requested.requester());
        assertEquals(0, a.openChannelCount());
        assertEquals(0, b.pendingRequestCount());
    }

    @Test
    void notFoundAnswerShouldFailTransfer() throws Exception {
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);

        ListenableFuture<byte[]> download = b.newClient().requestArtifact(a.peerId(), hashOf("missing"));
        runUntil(() -> !a.inboundEvents().isEmpty());
        InboundEvent.ArtifactRequested requested = (InboundEvent.ArtifactRequested) a.inboundEvents().take();
        a.newClient().respondNotFound(requested.channel());

        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, awaitFailure(download).kind());
    }

    @Test
    void requestToUnknownPeerShouldFailImmediately() {
        OverlayEngine a = listeningEngine();

        ArtifactException error = awaitFailure(a.newClient().requestArtifact(new PeerId("stranger"), hashOf("x")));

        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, error.kind());
        assertEquals(0, a.pendingRequestCount());
    }

    @Test
    void unansweredRequestShouldTimeOut() {
        // Given: a peer that announces itself but is not bound anywhere
        NetworkConfig config = NetworkConfig.builder().requestTimeoutTicks(20).build();
        OverlayEngine a = listeningEngine(config);
        PeerId ghost = new PeerId("ghost");
        registry.announce(ghost, new NetworkAddress("10.0.0.66", 6666));
        runUntil(() -> peersOf(a).contains(ghost));

        // When
        ListenableFuture<byte[]> download = a.newClient().requestArtifact(ghost, hashOf("y"));

        // Then
        assertEquals(ErrorKind.PEER_TIMEOUT, awaitFailure(download).kind());
        assertEquals(0, a.pendingRequestCount());
    }

    @Test
    void respondingTwiceOnSameChannelShouldFail() throws Exception {
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        byte[] content = "once".getBytes(StandardCharsets.UTF_8);
        ListenableFuture<byte[]> download = b.newClient().requestArtifact(a.peerId(), ArtifactHash.sha256(content));
        runUntil(() -> !a.inboundEvents().isEmpty());
        ResponseChannel channel = ((InboundEvent.ArtifactRequested) a.inboundEvents().take()).channel();

        await(a.newClient().respondArtifact(channel, content));
        ListenableFuture<Void> second = a.newClient().respondArtifact(channel, content);
        runUntil(() -> !second.isPending());

        assertInstanceOf(IllegalStateException.class, second.getException());
        assertArrayEquals(content, await(download));
    }

    @Test
    void expiredResponseChannelShouldAnswerNotFound() {
        // Given
        NetworkConfig config = NetworkConfig.builder().responseChannelTimeoutTicks(10).build();
        OverlayEngine a = listeningEngine(config);
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);

        // When: a's application never answers
        ListenableFuture<byte[]> download = b.newClient().requestArtifact(a.peerId(), hashOf("slow"));

        // Then
        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, awaitFailure(download).kind());
        assertEquals(0, a.openChannelCount());
    }

    @Test
    void fullEventQueueShouldAnswerNotFound() {
        NetworkConfig config = NetworkConfig.builder().eventQueueCapacity(1).build();
        OverlayEngine a = listeningEngine(config);
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);

        ListenableFuture<byte[]> first = b.newClient().requestArtifact(a.peerId(), hashOf("first"));
        runUntil(() -> a.inboundEvents().size() == 1);
        ListenableFuture<byte[]> second = b.newClient().requestArtifact(a.peerId(), hashOf("second"));

        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, awaitFailure(second).kind());
        assertTrue(first.isPending());
    }

    @Test
    void expiredRecordOfAnnouncingPeerShouldKeepIt() {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);

        // When
        registry.expireRecord(b.peerId());
        tick(5);

        // Then
        assertTrue(peersOf(a).contains(b.peerId()));
    }

    @Test
    void withdrawnPeerShouldLeaveViewAndProviderTable() {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        ArtifactHash hash = hashOf("layer-4");
        await(b.newClient().provide(hash));
        runUntil(() -> await(a.newClient().listProviders(hash)).contains(b.peerId()));

        // When
        registry.withdraw(b.peerId());

        // Then
        runUntil(() -> !peersOf(a).contains(b.peerId()));
        assertTrue(await(a.newClient().listProviders(hash)).isEmpty());
    }

    @Test
    void dialedPeerShouldSurviveDiscoveryExpiry() {
        OverlayEngine a = listeningEngine();
        OverlayEngine b = engine(NetworkConfig.defaults(), new NoDiscovery());
        NetworkAddress addressB = await(b.newClient().listen(ANY_PORT));
        await(a.newClient().dial(addressB));

        registry.announce(b.peerId(), addressB);
        registry.withdraw(b.peerId());
        tick(5);

        assertTrue(peersOf(a).contains(b.peerId()));
    }

    @Test
    void concurrentClientsShouldAllBeServed() throws Exception {
        // Given
        OverlayEngine a = listeningEngine();
        OverlayEngine b = listeningEngine();
        connectViaDiscovery(a, b);
        List<ArtifactHash> hashes = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            hashes.add(hashOf("artifact-" + i));
        }
        List<ListenableFuture<Void>> replies = Collections.synchronizedList(new ArrayList<>());

        // When: four threads share nothing but the engine
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            List<ArtifactHash> slice = hashes.subList(t * 50, (t + 1) * 50);
            threads.add(new Thread(() -> {
                NetworkClient client = a.newClient();
                slice.forEach(hash -> replies.add(client.provide(hash)));
            }));
        }
        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join();
        }
        runUntil(() -> replies.stream().noneMatch(ListenableFuture::isPending));

        // Then
        assertTrue(replies.stream().allMatch(ListenableFuture::isCompleted));
        for (ArtifactHash hash : List.of(hashes.get(0), hashes.get(99), hashes.get(199))) {
            runUntil(() -> await(b.newClient().listProviders(hash)).contains(a.peerId()));
        }
    }

    @Test
    void closeShouldFailQueuedCommands() {
        OverlayEngine a = engine(NetworkConfig.defaults());
        ListenableFuture<NetworkAddress> listen = a.newClient().listen(ANY_PORT);

        a.close();
        engines.remove(a);

        assertInstanceOf(IllegalStateException.class, listen.getException());
    }

    @Test
    void startedEngineShouldTickOnItsOwnThread() throws Exception {
        OverlayEngine a = engine(NetworkConfig.builder().tickIntervalMillis(1).build());
        engines.remove(a);
        try {
            a.start();
            NetworkAddress bound = a.newClient().listen(ANY_PORT).await(Duration.ofSeconds(5));
            assertEquals(bound, a.listenAddress());
        } finally {
            a.close();
        }
    }
}
