package blobnet.overlay;

import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import blobnet.future.ListenableFuture;
import blobnet.messaging.JsonMessageCodec;
import blobnet.messaging.NetworkAddress;
import blobnet.network.NetworkConfig;
import blobnet.network.NioNetwork;
import blobnet.network.discovery.NoDiscovery;
import blobnet.network.id.NodeIdentity;
import blobnet.storage.ArtifactHash;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class OverlayEngineNioTest {

    private static final NetworkAddress LOOPBACK = new NetworkAddress("127.0.0.1", 0);

    private final List<OverlayEngine> engines = new ArrayList<>();

    @AfterEach
    void tearDown() {
        engines.forEach(OverlayEngine::close);
    }

    private OverlayEngine engine(NetworkConfig config) {
        JsonMessageCodec codec = new JsonMessageCodec();
        OverlayEngine engine = new OverlayEngine(NodeIdentity.generate(), new NioNetwork(codec, config),
                new NoDiscovery(), codec, config);
        engines.add(engine);
        return engine;
    }

    private void runUntil(Supplier<Boolean> condition) {
        long startTime = System.currentTimeMillis();
        while (!condition.get()) {
            engines.forEach(OverlayEngine::tick);
            if (System.currentTimeMillis() - startTime > 5000) {
                fail("Timeout waiting for condition to be met");
            }
            Thread.yield();
        }
    }

    private <T> T await(ListenableFuture<T> future) {
        runUntil(() -> !future.isPending());
        if (future.isFailed()) {
            fail("Expected success but failed with " + future.getException());
        }
        return future.getResult();
    }

    @Test
    void artifactTooLargeToFrameShouldFailRequesterWithoutTimeout() {
        // Given: frames are capped well below the artifact size and requests never time out
        NetworkConfig config = NetworkConfig.builder()
                .maxFrameBytes(4096)
                .requestTimeoutTicks(1_000_000)
                .build();
        OverlayEngine a = engine(config);
        OverlayEngine b = engine(config);
        NetworkAddress addressA = await(a.newClient().listen(LOOPBACK));
        await(b.newClient().listen(LOOPBACK));
        await(b.newClient().dial(a.peerId(), addressA));

        byte[] content = new byte[16 * 1024];
        Arrays.fill(content, (byte) 'x');
        ArtifactHash hash = ArtifactHash.sha256(content);

        // When
        ListenableFuture<byte[]> fetch = b.newClient().requestArtifact(a.peerId(), hash);
        runUntil(() -> !a.inboundEvents().isEmpty());
        InboundEvent.ArtifactRequested requested = (InboundEvent.ArtifactRequested) a.inboundEvents().poll();
        ListenableFuture<Void> respond = a.newClient().respondArtifact(requested.channel(), content);
        runUntil(() -> !fetch.isPending() && !respond.isPending());

        // Then
        assertTrue(respond.isFailed());
        assertInstanceOf(IllegalArgumentException.class, respond.getException());
        assertTrue(fetch.isFailed());
        ArtifactException error = assertInstanceOf(ArtifactException.class, fetch.getException());
        assertEquals(ErrorKind.PEER_TRANSFER_FAILED, error.kind());
    }
}
