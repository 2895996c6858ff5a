package blobnet.network.id;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdentityTest {

    @Test
    void peerIdShouldDeriveFromPublicKey() {
        NodeIdentity identity = NodeIdentity.generate();

        assertEquals(NodeIdentity.peerIdOf(identity.publicKey()), identity.peerId());
        assertTrue(identity.peerId().value().matches("[0-9a-f]{64}"));
    }

    @Test
    void separateIdentitiesShouldDiffer() {
        assertNotEquals(NodeIdentity.generate().peerId(), NodeIdentity.generate().peerId());
    }

    @Test
    void shortIdShouldAbbreviate() {
        PeerId peer = new PeerId("0123456789abcdef");

        assertEquals("01234567", peer.shortId());
        assertEquals("abc", new PeerId("abc").shortId());
    }

    @Test
    void blankPeerIdShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PeerId(" "));
        assertThrows(NullPointerException.class, () -> new PeerId(null));
    }
}
