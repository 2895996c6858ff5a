package blobnet.network.id;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.util.HexFormat;

/**
 * Ed25519 key pair generated once per process, and the {@link PeerId} derived
 * from its public key. Passed explicitly to the components that need it.
 */
public final class NodeIdentity {

    private final KeyPair keyPair;
    private final PeerId peerId;

    private NodeIdentity(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.peerId = peerIdOf(keyPair.getPublic());
    }

    public static NodeIdentity generate() {
        try {
            return new NodeIdentity(KeyPairGenerator.getInstance("Ed25519").generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 key generation is not available", e);
        }
    }

    public static PeerId peerIdOf(PublicKey publicKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
            return new PeerId(HexFormat.of().formatHex(digest));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public PeerId peerId() {
        return peerId;
    }

    public PublicKey publicKey() {
        return keyPair.getPublic();
    }

    @Override
    public String toString() {
        return "NodeIdentity{" + peerId.shortId() + "}";
    }
}
