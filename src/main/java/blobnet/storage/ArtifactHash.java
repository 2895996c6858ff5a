package blobnet.storage;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content address of an artifact: a digest algorithm plus the raw digest.
 * <p>
 * The string form is {@code "sha256:<lowercase hex>"}. Decoding strips exactly
 * {@link HashAlgorithm#PREFIX_LENGTH} characters before hex-decoding the digest.
 */
public record ArtifactHash(HashAlgorithm algorithm, byte[] digest) {

    private static final HexFormat HEX = HexFormat.of();

    public ArtifactHash {
        Objects.requireNonNull(algorithm, "Algorithm cannot be null");
        Objects.requireNonNull(digest, "Digest cannot be null");
        if (digest.length != algorithm.digestLength()) {
            throw new IllegalArgumentException("Digest for " + algorithm.wireName() + " must be "
                    + algorithm.digestLength() + " bytes, got: " + digest.length);
        }
        digest = Arrays.copyOf(digest, digest.length);
    }

    /**
     * Parses an identifier such as {@code sha256:e3b0c442...}.
     *
     * @throws IllegalArgumentException if the prefix or the hex digest is malformed
     */
    public static ArtifactHash parse(String id) {
        if (id == null || id.length() <= HashAlgorithm.PREFIX_LENGTH
                || id.charAt(HashAlgorithm.PREFIX_LENGTH - 1) != ':') {
            throw new IllegalArgumentException("Invalid artifact identifier: " + id);
        }
        HashAlgorithm algorithm = HashAlgorithm.fromWireName(id.substring(0, HashAlgorithm.PREFIX_LENGTH - 1));
        try {
            return new ArtifactHash(algorithm, HEX.parseHex(id.substring(HashAlgorithm.PREFIX_LENGTH)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid artifact identifier: " + id, e);
        }
    }

    public static ArtifactHash of(HashAlgorithm algorithm, byte[] content) {
        return new ArtifactHash(algorithm, algorithm.newDigest().digest(content));
    }

    public static ArtifactHash sha256(byte[] content) {
        return of(HashAlgorithm.SHA256, content);
    }

    @Override
    public byte[] digest() {
        return Arrays.copyOf(digest, digest.length);
    }

    public String hex() {
        return HEX.formatHex(digest);
    }

    /**
     * Compares a freshly computed digest with this hash without copying.
     */
    public boolean matches(byte[] computedDigest) {
        return Arrays.equals(digest, computedDigest);
    }

    public String id() {
        return algorithm.wireName() + ":" + hex();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArtifactHash other)) return false;
        return algorithm == other.algorithm && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return id();
    }
}
