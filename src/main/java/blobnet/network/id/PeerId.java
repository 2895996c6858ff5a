package blobnet.network.id;

import java.util.Objects;

/**
 * Identity of a node in the overlay: the lowercase hex SHA-256 digest of its
 * encoded public key.
 */
public record PeerId(String value) implements Comparable<PeerId> {

    public PeerId {
        Objects.requireNonNull(value, "Peer id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Peer id cannot be blank");
        }
    }

    /**
     * Abbreviated form for log lines.
     */
    public String shortId() {
        return value.length() <= 8 ? value : value.substring(0, 8);
    }

    @Override
    public int compareTo(PeerId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
