package blobnet.storage;

import java.util.Objects;

/**
 * Index entry for a stored artifact.
 *
 * @param id the artifact identifier, e.g. {@code sha256:<hex>}
 * @param size content length in bytes
 * @param storedAt epoch millis of the commit
 */
public record ArtifactRecord(String id, long size, long storedAt) {
    public ArtifactRecord {
        Objects.requireNonNull(id, "Artifact id cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Artifact size cannot be negative: " + size);
        }
    }
}
