package blobnet.storage;

import java.util.List;
import java.util.Optional;

/**
 * Accounting index of the artifacts committed to a store. The blob files are the
 * source of truth for content; the index answers counts and used space without
 * walking the file tree.
 */
public interface ArtifactIndex extends AutoCloseable {

    Optional<ArtifactRecord> get(String id);

    void put(ArtifactRecord record);

    void remove(String id);

    List<ArtifactRecord> all();

    long count();

    @Override
    void close();
}
