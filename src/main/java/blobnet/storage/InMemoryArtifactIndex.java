package blobnet.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent index used by tests and by nodes running without RocksDB.
 */
public class InMemoryArtifactIndex implements ArtifactIndex {

    private final Map<String, ArtifactRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ArtifactRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public void put(ArtifactRecord record) {
        records.put(record.id(), record);
    }

    @Override
    public void remove(String id) {
        records.remove(id);
    }

    @Override
    public List<ArtifactRecord> all() {
        return new ArrayList<>(records.values());
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public void close() {
        // nothing to release
    }
}
