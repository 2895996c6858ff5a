package blobnet.storage;

import blobnet.messaging.JsonMessageCodec;
import blobnet.messaging.MessageCodec;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * RocksDB backed artifact index. Keys are artifact ids in UTF-8, values are
 * {@link ArtifactRecord}s encoded with the message codec.
 */
public class RocksDbArtifactIndex implements ArtifactIndex {

    private static final Logger log = LoggerFactory.getLogger(RocksDbArtifactIndex.class);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final Options options;
    private final MessageCodec codec;
    private final String dbPath;

    public RocksDbArtifactIndex(String dbPath) {
        this(dbPath, new JsonMessageCodec());
    }

    public RocksDbArtifactIndex(String dbPath, MessageCodec codec) {
        if (dbPath == null) {
            throw new IllegalArgumentException("Database path cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        this.dbPath = dbPath;
        this.codec = codec;

        File dbDir = new File(dbPath);
        if (!dbDir.exists() && !dbDir.mkdirs()) {
            throw new IllegalStateException("Failed to create index directory: " + dbPath);
        }

        this.options = new Options().setCreateIfMissing(true);
        try {
            this.db = RocksDB.open(options, dbPath);
        } catch (RocksDBException e) {
            options.close();
            throw new IllegalStateException("Failed to open artifact index at " + dbPath, e);
        }
        log.info("Opened artifact index at {}", dbPath);
    }

    @Override
    public Optional<ArtifactRecord> get(String id) {
        try {
            byte[] value = db.get(key(id));
            return value == null ? Optional.empty() : Optional.of(codec.decode(value, ArtifactRecord.class));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to read index entry " + id, e);
        }
    }

    @Override
    public void put(ArtifactRecord record) {
        try {
            db.put(key(record.id()), codec.encode(record));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to write index entry " + record.id(), e);
        }
    }

    @Override
    public void remove(String id) {
        try {
            db.delete(key(id));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to delete index entry " + id, e);
        }
    }

    @Override
    public List<ArtifactRecord> all() {
        List<ArtifactRecord> records = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                records.add(codec.decode(iterator.value(), ArtifactRecord.class));
            }
        }
        return records;
    }

    @Override
    public long count() {
        long count = 0;
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void close() {
        db.close();
        options.close();
        log.info("Closed artifact index at {}", dbPath);
    }

    private static byte[] key(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }
}
