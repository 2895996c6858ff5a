package blobnet.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RocksDbArtifactIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreAndReadRecords() {
        try (RocksDbArtifactIndex index = new RocksDbArtifactIndex(tempDir.resolve("index").toString())) {
            // Given
            ArtifactRecord record = new ArtifactRecord("sha256:aa", 42, 1_000L);

            // When
            index.put(record);

            // Then
            assertEquals(record, index.get("sha256:aa").orElseThrow());
            assertTrue(index.get("sha256:bb").isEmpty());
            assertEquals(1, index.count());
        }
    }

    @Test
    void shouldRemoveRecords() {
        try (RocksDbArtifactIndex index = new RocksDbArtifactIndex(tempDir.resolve("index").toString())) {
            index.put(new ArtifactRecord("sha256:aa", 1, 1L));
            index.put(new ArtifactRecord("sha256:bb", 2, 2L));

            index.remove("sha256:aa");

            assertEquals(1, index.all().size());
            assertEquals("sha256:bb", index.all().get(0).id());
        }
    }

    @Test
    void storeShouldRecoverAccountingFromPersistedIndex() {
        // Given - a store that wrote one artifact and was closed
        String indexPath = tempDir.resolve("index").toString();
        Path blobs = tempDir.resolve("blobs");
        byte[] content = new byte[128];
        ArtifactHash hash = ArtifactHash.sha256(content);
        try (FileSystemArtifactStore store = new FileSystemArtifactStore(blobs, 10_000, new RocksDbArtifactIndex(indexPath))) {
            store.put(hash, new ByteArrayInputStream(content));
        }

        // When
        try (FileSystemArtifactStore reopened = new FileSystemArtifactStore(blobs, 10_000, new RocksDbArtifactIndex(indexPath))) {
            // Then
            assertEquals(1, reopened.artifactCount());
            assertEquals(128, reopened.usedSpace());
            assertArrayEquals(content, reopened.get(hash));
        }
    }
}
