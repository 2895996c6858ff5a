package blobnet.storage;

import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStoreTest {

    @TempDir
    Path root;

    private FileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(root, 1_000, new InMemoryArtifactIndex());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldReturnExactlyTheStoredBytes() {
        // Given
        byte[] content = bytes("layer-content");
        ArtifactHash hash = ArtifactHash.sha256(content);

        // When
        boolean written = store.put(hash, new ByteArrayInputStream(content));

        // Then
        assertTrue(written);
        assertTrue(store.contains(hash));
        assertArrayEquals(content, store.get(hash));
        assertEquals(content.length, store.usedSpace());
        assertEquals(1, store.artifactCount());
    }

    @Test
    void shouldRejectContentThatDoesNotMatchItsHash() {
        // Given
        ArtifactHash hash = ArtifactHash.sha256(bytes("expected"));
        long before = store.availableSpace();

        // When
        ArtifactException e = assertThrows(ArtifactException.class,
                () -> store.put(hash, new ByteArrayInputStream(bytes("something else"))));

        // Then - nothing retrievable, nothing left in staging
        assertEquals(ErrorKind.INTEGRITY_MISMATCH, e.kind());
        assertFalse(store.contains(hash));
        assertEquals(ErrorKind.NOT_FOUND_LOCALLY, assertThrows(ArtifactException.class, () -> store.get(hash)).kind());
        assertEquals(before, store.availableSpace());
        assertStagingEmpty();
    }

    @Test
    void secondPutOfSameArtifactShouldBeNoOp() {
        // Given
        byte[] content = bytes("idempotent");
        ArtifactHash hash = ArtifactHash.sha256(content);
        store.put(hash, new ByteArrayInputStream(content));
        long used = store.usedSpace();

        // When
        boolean written = store.put(hash, new ByteArrayInputStream(content));

        // Then
        assertFalse(written);
        assertEquals(used, store.usedSpace());
        assertEquals(1, store.artifactCount());
    }

    @Test
    void shouldRejectContentLargerThanAvailableSpace() {
        // Given
        byte[] content = new byte[1_500];
        ArtifactHash hash = ArtifactHash.sha256(content);
        long before = store.availableSpace();

        // When
        ArtifactException e = assertThrows(ArtifactException.class,
                () -> store.put(hash, new ByteArrayInputStream(content)));

        // Then
        assertEquals(ErrorKind.QUOTA_EXCEEDED, e.kind());
        assertEquals(before, store.availableSpace());
        assertFalse(store.contains(hash));
        assertStagingEmpty();
    }

    @Test
    void blobThatFitsOnNearlyFullDiskShouldBeStored() {
        // Given - 100 MB quota on a disk with 2 MB free, shrinking as staging grows
        FileSystemArtifactStore smallDisk = new SmallDiskStore(root.resolve("small"), 2 * 1024 * 1024);
        byte[] content = new byte[1_258_291];
        new Random(7).nextBytes(content);
        ArtifactHash hash = ArtifactHash.sha256(content);

        // When
        boolean written = smallDisk.put(hash, new ByteArrayInputStream(content));

        // Then
        assertTrue(written);
        assertArrayEquals(content, smallDisk.get(hash));
    }

    @Test
    void blobLargerThanFreeDiskShouldBeRejected() {
        FileSystemArtifactStore smallDisk = new SmallDiskStore(root.resolve("small"), 2 * 1024 * 1024);
        byte[] content = new byte[3 * 1024 * 1024];
        ArtifactHash hash = ArtifactHash.sha256(content);

        ArtifactException e = assertThrows(ArtifactException.class,
                () -> smallDisk.put(hash, new ByteArrayInputStream(content)));

        assertEquals(ErrorKind.QUOTA_EXCEEDED, e.kind());
        assertFalse(smallDisk.contains(hash));
    }

    @Test
    void concurrentPutsShouldNotCommitPastQuota() throws Exception {
        // Given - ten distinct 300-byte artifacts, only three fit in 1000 bytes
        List<byte[]> contents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            byte[] content = new byte[300];
            content[0] = (byte) i;
            contents.add(content);
        }
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger stored = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Thread> threads = new ArrayList<>();
        for (byte[] content : contents) {
            threads.add(new Thread(() -> {
                try {
                    start.await();
                    store.put(ArtifactHash.sha256(content), new ByteArrayInputStream(content));
                    stored.incrementAndGet();
                } catch (ArtifactException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
        }

        // When
        threads.forEach(Thread::start);
        start.countDown();
        for (Thread t : threads) {
            t.join();
        }

        // Then
        assertEquals(3, stored.get());
        assertEquals(7, rejected.get());
        assertEquals(900, store.usedSpace());
    }

    @Test
    void shouldRebuildUsedSpaceFromIndexOnReopen() {
        // Given
        InMemoryArtifactIndex index = new InMemoryArtifactIndex();
        FileSystemArtifactStore first = new FileSystemArtifactStore(root.resolve("s"), 1_000, index);
        byte[] content = bytes("persisted");
        first.put(ArtifactHash.sha256(content), new ByteArrayInputStream(content));

        // When
        FileSystemArtifactStore reopened = new FileSystemArtifactStore(root.resolve("s"), 1_000, index);

        // Then
        assertEquals(content.length, reopened.usedSpace());
        assertArrayEquals(content, reopened.get(ArtifactHash.sha256(content)));
    }

    @Test
    void shouldReindexBlobFoundWithoutIndexRecord() {
        // Given - a blob on disk whose index was lost
        byte[] content = bytes("orphan");
        ArtifactHash hash = ArtifactHash.sha256(content);
        store.put(hash, new ByteArrayInputStream(content));
        FileSystemArtifactStore withEmptyIndex = new FileSystemArtifactStore(root, 1_000, new InMemoryArtifactIndex());
        assertEquals(0, withEmptyIndex.artifactCount());

        // When
        boolean written = withEmptyIndex.put(hash, new ByteArrayInputStream(content));

        // Then
        assertFalse(written);
        assertEquals(1, withEmptyIndex.artifactCount());
        assertEquals(content.length, withEmptyIndex.usedSpace());
    }

    @Test
    void shouldLayOutBlobsByAlgorithmAndPrefix() {
        byte[] content = bytes("layout");
        ArtifactHash hash = ArtifactHash.sha256(content);

        store.put(hash, new ByteArrayInputStream(content));

        Path expected = root.resolve("sha256").resolve(hash.hex().substring(0, 2)).resolve(hash.hex());
        assertEquals(expected, store.blobPath(hash));
        assertTrue(Files.isRegularFile(expected));
    }

    @Test
    void diskUsageShouldBePercentOfQuota() {
        byte[] content = new byte[250];

        store.put(ArtifactHash.sha256(content), new ByteArrayInputStream(content));

        assertEquals(1_000, store.allocatedSpace());
        assertEquals(25.0, store.diskUsage(), 0.0001);
    }

    /**
     * Reports a fixed amount of free disk minus whatever currently sits in staging,
     * the way a real file system does.
     */
    private static final class SmallDiskStore extends FileSystemArtifactStore {
        private final Path stagingDir;
        private final long freeBytes;

        SmallDiskStore(Path root, long freeBytes) {
            super(root, 100_000_000, new InMemoryArtifactIndex());
            this.stagingDir = root.resolve("staging");
            this.freeBytes = freeBytes;
        }

        @Override
        long usableDiskSpace() {
            try (Stream<Path> files = Files.list(stagingDir)) {
                long staged = files.mapToLong(file -> file.toFile().length()).sum();
                return Math.max(0, freeBytes - staged);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private void assertStagingEmpty() {
        try (Stream<Path> files = Files.list(root.resolve("staging"))) {
            assertEquals(0, files.count());
        } catch (IOException e) {
            fail(e);
        }
    }
}
