package blobnet.storage;

import blobnet.error.ArtifactException;
import blobnet.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores blobs as files under {@code <root>/<algorithm>/<first two hex chars>/<hex>}.
 * <p>
 * Content is first streamed into {@code <root>/staging} while its digest is computed.
 * Only verified content that fits the quota is moved into place, with an atomic
 * rename, so readers never observe a partial blob. The quota is checked while
 * streaming and again under the commit lock right before the rename.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path root;
    private final Path stagingDir;
    private final long quotaBytes;
    private final ArtifactIndex index;
    private final AtomicLong usedBytes = new AtomicLong();
    private final Object commitLock = new Object();

    public FileSystemArtifactStore(Path root, long quotaBytes, ArtifactIndex index) {
        if (root == null) {
            throw new IllegalArgumentException("Store root cannot be null");
        }
        if (quotaBytes <= 0) {
            throw new IllegalArgumentException("Quota must be positive, got: " + quotaBytes);
        }
        if (index == null) {
            throw new IllegalArgumentException("Index cannot be null");
        }
        this.root = root;
        this.stagingDir = root.resolve("staging");
        this.quotaBytes = quotaBytes;
        this.index = index;
        try {
            Files.createDirectories(stagingDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create store directories under " + root, e);
        }
        usedBytes.set(index.all().stream().mapToLong(ArtifactRecord::size).sum());
        log.info("Artifact store at {} holds {} artifacts, {} of {} bytes used",
                root, index.count(), usedBytes.get(), quotaBytes);
    }

    @Override
    public boolean put(ArtifactHash hash, InputStream content) {
        if (hash == null || content == null) {
            throw new IllegalArgumentException("Hash and content cannot be null");
        }
        Path target = blobPath(hash);
        if (Files.exists(target)) {
            reindexIfMissing(hash, target);
            log.debug("Artifact {} already stored, skipping write", hash);
            return false;
        }

        Path staging = stagingDir.resolve(UUID.randomUUID() + ".part");
        MessageDigest digest = hash.algorithm().newDigest();
        // Usable disk space shrinks while staging, so it is sampled only once
        long diskSpace = usableDiskSpace();
        long written = 0;
        try (OutputStream out = Files.newOutputStream(staging, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = content.read(buffer)) != -1) {
                written += read;
                if (written > Math.min(remainingQuota(), diskSpace)) {
                    throw quotaExceeded(hash, written);
                }
                digest.update(buffer, 0, read);
                out.write(buffer, 0, read);
            }
        } catch (IOException e) {
            discard(staging);
            throw ArtifactException.ioError("Failed to stage artifact " + hash, e);
        } catch (RuntimeException e) {
            discard(staging);
            throw e;
        }

        byte[] computed = digest.digest();
        if (!hash.matches(computed)) {
            discard(staging);
            throw ArtifactException.integrityMismatch(hash.id(),
                    hash.algorithm().wireName() + ":" + HexFormat.of().formatHex(computed));
        }
        return commit(hash, staging, target, written);
    }

    private boolean commit(ArtifactHash hash, Path staging, Path target, long size) {
        synchronized (commitLock) {
            if (Files.exists(target)) {
                discard(staging);
                return false;
            }
            // The staged bytes are already on disk; only the quota is left to check
            if (size > remainingQuota()) {
                discard(staging);
                throw quotaExceeded(hash, size);
            }
            try {
                Files.createDirectories(target.getParent());
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                discard(staging);
                throw ArtifactException.ioError("Failed to commit artifact " + hash, e);
            }
            usedBytes.addAndGet(size);
            index.put(new ArtifactRecord(hash.id(), size, System.currentTimeMillis()));
        }
        log.debug("Stored artifact {} ({} bytes)", hash, size);
        return true;
    }

    @Override
    public byte[] get(ArtifactHash hash) {
        Path target = blobPath(hash);
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            throw ArtifactException.notFoundLocally(hash.id());
        } catch (IOException e) {
            throw ArtifactException.ioError("Failed to read artifact " + hash, e);
        }
    }

    @Override
    public boolean contains(ArtifactHash hash) {
        return Files.exists(blobPath(hash));
    }

    @Override
    public long availableSpace() {
        return Math.min(remainingQuota(), usableDiskSpace());
    }

    private long remainingQuota() {
        return Math.max(0, quotaBytes - usedBytes.get());
    }

    /**
     * Free bytes on the file system holding the store, or {@code Long.MAX_VALUE}
     * if it cannot be determined.
     */
    long usableDiskSpace() {
        try {
            return Files.getFileStore(root).getUsableSpace();
        } catch (IOException e) {
            log.warn("Could not read usable space of {}: {}", root, e.getMessage());
            return Long.MAX_VALUE;
        }
    }

    @Override
    public long allocatedSpace() {
        return quotaBytes;
    }

    @Override
    public long usedSpace() {
        return usedBytes.get();
    }

    @Override
    public long artifactCount() {
        return index.count();
    }

    @Override
    public void close() {
        index.close();
    }

    Path blobPath(ArtifactHash hash) {
        String hex = hash.hex();
        return root.resolve(hash.algorithm().wireName()).resolve(hex.substring(0, 2)).resolve(hex);
    }

    private void reindexIfMissing(ArtifactHash hash, Path target) {
        synchronized (commitLock) {
            if (index.get(hash.id()).isPresent()) {
                return;
            }
            try {
                long size = Files.size(target);
                index.put(new ArtifactRecord(hash.id(), size, Files.getLastModifiedTime(target).toMillis()));
                usedBytes.addAndGet(size);
                log.info("Re-indexed artifact {} found on disk without an index entry", hash);
            } catch (IOException e) {
                throw ArtifactException.ioError("Failed to re-index artifact " + hash, e);
            }
        }
    }

    private static ArtifactException quotaExceeded(ArtifactHash hash, long size) {
        return new ArtifactException(ErrorKind.QUOTA_EXCEEDED,
                "Not enough space left to store artifact " + hash + " (" + size + " bytes)");
    }

    private static void discard(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("Failed to delete staging file {}: {}", staging, e.getMessage());
        }
    }
}
