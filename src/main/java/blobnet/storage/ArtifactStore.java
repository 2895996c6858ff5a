package blobnet.storage;

import java.io.InputStream;

/**
 * Content-addressed blob storage with digest verification and a disk quota.
 * <p>
 * All operations are synchronous and may block on disk I/O. They are called from
 * request worker threads, never from the overlay engine thread.
 */
public interface ArtifactStore extends AutoCloseable {

    /**
     * Streams {@code content} into the store under {@code hash}.
     *
     * @return {@code true} if the artifact was written, {@code false} if it was already stored
     * @throws blobnet.error.ArtifactException with {@code INTEGRITY_MISMATCH} if the content does
     *         not hash to {@code hash}, {@code QUOTA_EXCEEDED} if it does not fit in the available
     *         space, or {@code IO_ERROR} on disk failures. Nothing is visible under {@code hash}
     *         after a failure.
     */
    boolean put(ArtifactHash hash, InputStream content);

    /**
     * Returns exactly the bytes previously verified under {@code hash}.
     *
     * @throws blobnet.error.ArtifactException with {@code NOT_FOUND_LOCALLY} if absent
     */
    byte[] get(ArtifactHash hash);

    boolean contains(ArtifactHash hash);

    /**
     * Bytes that can still be accepted before the quota is exhausted.
     */
    long availableSpace();

    /**
     * The configured quota in bytes.
     */
    long allocatedSpace();

    long usedSpace();

    long artifactCount();

    /**
     * Share of the quota in use, in percent.
     */
    default double diskUsage() {
        long allocated = allocatedSpace();
        return allocated == 0 ? 0.0 : usedSpace() * 100.0 / allocated;
    }

    @Override
    void close();
}
