package blobnet.origin;

import blobnet.storage.ArtifactHash;

/**
 * Upstream registry that serves blobs by repository name and digest.
 */
public interface OriginRegistry {

    /**
     * Fetches the blob {@code hash} of repository {@code name}. The content is not
     * verified against the hash.
     *
     * @throws blobnet.error.ArtifactException with ORIGIN_UNAUTHORIZED, ORIGIN_NOT_FOUND or IO_ERROR
     */
    byte[] fetchBlob(String name, ArtifactHash hash);
}
