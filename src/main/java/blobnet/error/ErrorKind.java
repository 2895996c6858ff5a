package blobnet.error;

/**
 * Failure taxonomy shared by the store, the overlay and the retrieval cascade.
 */
public enum ErrorKind {
    /** Recomputed digest disagrees with the claimed hash. The next source is tried, never the same one. */
    INTEGRITY_MISMATCH(true),
    /** Not enough local space to accept the artifact. */
    QUOTA_EXCEEDED(false),
    /** The artifact is not in the local store. */
    NOT_FOUND_LOCALLY(true),
    /** No peer is known to provide the artifact. */
    NO_PROVIDERS(true),
    PEER_TIMEOUT(true),
    PEER_TRANSFER_FAILED(true),
    ORIGIN_UNAUTHORIZED(false),
    ORIGIN_NOT_FOUND(false),
    IO_ERROR(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Whether the retrieval cascade moves on to the next tier on this failure
     * instead of surfacing it.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
