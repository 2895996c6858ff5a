package blobnet.error;

import java.util.Objects;

/**
 * Unchecked failure of an artifact operation, tagged with its {@link ErrorKind}.
 */
public class ArtifactException extends RuntimeException {

    private final ErrorKind kind;

    public ArtifactException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
    }

    public ArtifactException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static ArtifactException integrityMismatch(String expected, String actual) {
        return new ArtifactException(ErrorKind.INTEGRITY_MISMATCH,
                "Digest mismatch: expected " + expected + " but content hashed to " + actual);
    }

    public static ArtifactException notFoundLocally(String hashId) {
        return new ArtifactException(ErrorKind.NOT_FOUND_LOCALLY, "Artifact not found locally: " + hashId);
    }

    public static ArtifactException peerTimeout(String hashId) {
        return new ArtifactException(ErrorKind.PEER_TIMEOUT, "Timed out waiting for peer to send " + hashId);
    }

    public static ArtifactException ioError(String message, Throwable cause) {
        return new ArtifactException(ErrorKind.IO_ERROR, message, cause);
    }

    @Override
    public String toString() {
        return "ArtifactException{" + kind + ": " + getMessage() + "}";
    }
}
