package blobnet.messaging;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;
import java.util.Objects;

public record ArtifactResponse(String artifactId, Status status, byte[] content, String error) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        ERROR
    }

    public ArtifactResponse {
        Objects.requireNonNull(artifactId, "Artifact id cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        if (status == Status.FOUND && content == null) {
            throw new IllegalArgumentException("Found response must carry content");
        }
    }

    public static ArtifactResponse found(String artifactId, byte[] content) {
        return new ArtifactResponse(artifactId, Status.FOUND, content, null);
    }

    public static ArtifactResponse notFound(String artifactId) {
        return new ArtifactResponse(artifactId, Status.NOT_FOUND, null, null);
    }

    public static ArtifactResponse error(String artifactId, String error) {
        return new ArtifactResponse(artifactId, Status.ERROR, null, error);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == Status.FOUND;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArtifactResponse that)) return false;
        return artifactId.equals(that.artifactId) && status == that.status
                && Arrays.equals(content, that.content) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(artifactId, status, Arrays.hashCode(content), error);
    }

    @Override
    public String toString() {
        return "ArtifactResponse{" + artifactId + ", " + status
                + (content != null ? ", " + content.length + "B" : "")
                + (error != null ? ", error=" + error : "") + "}";
    }
}
