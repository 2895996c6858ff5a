package blobnet.messaging;

public record ArtifactRequest(String artifactId) {
    public ArtifactRequest {
        if (artifactId == null || artifactId.isBlank()) {
            throw new IllegalArgumentException("Artifact id cannot be null or blank");
        }
    }
}
