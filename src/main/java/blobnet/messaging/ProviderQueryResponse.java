package blobnet.messaging;

public record ProviderQueryResponse(String artifactId, boolean provides) {
}
