package blobnet.messaging;

public record ProviderQuery(String topic, String artifactId) {
}
