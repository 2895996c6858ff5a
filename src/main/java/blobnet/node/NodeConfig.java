package blobnet.node;

import blobnet.messaging.NetworkAddress;
import blobnet.network.NetworkConfig;
import blobnet.origin.DockerHubRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings of one node. Immutable; build with {@link #builder()} or start from a
 * properties file with {@link #fromProperties(Properties)} and override.
 */
public final class NodeConfig {

    public static final String DEFAULT_QUOTA = "10 GB";

    private static final Pattern SIZE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-zA-Z]*)");

    private final NetworkAddress listenAddress;
    private final List<NetworkAddress> bootstrapPeers;
    private final Path storageDir;
    private final long quotaBytes;
    private final boolean multicastDiscovery;
    private final String originAuthUrl;
    private final String originRegistryUrl;
    private final String originService;
    private final Duration originTimeout;
    private final Duration awaitTimeout;
    private final NetworkConfig networkConfig;

    private NodeConfig(Builder builder) {
        this.listenAddress = builder.listenAddress;
        this.bootstrapPeers = List.copyOf(builder.bootstrapPeers);
        this.storageDir = builder.storageDir;
        this.quotaBytes = builder.quotaBytes;
        this.multicastDiscovery = builder.multicastDiscovery;
        this.originAuthUrl = builder.originAuthUrl;
        this.originRegistryUrl = builder.originRegistryUrl;
        this.originService = builder.originService;
        this.originTimeout = builder.originTimeout;
        this.awaitTimeout = builder.awaitTimeout;
        this.networkConfig = builder.networkConfig.build();

        validate();
    }

    private void validate() {
        if (listenAddress == null) {
            throw new IllegalArgumentException("listenAddress must be set");
        }
        if (storageDir == null) {
            throw new IllegalArgumentException("storageDir must be set");
        }
        if (quotaBytes <= 0) {
            throw new IllegalArgumentException("quota must be positive");
        }
        if (originTimeout == null || originTimeout.isNegative() || originTimeout.isZero()) {
            throw new IllegalArgumentException("originTimeout must be positive");
        }
        if (awaitTimeout == null || awaitTimeout.isNegative() || awaitTimeout.isZero()) {
            throw new IllegalArgumentException("awaitTimeout must be positive");
        }
    }

    public NetworkAddress listenAddress() {
        return listenAddress;
    }

    public List<NetworkAddress> bootstrapPeers() {
        return bootstrapPeers;
    }

    public Path storageDir() {
        return storageDir;
    }

    public long quotaBytes() {
        return quotaBytes;
    }

    public boolean multicastDiscovery() {
        return multicastDiscovery;
    }

    public String originAuthUrl() {
        return originAuthUrl;
    }

    public String originRegistryUrl() {
        return originRegistryUrl;
    }

    public String originService() {
        return originService;
    }

    public Duration originTimeout() {
        return originTimeout;
    }

    /**
     * Upper bound on waiting for any single overlay engine reply.
     */
    public Duration awaitTimeout() {
        return awaitTimeout;
    }

    public NetworkConfig networkConfig() {
        return networkConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Properties loadProperties(Path file) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        }
        return properties;
    }

    /**
     * Starts a builder from {@code blobnet.*} properties. Missing keys keep their defaults.
     */
    public static Builder fromProperties(Properties properties) {
        Builder builder = builder();
        String listen = properties.getProperty("blobnet.listen");
        if (listen != null) builder.listenAddress(NetworkAddress.parse(listen.trim()));
        String peers = properties.getProperty("blobnet.peers");
        if (peers != null) builder.bootstrapPeers(parseAddresses(peers));
        String storage = properties.getProperty("blobnet.storage");
        if (storage != null) builder.storageDir(Path.of(storage.trim()));
        String quota = properties.getProperty("blobnet.quota");
        if (quota != null) builder.quota(quota);
        String multicast = properties.getProperty("blobnet.discovery.multicast");
        if (multicast != null) builder.multicastDiscovery(Boolean.parseBoolean(multicast.trim()));
        String authUrl = properties.getProperty("blobnet.origin.auth-url");
        if (authUrl != null) builder.originAuthUrl(authUrl.trim());
        String registryUrl = properties.getProperty("blobnet.origin.registry-url");
        if (registryUrl != null) builder.originRegistryUrl(registryUrl.trim());
        String service = properties.getProperty("blobnet.origin.service");
        if (service != null) builder.originService(service.trim());

        NetworkConfig.Builder network = NetworkConfig.builder();
        String tickInterval = properties.getProperty("blobnet.tick-interval-ms");
        if (tickInterval != null) network.tickIntervalMillis(Long.parseLong(tickInterval.trim()));
        String requestTimeout = properties.getProperty("blobnet.request-timeout-ticks");
        if (requestTimeout != null) network.requestTimeoutTicks(Long.parseLong(requestTimeout.trim()));
        String queryWindow = properties.getProperty("blobnet.provider-query-window-ticks");
        if (queryWindow != null) network.providerQueryWindowTicks(Long.parseLong(queryWindow.trim()));
        String topic = properties.getProperty("blobnet.topic");
        if (topic != null) network.topic(topic.trim());
        return builder.networkConfig(network);
    }

    public static List<NetworkAddress> parseAddresses(String commaSeparated) {
        if (commaSeparated.isBlank()) {
            return List.of();
        }
        return Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(NetworkAddress::parse)
                .toList();
    }

    /**
     * Parses sizes such as {@code 10 GB}, {@code 512MiB} or {@code 1024}. Decimal
     * units are powers of 1000, binary units ({@code KiB}...) powers of 1024.
     */
    public static long parseSize(String size) {
        Matcher m = SIZE.matcher(size.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid size: " + size);
        }
        double value = Double.parseDouble(m.group(1));
        long multiplier;
        switch (m.group(2).toUpperCase(Locale.ROOT)) {
            case "", "B" -> multiplier = 1L;
            case "KB" -> multiplier = 1_000L;
            case "MB" -> multiplier = 1_000_000L;
            case "GB" -> multiplier = 1_000_000_000L;
            case "TB" -> multiplier = 1_000_000_000_000L;
            case "KIB" -> multiplier = 1L << 10;
            case "MIB" -> multiplier = 1L << 20;
            case "GIB" -> multiplier = 1L << 30;
            case "TIB" -> multiplier = 1L << 40;
            default -> throw new IllegalArgumentException("Unknown size unit in: " + size);
        }
        return (long) (value * multiplier);
    }

    @Override
    public String toString() {
        return "NodeConfig{listen=" + listenAddress + ", peers=" + bootstrapPeers + ", storage=" + storageDir
                + ", quotaBytes=" + quotaBytes + ", multicastDiscovery=" + multicastDiscovery
                + ", origin=" + originRegistryUrl + ", " + networkConfig + "}";
    }

    public static final class Builder {
        private NetworkAddress listenAddress = new NetworkAddress("localhost", 7888);
        private List<NetworkAddress> bootstrapPeers = new ArrayList<>();
        private Path storageDir = Path.of("blobnet-data");
        private long quotaBytes = parseSize(DEFAULT_QUOTA);
        private boolean multicastDiscovery = true;
        private String originAuthUrl = DockerHubRegistry.DEFAULT_AUTH_URL;
        private String originRegistryUrl = DockerHubRegistry.DEFAULT_REGISTRY_URL;
        private String originService = DockerHubRegistry.DEFAULT_SERVICE;
        private Duration originTimeout = Duration.ofSeconds(60);
        private Duration awaitTimeout = Duration.ofSeconds(60);
        private NetworkConfig.Builder networkConfig = NetworkConfig.builder();

        public Builder listenAddress(NetworkAddress listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder bootstrapPeers(List<NetworkAddress> bootstrapPeers) {
            this.bootstrapPeers = new ArrayList<>(bootstrapPeers);
            return this;
        }

        public Builder addBootstrapPeer(NetworkAddress peer) {
            this.bootstrapPeers.add(peer);
            return this;
        }

        public Builder storageDir(Path storageDir) {
            this.storageDir = storageDir;
            return this;
        }

        public Builder quotaBytes(long quotaBytes) {
            this.quotaBytes = quotaBytes;
            return this;
        }

        public Builder quota(String quota) {
            this.quotaBytes = parseSize(quota);
            return this;
        }

        public Builder multicastDiscovery(boolean multicastDiscovery) {
            this.multicastDiscovery = multicastDiscovery;
            return this;
        }

        public Builder originAuthUrl(String originAuthUrl) {
            this.originAuthUrl = originAuthUrl;
            return this;
        }

        public Builder originRegistryUrl(String originRegistryUrl) {
            this.originRegistryUrl = originRegistryUrl;
            return this;
        }

        public Builder originService(String originService) {
            this.originService = originService;
            return this;
        }

        public Builder originTimeout(Duration originTimeout) {
            this.originTimeout = originTimeout;
            return this;
        }

        public Builder awaitTimeout(Duration awaitTimeout) {
            this.awaitTimeout = awaitTimeout;
            return this;
        }

        public Builder networkConfig(NetworkConfig.Builder networkConfig) {
            this.networkConfig = networkConfig;
            return this;
        }

        public NodeConfig build() {
            return new NodeConfig(this);
        }
    }
}
