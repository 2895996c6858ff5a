package blobnet.network;

import java.time.Duration;

/**
 * Tuning for the transport and the overlay engine. Immutable, built with
 * {@link #builder()} and validated on build. Timeouts are counted in engine ticks.
 */
public final class NetworkConfig {

    public static final String DEFAULT_TOPIC = "blobnet-artifacts";

    private final int maxInboundPerTick;
    private final int maxFrameBytes;
    private final int maxCommandsPerTick;
    private final int commandQueueCapacity;
    private final int eventQueueCapacity;
    private final long requestTimeoutTicks;
    private final long responseChannelTimeoutTicks;
    private final long providerQueryWindowTicks;
    private final long tickIntervalMillis;
    private final Duration submitTimeout;
    private final String topic;

    private NetworkConfig(Builder builder) {
        this.maxInboundPerTick = builder.maxInboundPerTick;
        this.maxFrameBytes = builder.maxFrameBytes;
        this.maxCommandsPerTick = builder.maxCommandsPerTick;
        this.commandQueueCapacity = builder.commandQueueCapacity;
        this.eventQueueCapacity = builder.eventQueueCapacity;
        this.requestTimeoutTicks = builder.requestTimeoutTicks;
        this.responseChannelTimeoutTicks = builder.responseChannelTimeoutTicks;
        this.providerQueryWindowTicks = builder.providerQueryWindowTicks;
        this.tickIntervalMillis = builder.tickIntervalMillis;
        this.submitTimeout = builder.submitTimeout;
        this.topic = builder.topic;

        validate();
    }

    private void validate() {
        requirePositive(maxInboundPerTick, "maxInboundPerTick");
        requirePositive(maxFrameBytes, "maxFrameBytes");
        requirePositive(maxCommandsPerTick, "maxCommandsPerTick");
        requirePositive(commandQueueCapacity, "commandQueueCapacity");
        requirePositive(eventQueueCapacity, "eventQueueCapacity");
        requirePositive(requestTimeoutTicks, "requestTimeoutTicks");
        requirePositive(responseChannelTimeoutTicks, "responseChannelTimeoutTicks");
        requirePositive(providerQueryWindowTicks, "providerQueryWindowTicks");
        requirePositive(tickIntervalMillis, "tickIntervalMillis");
        if (submitTimeout == null || submitTimeout.isNegative()) {
            throw new IllegalArgumentException("submitTimeout must not be negative");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public int maxInboundPerTick() {
        return maxInboundPerTick;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public int maxCommandsPerTick() {
        return maxCommandsPerTick;
    }

    public int commandQueueCapacity() {
        return commandQueueCapacity;
    }

    public int eventQueueCapacity() {
        return eventQueueCapacity;
    }

    public long requestTimeoutTicks() {
        return requestTimeoutTicks;
    }

    public long responseChannelTimeoutTicks() {
        return responseChannelTimeoutTicks;
    }

    public long providerQueryWindowTicks() {
        return providerQueryWindowTicks;
    }

    public long tickIntervalMillis() {
        return tickIntervalMillis;
    }

    public Duration submitTimeout() {
        return submitTimeout;
    }

    public String topic() {
        return topic;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static NetworkConfig defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("NetworkConfig{topic=%s, tickIntervalMillis=%d, requestTimeoutTicks=%d, "
                        + "responseChannelTimeoutTicks=%d, providerQueryWindowTicks=%d, commandQueueCapacity=%d}",
                topic, tickIntervalMillis, requestTimeoutTicks, responseChannelTimeoutTicks,
                providerQueryWindowTicks, commandQueueCapacity);
    }

    public static final class Builder {
        private int maxInboundPerTick = 1000;
        private int maxFrameBytes = 256 * 1024 * 1024;
        private int maxCommandsPerTick = 256;
        private int commandQueueCapacity = 1024;
        private int eventQueueCapacity = 256;
        // 10ms ticks: 30s request timeout, 2s provider query window
        private long requestTimeoutTicks = 3000;
        private long responseChannelTimeoutTicks = 3000;
        private long providerQueryWindowTicks = 200;
        private long tickIntervalMillis = 10;
        private Duration submitTimeout = Duration.ofSeconds(5);
        private String topic = DEFAULT_TOPIC;

        public Builder maxInboundPerTick(int maxInboundPerTick) {
            this.maxInboundPerTick = maxInboundPerTick;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public Builder maxCommandsPerTick(int maxCommandsPerTick) {
            this.maxCommandsPerTick = maxCommandsPerTick;
            return this;
        }

        public Builder commandQueueCapacity(int commandQueueCapacity) {
            this.commandQueueCapacity = commandQueueCapacity;
            return this;
        }

        public Builder eventQueueCapacity(int eventQueueCapacity) {
            this.eventQueueCapacity = eventQueueCapacity;
            return this;
        }

        public Builder requestTimeoutTicks(long requestTimeoutTicks) {
            this.requestTimeoutTicks = requestTimeoutTicks;
            return this;
        }

        public Builder responseChannelTimeoutTicks(long responseChannelTimeoutTicks) {
            this.responseChannelTimeoutTicks = responseChannelTimeoutTicks;
            return this;
        }

        public Builder providerQueryWindowTicks(long providerQueryWindowTicks) {
            this.providerQueryWindowTicks = providerQueryWindowTicks;
            return this;
        }

        public Builder tickIntervalMillis(long tickIntervalMillis) {
            this.tickIntervalMillis = tickIntervalMillis;
            return this;
        }

        public Builder submitTimeout(Duration submitTimeout) {
            this.submitTimeout = submitTimeout;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public NetworkConfig build() {
            return new NetworkConfig(this);
        }
    }
}
