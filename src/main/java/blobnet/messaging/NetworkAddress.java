package blobnet.messaging;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.net.InetSocketAddress;

public record NetworkAddress(String ipAddress, int port) {
    public NetworkAddress {
        if (ipAddress == null || ipAddress.isBlank()) {
            throw new IllegalArgumentException("IP address cannot be null or blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535, but was: " + port);
        }
    }

    public static NetworkAddress parse(String s) {
        if (s == null || !s.contains(":")) throw new IllegalArgumentException("Invalid address: " + s);
        String[] parts = s.split(":");
        if (parts.length != 2) throw new IllegalArgumentException("Invalid address: " + s);
        try {
            return new NetworkAddress(parts[0], Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + s, e);
        }
    }

    /**
     * Creates a {@link NetworkAddress} from a given {@link InetSocketAddress}.
     *
     * @param socketAddress the InetSocketAddress to convert (must not be {@code null})
     * @return a new {@code NetworkAddress} representing the same IP and port
     * @throws IllegalArgumentException if {@code socketAddress} is {@code null}
     */
    public static NetworkAddress from(InetSocketAddress socketAddress) {
        if (socketAddress == null) {
            throw new IllegalArgumentException("socketAddress cannot be null");
        }
        return new NetworkAddress(socketAddress.getAddress().getHostAddress(), socketAddress.getPort());
    }

    /**
     * Port 0 asks the operating system for an ephemeral port when binding.
     */
    @JsonIgnore
    public boolean isEphemeral() {
        return port == 0;
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(ipAddress, port);
    }

    @Override
    public String toString() {
        return ipAddress + ":" + port;
    }
}
