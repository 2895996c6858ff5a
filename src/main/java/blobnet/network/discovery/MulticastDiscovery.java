package blobnet.network.discovery;

import blobnet.messaging.MessageCodec;
import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.MembershipKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Local network discovery over UDP multicast. Each node periodically sends a
 * {@link DiscoveryAnnouncement} to the group; peers not heard from within the
 * expiry window are reported as expired.
 * <p>
 * Non-blocking: all socket work happens inside {@link #poll()} on the engine thread.
 */
public class MulticastDiscovery implements Discovery {

    private static final Logger log = LoggerFactory.getLogger(MulticastDiscovery.class);

    public static final String DEFAULT_GROUP = "239.255.42.99";
    public static final int DEFAULT_PORT = 7887;

    private final MessageCodec codec;
    private final InetSocketAddress group;
    private final long announceIntervalMillis;
    private final long expiryMillis;

    private final Map<PeerId, Sighting> sightings = new HashMap<>();
    private final ByteBuffer receiveBuffer = ByteBuffer.allocate(2048);
    private DatagramChannel channel;
    private MembershipKey membership;
    private byte[] announcement;
    private PeerId self;
    private long lastAnnounceAt;

    public MulticastDiscovery(MessageCodec codec) {
        this(codec, new InetSocketAddress(DEFAULT_GROUP, DEFAULT_PORT), 5_000, 20_000);
    }

    public MulticastDiscovery(MessageCodec codec, InetSocketAddress group, long announceIntervalMillis, long expiryMillis) {
        if (expiryMillis <= announceIntervalMillis) {
            throw new IllegalArgumentException("Expiry window must be longer than the announce interval");
        }
        this.codec = codec;
        this.group = group;
        this.announceIntervalMillis = announceIntervalMillis;
        this.expiryMillis = expiryMillis;
    }

    @Override
    public void start(PeerId self, NetworkAddress listenAddress) {
        this.self = self;
        this.announcement = codec.encode(new DiscoveryAnnouncement(self.value(), listenAddress));
        try {
            NetworkInterface networkInterface = selectInterface();
            channel = DatagramChannel.open(StandardProtocolFamily.INET)
                    .setOption(StandardSocketOptions.SO_REUSEADDR, true)
                    .bind(new InetSocketAddress(group.getPort()))
                    .setOption(StandardSocketOptions.IP_MULTICAST_IF, networkInterface)
                    .setOption(StandardSocketOptions.IP_MULTICAST_LOOP, true);
            channel.configureBlocking(false);
            membership = channel.join(group.getAddress(), networkInterface);
            log.info("Multicast discovery on {} via {}", group, networkInterface.getName());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to join multicast group " + group, e);
        }
        announce(System.currentTimeMillis());
    }

    private static NetworkInterface selectInterface() throws IOException {
        NetworkInterface loopback = NetworkInterface.getByInetAddress(InetAddress.getLoopbackAddress());
        Iterator<NetworkInterface> interfaces = NetworkInterface.networkInterfaces().iterator();
        while (interfaces.hasNext()) {
            NetworkInterface candidate = interfaces.next();
            if (candidate.isUp() && candidate.supportsMulticast() && !candidate.isLoopback()) {
                return candidate;
            }
        }
        if (loopback == null) {
            throw new IOException("No multicast capable network interface");
        }
        return loopback;
    }

    @Override
    public List<DiscoveryEvent> poll() {
        List<DiscoveryEvent> events = new ArrayList<>();
        if (channel == null) {
            return events;
        }
        long now = System.currentTimeMillis();
        if (now - lastAnnounceAt >= announceIntervalMillis) {
            announce(now);
        }
        receive(now, events);
        expire(now, events);
        return events;
    }

    private void announce(long now) {
        try {
            channel.send(ByteBuffer.wrap(announcement), group);
            lastAnnounceAt = now;
        } catch (IOException e) {
            log.warn("Failed to send discovery announcement: {}", e.getMessage());
        }
    }

    private void receive(long now, List<DiscoveryEvent> events) {
        while (true) {
            SocketAddress sender;
            receiveBuffer.clear();
            try {
                sender = channel.receive(receiveBuffer);
            } catch (IOException e) {
                log.warn("Failed to receive discovery datagram: {}", e.getMessage());
                return;
            }
            if (sender == null) {
                return;
            }
            receiveBuffer.flip();
            byte[] datagram = Arrays.copyOf(receiveBuffer.array(), receiveBuffer.limit());
            DiscoveryAnnouncement announced;
            try {
                announced = codec.decode(datagram, DiscoveryAnnouncement.class);
            } catch (RuntimeException e) {
                log.debug("Ignoring malformed discovery datagram from {}", sender);
                continue;
            }
            PeerId peer = new PeerId(announced.peerId());
            if (peer.equals(self)) {
                continue;
            }
            NetworkAddress address = reachableAddress(announced.listenAddress(), sender);
            Sighting previous = sightings.put(peer, new Sighting(address, now));
            if (previous == null || !previous.address.equals(address)) {
                events.add(new DiscoveryEvent.Discovered(peer, address));
            }
        }
    }

    // A wildcard or loopback listen address is reachable at the datagram's source host
    static NetworkAddress reachableAddress(NetworkAddress announced, SocketAddress sender) {
        if (!isLocalOnly(announced.ipAddress()) || !(sender instanceof InetSocketAddress inet)) {
            return announced;
        }
        return new NetworkAddress(inet.getAddress().getHostAddress(), announced.port());
    }

    private static boolean isLocalOnly(String host) {
        return "0.0.0.0".equals(host)
                || "localhost".equalsIgnoreCase(host)
                || host.startsWith("127.")
                || "::1".equals(host)
                || "0:0:0:0:0:0:0:1".equals(host);
    }

    private void expire(long now, List<DiscoveryEvent> events) {
        Iterator<Map.Entry<PeerId, Sighting>> it = sightings.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<PeerId, Sighting> entry = it.next();
            if (now - entry.getValue().lastSeenAt > expiryMillis) {
                it.remove();
                events.add(new DiscoveryEvent.Expired(entry.getKey(), entry.getValue().address));
            }
        }
    }

    @Override
    public boolean isKnown(PeerId peer) {
        Sighting sighting = sightings.get(peer);
        return sighting != null && System.currentTimeMillis() - sighting.lastSeenAt <= expiryMillis;
    }

    @Override
    public void close() {
        if (channel == null) {
            return;
        }
        if (membership != null) {
            membership.drop();
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error closing multicast channel", e);
        }
    }

    private record Sighting(NetworkAddress address, long lastSeenAt) {}
}
