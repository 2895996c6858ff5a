package blobnet.network;

import blobnet.messaging.Message;
import blobnet.messaging.NetworkAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory network for deterministic tests. Every node owns one
 * {@code SimulatedNetwork}; nodes that share a {@link Hub} can reach each other.
 * <p>
 * send() queues the message in the destination's inbox, stamped with the tick at
 * which it becomes deliverable. The destination's tick() hands due messages to its
 * callback in FIFO order. Nodes may tick on different threads.
 */
public class SimulatedNetwork implements Network {

    private static final Logger log = LoggerFactory.getLogger(SimulatedNetwork.class);

    private final Hub hub;
    private final int delayTicks;
    private final Queue<QueuedMessage> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicLong currentTick = new AtomicLong();
    private final List<NetworkAddress> boundAddresses = new ArrayList<>();
    private volatile MessageCallback callback;

    public SimulatedNetwork(Hub hub) {
        this(hub, 0);
    }

    /**
     * @param delayTicks number of receiver ticks before a message is delivered (0 = next tick)
     */
    public SimulatedNetwork(Hub hub, int delayTicks) {
        if (hub == null) {
            throw new IllegalArgumentException("Hub cannot be null");
        }
        if (delayTicks < 0) {
            throw new IllegalArgumentException("Delay ticks cannot be negative");
        }
        this.hub = hub;
        this.delayTicks = delayTicks;
    }

    @Override
    public NetworkAddress bind(NetworkAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        NetworkAddress actual = address.isEphemeral()
                ? new NetworkAddress(address.ipAddress(), hub.nextEphemeralPort())
                : address;
        hub.attach(actual, this);
        boundAddresses.add(actual);
        return actual;
    }

    @Override
    public void send(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        hub.route(message);
    }

    private void enqueue(Message message) {
        inbox.offer(new QueuedMessage(message, currentTick.get() + delayTicks + 1));
    }

    @Override
    public void tick() {
        long now = currentTick.incrementAndGet();
        QueuedMessage next;
        while ((next = inbox.peek()) != null && next.deliveryTick <= now) {
            inbox.poll();
            MessageCallback target = callback;
            if (target == null) {
                log.warn("No message callback registered, dropping {}", next.message);
                continue;
            }
            target.onMessage(next.message);
        }
    }

    @Override
    public void registerMessageHandler(MessageCallback callback) {
        this.callback = callback;
    }

    @Override
    public void close() {
        boundAddresses.forEach(hub::detach);
        boundAddresses.clear();
        inbox.clear();
    }

    private record QueuedMessage(Message message, long deliveryTick) {}

    /**
     * Shared switchboard connecting the simulated networks of several nodes. It can
     * drop messages at random and partition addresses to model unreachable peers.
     */
    public static class Hub {

        private final Map<NetworkAddress, SimulatedNetwork> endpoints = new ConcurrentHashMap<>();
        private final Set<NetworkAddress> partitioned = ConcurrentHashMap.newKeySet();
        private final AtomicInteger nextPort = new AtomicInteger(40000);
        private final Random random;
        private final double packetLossRate;

        public Hub() {
            this(new Random(0), 0.0);
        }

        public Hub(Random random, double packetLossRate) {
            if (random == null) {
                throw new IllegalArgumentException("Random cannot be null");
            }
            if (packetLossRate < 0.0 || packetLossRate > 1.0) {
                throw new IllegalArgumentException("Packet loss rate must be between 0.0 and 1.0");
            }
            this.random = random;
            this.packetLossRate = packetLossRate;
        }

        /**
         * Drops every message sent to or from {@code address} until healed.
         */
        public void partition(NetworkAddress address) {
            partitioned.add(address);
        }

        public void heal(NetworkAddress address) {
            partitioned.remove(address);
        }

        public boolean isAttached(NetworkAddress address) {
            return endpoints.containsKey(address);
        }

        private void attach(NetworkAddress address, SimulatedNetwork network) {
            SimulatedNetwork existing = endpoints.putIfAbsent(address, network);
            if (existing != null && existing != network) {
                throw new IllegalStateException("Address already bound: " + address);
            }
        }

        private void detach(NetworkAddress address) {
            endpoints.remove(address);
        }

        private int nextEphemeralPort() {
            return nextPort.getAndIncrement();
        }

        private void route(Message message) {
            if (partitioned.contains(message.source()) || partitioned.contains(message.destination())) {
                log.debug("Dropping {} across partition", message);
                return;
            }
            if (packetLossRate > 0.0 && nextLossSample() < packetLossRate) {
                log.debug("Dropping {} as packet loss", message);
                return;
            }
            SimulatedNetwork destination = endpoints.get(message.destination());
            if (destination == null) {
                log.debug("No node bound at {}, dropping {}", message.destination(), message);
                return;
            }
            destination.enqueue(message);
        }

        private synchronized double nextLossSample() {
            return random.nextDouble();
        }
    }
}
