package blobnet.network.discovery;

import blobnet.messaging.NetworkAddress;
import blobnet.network.id.PeerId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Discovery over a shared in-memory {@link Registry}, for deterministic tests.
 */
public class SimulatedDiscovery implements Discovery {

    private final Registry registry;
    private final Queue<DiscoveryEvent> events = new ConcurrentLinkedQueue<>();
    private volatile PeerId self;

    public SimulatedDiscovery(Registry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public void start(PeerId self, NetworkAddress listenAddress) {
        this.self = self;
        registry.subscribe(this);
        registry.announce(self, listenAddress);
    }

    @Override
    public List<DiscoveryEvent> poll() {
        List<DiscoveryEvent> drained = new ArrayList<>();
        DiscoveryEvent event;
        while ((event = events.poll()) != null) {
            drained.add(event);
        }
        return drained;
    }

    @Override
    public boolean isKnown(PeerId peer) {
        return registry.contains(peer);
    }

    @Override
    public void close() {
        registry.unsubscribe(this);
        if (self != null) {
            registry.withdraw(self);
        }
    }

    private void publish(DiscoveryEvent event) {
        if (!event.peer().equals(self)) {
            events.add(event);
        }
    }

    /**
     * The shared view of which peers are announcing themselves. Tests drive it
     * directly to make peers appear, vanish, or have their records expire.
     */
    public static class Registry {

        private final Map<PeerId, NetworkAddress> members = new ConcurrentHashMap<>();
        private final List<SimulatedDiscovery> subscribers = new CopyOnWriteArrayList<>();

        public synchronized void announce(PeerId peer, NetworkAddress address) {
            NetworkAddress previous = members.put(peer, address);
            if (!address.equals(previous)) {
                DiscoveryEvent event = new DiscoveryEvent.Discovered(peer, address);
                subscribers.forEach(s -> s.publish(event));
            }
        }

        /**
         * The peer stops announcing: it is forgotten and every observer sees it expire.
         */
        public synchronized void withdraw(PeerId peer) {
            NetworkAddress address = members.remove(peer);
            if (address != null) {
                DiscoveryEvent event = new DiscoveryEvent.Expired(peer, address);
                subscribers.forEach(s -> s.publish(event));
            }
        }

        /**
         * A stale record of the peer expires while the peer keeps announcing.
         */
        public synchronized void expireRecord(PeerId peer) {
            NetworkAddress address = members.get(peer);
            if (address != null) {
                DiscoveryEvent event = new DiscoveryEvent.Expired(peer, address);
                subscribers.forEach(s -> s.publish(event));
            }
        }

        public boolean contains(PeerId peer) {
            return members.containsKey(peer);
        }

        private synchronized void subscribe(SimulatedDiscovery discovery) {
            subscribers.add(discovery);
            members.forEach((peer, address) -> discovery.publish(new DiscoveryEvent.Discovered(peer, address)));
        }

        private void unsubscribe(SimulatedDiscovery discovery) {
            subscribers.remove(discovery);
        }
    }
}
