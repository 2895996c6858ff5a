package blobnet.network;

import blobnet.messaging.Message;
import blobnet.messaging.NetworkAddress;

/**
 * Message transport driven by {@link #tick()}. Inbound messages are handed to the
 * registered {@link MessageCallback} on the ticking thread.
 */
public interface Network extends AutoCloseable {

    /**
     * Starts accepting messages at {@code address}. Port 0 binds an ephemeral port.
     *
     * @return the address actually bound
     */
    NetworkAddress bind(NetworkAddress address);

    /**
     * Queues a message for delivery to its destination. Delivery is best effort:
     * messages to unreachable destinations are dropped.
     *
     * @throws IllegalArgumentException if the encoded message is larger than the transport can frame
     */
    void send(Message message);

    void tick();

    void registerMessageHandler(MessageCallback callback);

    @Override
    void close();
}
