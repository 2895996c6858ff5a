package blobnet.messaging;

import blobnet.network.MessageCallback;
import blobnet.network.Network;
import blobnet.network.id.PeerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Routes messages delivered by the {@link Network} to the handler registered for
 * their destination address, and sends typed payloads through the codec.
 * <p>
 * Used from the overlay engine thread only.
 */
public class MessageBus implements MessageCallback {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final Network network;
    private final MessageCodec messageCodec;
    private final Map<NetworkAddress, MessageHandler> addressHandlers = new HashMap<>();

    /**
     * @throws IllegalArgumentException if either parameter is null
     */
    public MessageBus(Network network, MessageCodec messageCodec) {
        if (network == null) {
            throw new IllegalArgumentException("Network cannot be null");
        }
        if (messageCodec == null) {
            throw new IllegalArgumentException("MessageCodec cannot be null");
        }
        this.network = network;
        this.messageCodec = messageCodec;
        network.registerMessageHandler(this);
    }

    public void sendMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        network.send(message);
    }

    /**
     * Encodes {@code payload} and sends it as a new message.
     */
    public void send(NetworkAddress source, PeerId sourcePeer, NetworkAddress destination,
                     MessageType messageType, Object payload, String correlationId) {
        sendMessage(new Message(source, destination, messageType, messageCodec.encode(payload), correlationId, sourcePeer));
    }

    /**
     * Sends the same payload to every recipient except the source itself. All copies
     * share one correlation id so that the responses can be collected together.
     */
    public void broadcast(NetworkAddress source, PeerId sourcePeer, Collection<NetworkAddress> recipients,
                          MessageType messageType, Object payload, String correlationId) {
        byte[] encoded = messageCodec.encode(payload);
        for (NetworkAddress recipient : recipients) {
            if (!recipient.equals(source)) {
                sendMessage(new Message(source, recipient, messageType, encoded, correlationId, sourcePeer));
            }
        }
    }

    /**
     * Sends the response to {@code request} back to its source.
     */
    public void reply(Message request, NetworkAddress from, PeerId fromPeer, MessageType responseType, Object payload) {
        sendMessage(request.reply(from, fromPeer, responseType, messageCodec.encode(payload)));
    }

    public <T> T decodePayload(Message message, Class<T> type) {
        return messageCodec.decode(message.payload(), type);
    }

    public void registerHandler(NetworkAddress address, MessageHandler handler) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        addressHandlers.put(address, handler);
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public void onMessage(Message message) {
        MessageHandler handler = addressHandlers.get(message.destination());
        if (handler == null) {
            log.warn("No handler registered for {}, dropping {}", message.destination(), message);
            return;
        }
        log.debug("Routing {} from {}", message.messageType(), message.sourcePeer());
        try {
            handler.onMessageReceived(message);
        } catch (RuntimeException e) {
            log.error("Handler failed for {}", message, e);
        }
    }
}
