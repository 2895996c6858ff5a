package blobnet.messaging;

import blobnet.network.id.PeerId;

import java.util.Arrays;
import java.util.Objects;

/**
 * A wire message between two overlay nodes.
 *
 * @param source the sender's listen address, where responses are sent
 * @param destination the receiver's listen address
 * @param messageType the message type
 * @param payload the encoded payload record
 * @param correlationId ties a response to its request
 * @param sourcePeer the sender's peer identity
 */
public record Message(
        NetworkAddress source,
        NetworkAddress destination,
        MessageType messageType,
        byte[] payload,
        String correlationId,
        PeerId sourcePeer
) {

    public Message {
        Objects.requireNonNull(source, "Source address cannot be null");
        Objects.requireNonNull(destination, "Destination address cannot be null");
        Objects.requireNonNull(messageType, "Message type cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        Objects.requireNonNull(correlationId, "Correlation ID cannot be null");
        Objects.requireNonNull(sourcePeer, "Source peer cannot be null");
    }

    /**
     * Builds the response to this message, addressed back to its source with the
     * same correlation id.
     */
    public Message reply(NetworkAddress from, PeerId fromPeer, MessageType responseType, byte[] responsePayload) {
        if (!responseType.isResponse()) {
            throw new IllegalArgumentException("Message type must be a response, but was: " + responseType);
        }
        return new Message(from, source, responseType, responsePayload, correlationId, fromPeer);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Message message = (Message) obj;
        return Objects.equals(source, message.source) &&
               Objects.equals(destination, message.destination) &&
               messageType == message.messageType &&
               Arrays.equals(payload, message.payload) &&
               Objects.equals(correlationId, message.correlationId) &&
               Objects.equals(sourcePeer, message.sourcePeer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, messageType, Arrays.hashCode(payload), correlationId, sourcePeer);
    }

    @Override
    public String toString() {
        return "Message{" + messageType + " " + source + "->" + destination
                + ", correlationId=" + correlationId + ", payload=" + payload.length + "B}";
    }
}
