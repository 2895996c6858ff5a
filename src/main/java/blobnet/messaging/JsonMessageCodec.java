package blobnet.messaging;

import blobnet.network.id.PeerId;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

public final class JsonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    public JsonMessageCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates an ObjectMapper for serializing payload records.
     * Jackson handles byte[] fields as Base64 in JSON.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] encode(Object obj) {
        if (obj == null) {
            throw new IllegalArgumentException("Cannot encode null object");
        }
        try {
            // Message types travel by id, peers by their string value
            if (obj instanceof Message msg) {
                Map<String, Object> map = new HashMap<>();
                map.put("source", msg.source());
                map.put("destination", msg.destination());
                map.put("messageType", msg.messageType().getId());
                map.put("payload", msg.payload());
                map.put("correlationId", msg.correlationId());
                map.put("sourcePeer", msg.sourcePeer().value());
                return objectMapper.writeValueAsBytes(map);
            }
            return objectMapper.writeValueAsBytes(obj);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode " + obj.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        try {
            if (type == Message.class) {
                JsonNode node = objectMapper.readTree(data);
                NetworkAddress source = objectMapper.treeToValue(node.get("source"), NetworkAddress.class);
                NetworkAddress destination = objectMapper.treeToValue(node.get("destination"), NetworkAddress.class);
                String typeId = node.get("messageType").asText();
                MessageType msgType = MessageType.valueOf(typeId);
                if (msgType == null) {
                    throw new IllegalArgumentException("Unknown message type: " + typeId);
                }
                byte[] payload = objectMapper.treeToValue(node.get("payload"), byte[].class);
                String correlationId = node.get("correlationId").asText();
                PeerId sourcePeer = new PeerId(node.get("sourcePeer").asText());
                return type.cast(new Message(source, destination, msgType, payload, correlationId, sourcePeer));
            }
            return objectMapper.readValue(data, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to decode to " + type.getSimpleName(), e);
        }
    }
}
