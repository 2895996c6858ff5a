package blobnet.messaging;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extensible message type constant. A global registry maps every id to a single
 * canonical instance so types compare by reference and decode by id.
 */
public final class MessageType {

    public enum Category {
        /** Direct request that expects a response carrying the same correlation id. */
        REQUEST,
        RESPONSE,
        /** Published on the broadcast topic to every peer in the partial view. */
        BROADCAST
    }

    private static final Map<String, MessageType> REGISTRY = new ConcurrentHashMap<>();

    private static MessageType register(MessageType type) {
        MessageType existing = REGISTRY.putIfAbsent(type.id, type);
        return existing == null ? type : existing;
    }

    /** Look up an existing MessageType by id (or null if not registered). */
    public static MessageType valueOf(String id) {
        return REGISTRY.get(id);
    }

    /**
     * Returns the registered type for {@code id}, registering a new one if needed.
     */
    public static MessageType valueOf(String id, Category category) {
        return REGISTRY.computeIfAbsent(id, k -> new MessageType(k, category));
    }

    public static final MessageType IDENTIFY_REQUEST = register(new MessageType("IDENTIFY_REQUEST", Category.REQUEST));
    public static final MessageType IDENTIFY_RESPONSE = register(new MessageType("IDENTIFY_RESPONSE", Category.RESPONSE));

    public static final MessageType ARTIFACT_REQUEST = register(new MessageType("ARTIFACT_REQUEST", Category.REQUEST));
    public static final MessageType ARTIFACT_RESPONSE = register(new MessageType("ARTIFACT_RESPONSE", Category.RESPONSE));

    public static final MessageType PROVIDER_ANNOUNCE = register(new MessageType("PROVIDER_ANNOUNCE", Category.BROADCAST));
    public static final MessageType PROVIDER_WITHDRAW = register(new MessageType("PROVIDER_WITHDRAW", Category.BROADCAST));
    public static final MessageType PROVIDER_QUERY = register(new MessageType("PROVIDER_QUERY", Category.BROADCAST));
    public static final MessageType PROVIDER_QUERY_RESPONSE = register(new MessageType("PROVIDER_QUERY_RESPONSE", Category.RESPONSE));

    private final String id;
    private final Category category;

    private MessageType(String id, Category category) {
        this.id = Objects.requireNonNull(id, "Message type id cannot be null");
        this.category = Objects.requireNonNull(category, "Message type category cannot be null");
    }

    public String getId() {
        return id;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRequest() {
        return category == Category.REQUEST;
    }

    public boolean isResponse() {
        return category == Category.RESPONSE;
    }

    public boolean isBroadcast() {
        return category == Category.BROADCAST;
    }

    @Override
    public String toString() {
        return id;
    }
}
