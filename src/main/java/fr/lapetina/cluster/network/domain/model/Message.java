package fr.lapetina.cluster.network.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A message to be delivered to one or more cluster nodes.
 * Immutable and thread-safe; the payload is opaque to the routing layer.
 */
public record Message(
        String messageId,
        String type,
        byte[] payload,
        Map<String, String> headers,
        Instant createdAt
) {
    public Message {
        Objects.requireNonNull(type, "Message type is required");
        if (messageId == null) {
            messageId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        payload = payload != null ? payload.clone() : new byte[0];
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    /**
     * Creates a message with a generated id and no headers.
     */
    public static Message of(String type, byte[] payload) {
        return new Message(null, type, payload, null, null);
    }

    /**
     * Creates a message with a generated id and the given headers.
     */
    public static Message of(String type, byte[] payload, Map<String, String> headers) {
        return new Message(null, type, payload, headers, null);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadSize() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "Message{" +
                "messageId='" + messageId + '\'' +
                ", type='" + type + '\'' +
                ", payloadSize=" + payload.length +
                ", headers=" + headers +
                '}';
    }
}
