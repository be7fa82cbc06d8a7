package fr.lapetina.cluster.network.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Acknowledgement returned by a node for a delivered message.
 */
public record MessageResponse(
        String messageId,
        int nodeId,
        int statusCode,
        byte[] payload,
        Duration latency
) {
    public MessageResponse {
        Objects.requireNonNull(messageId, "Message ID is required");
        payload = payload != null ? payload.clone() : new byte[0];
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public static MessageResponse of(String messageId, int nodeId, int statusCode) {
        return new MessageResponse(messageId, nodeId, statusCode, null, null);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "MessageResponse{" +
                "messageId='" + messageId + '\'' +
                ", nodeId=" + nodeId +
                ", statusCode=" + statusCode +
                ", latencyMs=" + latency.toMillis() +
                '}';
    }
}
