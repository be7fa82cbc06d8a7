package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Aggregate of the per-node sends of one broadcast.
 *
 * Individual failures are not masked: each per-node future completes the
 * way the transport completed it, and {@link #all()} fails if any of them fails.
 */
public final class BroadcastHandle {

    private final String messageId;
    private final Map<Node, CompletableFuture<MessageResponse>> responses;

    BroadcastHandle(String messageId, Map<Node, CompletableFuture<MessageResponse>> responses) {
        this.messageId = messageId;
        this.responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * Returns the per-node futures, keyed by the node each send went to.
     */
    public Map<Node, CompletableFuture<MessageResponse>> getResponses() {
        return responses;
    }

    public Optional<CompletableFuture<MessageResponse>> responseFrom(int nodeId) {
        return responses.entrySet().stream()
                .filter(entry -> entry.getKey().getId() == nodeId)
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Number of nodes the message was dispatched to.
     */
    public int size() {
        return responses.size();
    }

    /**
     * Completes with every acknowledgement once all sends succeeded, or
     * exceptionally as soon as all sends are done and at least one failed.
     */
    public CompletableFuture<List<MessageResponse>> all() {
        CompletableFuture<?>[] futures = responses.values().toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(futures)
                .thenApply(ignored -> responses.values().stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    public boolean isDone() {
        return responses.values().stream().allMatch(CompletableFuture::isDone);
    }

    @Override
    public String toString() {
        return "BroadcastHandle{" +
                "messageId='" + messageId + '\'' +
                ", nodes=" + responses.size() +
                ", done=" + isDone() +
                '}';
    }
}
