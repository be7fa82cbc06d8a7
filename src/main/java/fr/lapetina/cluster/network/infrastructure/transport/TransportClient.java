package fr.lapetina.cluster.network.infrastructure.transport;

import fr.lapetina.cluster.network.domain.model.Message;
import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;

import java.util.concurrent.CompletableFuture;

/**
 * Low-level sender delivering a message to one node.
 *
 * Delivery failures are reported through the returned future, never thrown
 * from {@link #sendMessage(Node, Message)}. Timeouts and retries are the
 * implementation's concern.
 */
public interface TransportClient extends AutoCloseable {

    /**
     * Sends a message to the given node.
     *
     * @return Future completed with the node's acknowledgement
     */
    CompletableFuture<MessageResponse> sendMessage(Node node, Message message);

    /**
     * Releases transport resources. Subsequent sends fail.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
