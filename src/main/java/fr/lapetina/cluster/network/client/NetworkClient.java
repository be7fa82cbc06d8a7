package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.exception.ClusterDisconnectedException;
import fr.lapetina.cluster.network.domain.exception.ClusterShutdownException;
import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.exception.InvalidNodeException;
import fr.lapetina.cluster.network.domain.exception.NetworkException;
import fr.lapetina.cluster.network.domain.exception.NetworkNotStartedException;
import fr.lapetina.cluster.network.domain.exception.NoNodesAvailableException;
import fr.lapetina.cluster.network.domain.model.Message;
import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancer;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes messages to cluster nodes.
 *
 * <p>A client is a lightweight handle on its {@link NetworkClientFactory}: it
 * keeps no state of its own and re-reads the factory's lifecycle, the cluster
 * view's connectivity and membership, and the current load balancer on every
 * call. Clients are thread-safe and cheap to create.
 *
 * <p>Every operation first checks, in this order, that the cluster is not shut
 * down, that the factory is started and that the cluster is connected. Failures
 * are thrown synchronously as {@link NetworkException} subclasses; delivery
 * failures are reported through the returned futures.
 */
public final class NetworkClient {

    private static final Logger log = LoggerFactory.getLogger(NetworkClient.class);

    private final NetworkClientFactory factory;

    NetworkClient(NetworkClientFactory factory) {
        this.factory = factory;
    }

    /**
     * Sends a message to every node of the current cluster membership.
     *
     * @return Handle on the per-node sends
     * @throws ClusterShutdownException if the cluster has been shut down
     * @throws ClusterDisconnectedException if the cluster is disconnected
     */
    public BroadcastHandle broadcastMessage(Message message) {
        Objects.requireNonNull(message, "Message is required");
        ensureSendable();

        Set<Node> nodes = factory.clusterView().getNodes();
        Map<Node, CompletableFuture<MessageResponse>> responses = new LinkedHashMap<>();
        for (Node node : nodes) {
            responses.put(node, dispatch("broadcast", node, message));
        }

        log.debug("Message broadcast: messageId={}, nodes={}", message.messageId(), responses.size());
        return new BroadcastHandle(message.messageId(), responses);
    }

    /**
     * Sends a message to a specific cluster member.
     *
     * The node is matched by id against the current membership and the send
     * goes to the member as currently reported by the cluster view.
     *
     * @throws InvalidNodeException if no current member has the node's id
     * @throws ClusterShutdownException if the cluster has been shut down
     * @throws ClusterDisconnectedException if the cluster is disconnected
     */
    public CompletableFuture<MessageResponse> sendMessageToNode(Message message, Node node) {
        Objects.requireNonNull(message, "Message is required");
        Objects.requireNonNull(node, "Node is required");
        ensureSendable();

        Optional<Node> member = factory.clusterView().getNodes().stream()
                .filter(candidate -> candidate.getId() == node.getId())
                .findFirst();
        if (member.isEmpty()) {
            throw fail(new InvalidNodeException(node));
        }

        return dispatch("targeted", member.get(), message);
    }

    /**
     * Sends a message to the node chosen by the current load balancer.
     *
     * @throws InvalidClusterException if the current node set was rejected by the load balancer factory
     * @throws NoNodesAvailableException if the load balancer has no node to offer
     * @throws ClusterShutdownException if the cluster has been shut down
     * @throws ClusterDisconnectedException if the cluster is disconnected
     */
    public CompletableFuture<MessageResponse> sendMessage(Message message) {
        Objects.requireNonNull(message, "Message is required");
        ensureSendable();

        LoadBalancerSnapshot snapshot = factory.getLoadBalancerSnapshot();
        if (snapshot.isRejected()) {
            throw fail(new InvalidClusterException(snapshot.failure().getMessage(), snapshot.failure()));
        }

        Optional<Node> node = snapshot.getLoadBalancer().flatMap(LoadBalancer::nextNode);
        if (node.isEmpty()) {
            throw fail(new NoNodesAvailableException());
        }

        return dispatch("balanced", node.get(), message);
    }

    private void ensureSendable() {
        LifecycleState state = factory.getState();
        ClusterView clusterView = factory.clusterView();

        if (state == LifecycleState.SHUT_DOWN || clusterView.isShutdown()) {
            throw fail(new ClusterShutdownException());
        }
        if (state == LifecycleState.NOT_STARTED) {
            throw fail(new NetworkNotStartedException());
        }
        if (!clusterView.isConnected()) {
            throw fail(new ClusterDisconnectedException());
        }
    }

    private CompletableFuture<MessageResponse> dispatch(String mode, Node node, Message message) {
        log.debug("Dispatching message: mode={}, messageId={}, type={}, nodeId={}",
                mode, message.messageId(), message.type(), node.getId());
        factory.metrics().incrementMessagesSent(mode, node.getId());
        return factory.transportClient().sendMessage(node, message);
    }

    private NetworkException fail(NetworkException e) {
        factory.metrics().incrementRoutingErrors(e.getErrorType());
        log.debug("Routing failed: errorType={}, reason={}", e.getErrorType(), e.getMessage());
        return e;
    }
}
