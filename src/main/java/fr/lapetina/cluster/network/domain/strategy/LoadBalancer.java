package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Optional;

/**
 * Node selection policy bound to one immutable node set.
 *
 * Implementations must be thread-safe as they are called from arbitrary
 * caller threads concurrently. Selection never leaves the node set the
 * balancer was built from, and repeated calls eventually return every
 * available node.
 */
public interface LoadBalancer {

    /**
     * Selects the next node to route a message to.
     *
     * @return Selected node, or empty if no node is available
     */
    Optional<Node> nextNode();
}
