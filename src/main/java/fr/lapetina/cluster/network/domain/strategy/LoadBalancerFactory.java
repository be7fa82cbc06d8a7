package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Set;

/**
 * Builds a {@link LoadBalancer} from a cluster snapshot.
 */
@FunctionalInterface
public interface LoadBalancerFactory {

    /**
     * Creates a load balancer for the given node set.
     *
     * @param nodes Immutable snapshot of the cluster membership
     * @return A balancer confined to {@code nodes}
     * @throws InvalidClusterException if the node set is unacceptable for this policy
     */
    LoadBalancer newLoadBalancer(Set<Node> nodes) throws InvalidClusterException;
}
