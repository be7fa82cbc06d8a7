package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Base factory for policies that balance over the available nodes of a set.
 *
 * Filters out nodes that are not available, orders the rest by id and
 * rejects the set when fewer than {@code minimumAvailableNodes} remain.
 */
public abstract class AbstractLoadBalancerFactory implements LoadBalancerFactory {

    private final int minimumAvailableNodes;

    protected AbstractLoadBalancerFactory(int minimumAvailableNodes) {
        if (minimumAvailableNodes < 0) {
            throw new IllegalArgumentException("minimumAvailableNodes must be >= 0: " + minimumAvailableNodes);
        }
        this.minimumAvailableNodes = minimumAvailableNodes;
    }

    /**
     * Returns the name of the policy for configuration and metrics.
     */
    public abstract String getName();

    public int getMinimumAvailableNodes() {
        return minimumAvailableNodes;
    }

    @Override
    public final LoadBalancer newLoadBalancer(Set<Node> nodes) {
        if (nodes == null) {
            throw new InvalidClusterException("Node set is null");
        }

        List<Node> available = nodes.stream()
                .filter(Node::isAvailable)
                .sorted(Comparator.comparingInt(Node::getId))
                .toList();

        if (available.size() < minimumAvailableNodes) {
            throw new InvalidClusterException(String.format(
                    "Cluster has %d available nodes out of %d, at least %d required by %s",
                    available.size(), nodes.size(), minimumAvailableNodes, getName()));
        }

        return create(available);
    }

    /**
     * Creates the balancer over the available nodes, sorted by id.
     */
    protected abstract LoadBalancer create(List<Node> availableNodes);
}
