package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin load balancing.
 *
 * Cycles through the available nodes in ascending id order.
 * Thread-safe via atomic counter.
 */
public final class RoundRobinLoadBalancerFactory extends AbstractLoadBalancerFactory {

    public static final String NAME = "round-robin";

    public RoundRobinLoadBalancerFactory() {
        this(0);
    }

    public RoundRobinLoadBalancerFactory(int minimumAvailableNodes) {
        super(minimumAvailableNodes);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected LoadBalancer create(List<Node> availableNodes) {
        return new RoundRobinLoadBalancer(availableNodes);
    }

    static final class RoundRobinLoadBalancer implements LoadBalancer {

        private final List<Node> nodes;
        private final AtomicInteger counter = new AtomicInteger(0);

        RoundRobinLoadBalancer(List<Node> nodes) {
            this.nodes = List.copyOf(nodes);
        }

        @Override
        public Optional<Node> nextNode() {
            if (nodes.isEmpty()) {
                return Optional.empty();
            }
            int index = (counter.getAndIncrement() & 0x7FFFFFFF) % nodes.size();
            return Optional.of(nodes.get(index));
        }

        @Override
        public String toString() {
            return "RoundRobinLoadBalancer{nodes=" + nodes.size() + '}';
        }
    }
}
