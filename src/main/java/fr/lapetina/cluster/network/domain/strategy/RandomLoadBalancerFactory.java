package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random load balancing.
 *
 * Picks uniformly among the available nodes. Simple but effective for
 * homogeneous clusters.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomLoadBalancerFactory extends AbstractLoadBalancerFactory {

    public static final String NAME = "random";

    public RandomLoadBalancerFactory() {
        this(0);
    }

    public RandomLoadBalancerFactory(int minimumAvailableNodes) {
        super(minimumAvailableNodes);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected LoadBalancer create(List<Node> availableNodes) {
        List<Node> nodes = List.copyOf(availableNodes);
        return () -> nodes.isEmpty()
                ? Optional.empty()
                : Optional.of(nodes.get(ThreadLocalRandom.current().nextInt(nodes.size())));
    }
}
