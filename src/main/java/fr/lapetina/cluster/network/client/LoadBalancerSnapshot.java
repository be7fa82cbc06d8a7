package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.model.Node;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancer;

import java.util.Optional;
import java.util.Set;

/**
 * Outcome of building a load balancer from one node set.
 *
 * Holds either the balancer or the factory's rejection, never both, together
 * with the node set it was built from. The version orders snapshots by the
 * moment their build began; a snapshot only replaces an older one.
 */
public record LoadBalancerSnapshot(
        long version,
        Set<Node> nodes,
        LoadBalancer loadBalancer,
        InvalidClusterException failure
) {
    /** Snapshot in place before the first build. */
    public static final LoadBalancerSnapshot EMPTY = new LoadBalancerSnapshot(0, Set.of(), null, null);

    public LoadBalancerSnapshot {
        nodes = Set.copyOf(nodes);
        if (loadBalancer != null && failure != null) {
            throw new IllegalArgumentException("A snapshot holds either a load balancer or a failure");
        }
    }

    static LoadBalancerSnapshot ready(long version, Set<Node> nodes, LoadBalancer loadBalancer) {
        return new LoadBalancerSnapshot(version, nodes, loadBalancer, null);
    }

    static LoadBalancerSnapshot rejected(long version, Set<Node> nodes, InvalidClusterException failure) {
        return new LoadBalancerSnapshot(version, nodes, null, failure);
    }

    public boolean isRejected() {
        return failure != null;
    }

    public Optional<LoadBalancer> getLoadBalancer() {
        return Optional.ofNullable(loadBalancer);
    }

    /**
     * Keeps whichever of the two snapshots started building last.
     */
    static LoadBalancerSnapshot latest(LoadBalancerSnapshot current, LoadBalancerSnapshot candidate) {
        return candidate.version > current.version ? candidate : current;
    }
}
