package fr.lapetina.cluster.network.infrastructure.cluster;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Objects;
import java.util.Set;

/**
 * Membership or connectivity change reported by a {@link ClusterView}.
 *
 * {@code CONNECTED} and {@code NODES_CHANGED} carry the full node set as of
 * the change; the other kinds carry an empty set.
 */
public record ClusterEvent(Type type, Set<Node> nodes) {

    public enum Type {
        CONNECTED,
        NODES_CHANGED,
        DISCONNECTED,
        SHUTDOWN
    }

    public ClusterEvent {
        Objects.requireNonNull(type, "Event type is required");
        nodes = nodes != null ? Set.copyOf(nodes) : Set.of();
    }

    public static ClusterEvent connected(Set<Node> nodes) {
        return new ClusterEvent(Type.CONNECTED, nodes);
    }

    public static ClusterEvent nodesChanged(Set<Node> nodes) {
        return new ClusterEvent(Type.NODES_CHANGED, nodes);
    }

    public static ClusterEvent disconnected() {
        return new ClusterEvent(Type.DISCONNECTED, null);
    }

    public static ClusterEvent shutdown() {
        return new ClusterEvent(Type.SHUTDOWN, null);
    }

    /**
     * Whether this event carries a membership snapshot.
     */
    public boolean carriesNodes() {
        return type == Type.CONNECTED || type == Type.NODES_CHANGED;
    }
}
