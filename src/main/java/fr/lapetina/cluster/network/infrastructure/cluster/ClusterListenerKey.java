package fr.lapetina.cluster.network.infrastructure.cluster;

/**
 * Opaque handle identifying a listener registration on a {@link ClusterView}.
 */
public record ClusterListenerKey(long id) {
}
