package fr.lapetina.cluster.network.infrastructure.cluster;

/**
 * Listener interface for cluster events.
 */
@FunctionalInterface
public interface ClusterListener {

    /**
     * Called on the cluster view's notification thread for every event.
     *
     * @param event The membership or connectivity change
     */
    void handleClusterEvent(ClusterEvent event);
}
