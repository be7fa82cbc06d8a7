package fr.lapetina.cluster.network.infrastructure.cluster;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.Set;

/**
 * Live view of cluster membership and connectivity.
 *
 * Implementations deliver {@link ClusterEvent}s to registered listeners,
 * possibly from a thread of their own, and must be safe for concurrent use.
 */
public interface ClusterView {

    /**
     * Starts the view and connects it to the cluster.
     * Calling it again while started does nothing.
     */
    void start();

    /**
     * Disconnects from the cluster and releases resources. Terminal.
     */
    void shutdown();

    /**
     * Returns the current membership snapshot. Never null.
     */
    Set<Node> getNodes();

    boolean isConnected();

    boolean isShutdown();

    /**
     * Registers a listener for cluster events.
     *
     * @return Key used to remove the listener
     */
    ClusterListenerKey addListener(ClusterListener listener);

    /**
     * Removes a listener. Unknown keys are ignored.
     */
    void removeListener(ClusterListenerKey key);
}
