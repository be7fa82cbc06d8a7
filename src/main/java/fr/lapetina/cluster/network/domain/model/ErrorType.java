package fr.lapetina.cluster.network.domain.model;

/**
 * Error taxonomy for routing operations.
 * Lets callers branch on the kind of failure rather than on the exception text.
 */
public enum ErrorType {
    /** A client was requested or used before the factory was started */
    NETWORK_NOT_STARTED,

    /** The factory or the cluster view has been shut down */
    CLUSTER_SHUTDOWN,

    /** The cluster view reports no connection to the cluster */
    CLUSTER_DISCONNECTED,

    /** The target node is not a current cluster member */
    INVALID_NODE,

    /** The load balancer factory rejected the current node set */
    INVALID_CLUSTER,

    /** The load balancer had no node to offer */
    NO_NODES_AVAILABLE
}
