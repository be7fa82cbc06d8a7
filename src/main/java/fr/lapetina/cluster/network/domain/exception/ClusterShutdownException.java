package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Thrown when an operation is attempted after shutdown, including a start after shutdown.
 */
public final class ClusterShutdownException extends NetworkException {

    public ClusterShutdownException() {
        super(ErrorType.CLUSTER_SHUTDOWN, "Cluster has been shut down");
    }

    public ClusterShutdownException(String message) {
        super(ErrorType.CLUSTER_SHUTDOWN, message);
    }
}
