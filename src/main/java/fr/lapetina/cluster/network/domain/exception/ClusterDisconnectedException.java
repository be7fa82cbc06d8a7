package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Thrown when the cluster view reports that it is not connected at call time.
 */
public final class ClusterDisconnectedException extends NetworkException {

    public ClusterDisconnectedException() {
        super(ErrorType.CLUSTER_DISCONNECTED, "Cluster is disconnected");
    }
}
