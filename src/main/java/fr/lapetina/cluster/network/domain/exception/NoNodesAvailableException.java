package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Thrown when the load balancer has no node to offer.
 */
public final class NoNodesAvailableException extends NetworkException {

    public NoNodesAvailableException() {
        super(ErrorType.NO_NODES_AVAILABLE, "No nodes available to route the message");
    }
}
