package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Thrown when a load balancer factory rejects a node set.
 *
 * The message is the rejection reason reported by the factory; it is kept
 * intact when the failure is later surfaced to a balanced send.
 */
public final class InvalidClusterException extends NetworkException {

    public InvalidClusterException(String reason) {
        super(ErrorType.INVALID_CLUSTER, reason);
    }

    public InvalidClusterException(String reason, Throwable cause) {
        super(ErrorType.INVALID_CLUSTER, reason, cause);
    }
}
