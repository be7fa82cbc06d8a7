package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Thrown when a client is requested or used before the factory has been started.
 */
public final class NetworkNotStartedException extends NetworkException {

    public NetworkNotStartedException() {
        super(ErrorType.NETWORK_NOT_STARTED, "Network client factory has not been started");
    }
}
