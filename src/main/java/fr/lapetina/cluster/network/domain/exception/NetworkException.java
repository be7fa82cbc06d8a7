package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;

/**
 * Base class of every routing failure raised synchronously by the network client.
 *
 * Each subclass maps to exactly one {@link ErrorType}, so callers can either
 * catch a specific subclass or catch this type and switch on {@link #getErrorType()}.
 */
public abstract class NetworkException extends RuntimeException {

    private final ErrorType errorType;

    protected NetworkException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected NetworkException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
