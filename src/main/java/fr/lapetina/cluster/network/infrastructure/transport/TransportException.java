package fr.lapetina.cluster.network.infrastructure.transport;

/**
 * Delivery failure reported through a transport future.
 */
public final class TransportException extends RuntimeException {

    private final Reason reason;
    private final int nodeId;
    private final int statusCode;

    public TransportException(Reason reason, int nodeId, String details) {
        this(reason, nodeId, -1, details, null);
    }

    public TransportException(Reason reason, int nodeId, int statusCode, String details, Throwable cause) {
        super(reason.getMessage() + ": nodeId=" + nodeId + (details != null ? " - " + details : ""), cause);
        this.reason = reason;
        this.nodeId = nodeId;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    public int getNodeId() {
        return nodeId;
    }

    /**
     * HTTP status returned by the node, or -1 if none was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public enum Reason {
        CIRCUIT_OPEN("Circuit breaker is open"),
        HTTP_ERROR("Node answered with an error status"),
        IO_ERROR("Node could not be reached"),
        TIMEOUT("Node did not answer in time"),
        SHUT_DOWN("Transport has been shut down");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
