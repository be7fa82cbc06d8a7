package fr.lapetina.cluster.network.domain.exception;

import fr.lapetina.cluster.network.domain.model.ErrorType;
import fr.lapetina.cluster.network.domain.model.Node;

/**
 * Thrown when a caller targets a node that is not a current cluster member.
 */
public final class InvalidNodeException extends NetworkException {

    private final Node node;

    public InvalidNodeException(Node node) {
        super(ErrorType.INVALID_NODE, "Node is not a current cluster member: " + node);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
