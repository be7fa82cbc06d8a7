package fr.lapetina.cluster.network.client;

/**
 * Lifecycle of a {@link NetworkClientFactory}.
 *
 * NOT_STARTED -> STARTED -> SHUT_DOWN, or NOT_STARTED -> SHUT_DOWN.
 * SHUT_DOWN is terminal.
 */
public enum LifecycleState {
    NOT_STARTED,
    STARTED,
    SHUT_DOWN
}
