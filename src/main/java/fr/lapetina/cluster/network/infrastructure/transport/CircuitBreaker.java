package fr.lapetina.cluster.network.infrastructure.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-node circuit breaker used by the HTTP transport.
 *
 * States:
 * - CLOSED: sends pass through, consecutive failures are counted
 * - OPEN: failure threshold reached, sends fail fast until the recovery timeout elapses
 * - HALF_OPEN: trial sends allowed; enough successes close the circuit, one failure reopens it
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int nodeId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenSuccessThreshold;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(int nodeId, int failureThreshold, Duration recoveryTimeout, int halfOpenSuccessThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        this.nodeId = nodeId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenSuccessThreshold = Math.max(1, halfOpenSuccessThreshold);
    }

    /**
     * Checks whether a send may go through.
     *
     * @return false while the circuit is open
     */
    public boolean allowRequest() {
        return getState() != State.OPEN;
    }

    public void recordSuccess() {
        switch (state.get()) {
            case CLOSED -> consecutiveFailures.set(0);
            case HALF_OPEN -> {
                if (halfOpenSuccesses.incrementAndGet() >= halfOpenSuccessThreshold
                        && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                    consecutiveFailures.set(0);
                    log.info("Circuit breaker CLOSED after recovery: nodeId={}", nodeId);
                }
            }
            case OPEN -> {
                // Late completion of a send issued before the circuit opened
            }
        }
    }

    public void recordFailure() {
        switch (state.get()) {
            case CLOSED -> {
                int failures = consecutiveFailures.incrementAndGet();
                if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                    openedAt = Instant.now();
                    log.warn("Circuit breaker OPENED: nodeId={}, failures={}", nodeId, failures);
                }
            }
            case HALF_OPEN -> {
                if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                    openedAt = Instant.now();
                    log.warn("Circuit breaker OPENED after failed trial: nodeId={}", nodeId);
                }
            }
            case OPEN -> {
                // Already open
            }
        }
    }

    /**
     * Returns the current state, moving OPEN to HALF_OPEN once the recovery timeout has elapsed.
     */
    public State getState() {
        Instant opened = openedAt;
        if (state.get() == State.OPEN && opened != null
                && Instant.now().isAfter(opened.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit breaker HALF_OPEN: nodeId={}", nodeId);
        }
        return state.get();
    }

    /**
     * Closes the circuit and clears failure counts.
     */
    public void reset() {
        State previous = state.getAndSet(State.CLOSED);
        consecutiveFailures.set(0);
        halfOpenSuccesses.set(0);
        if (previous != State.CLOSED) {
            log.info("Circuit breaker reset from {}: nodeId={}", previous, nodeId);
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getNodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "nodeId=" + nodeId +
                ", state=" + state.get() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
