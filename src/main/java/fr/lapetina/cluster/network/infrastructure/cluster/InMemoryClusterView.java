package fr.lapetina.cluster.network.infrastructure.cluster;

import fr.lapetina.cluster.network.domain.exception.ClusterShutdownException;
import fr.lapetina.cluster.network.domain.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process cluster view whose membership is driven by the application.
 *
 * Membership is kept as an immutable snapshot that is replaced on every
 * change. Events are delivered in order on a single notification thread
 * ({@code cluster-notifier}) unless another executor is supplied.
 * Membership changes only produce {@code NODES_CHANGED} while connected;
 * a reconnect reports the current membership through {@code CONNECTED}.
 */
public final class InMemoryClusterView implements ClusterView {

    private static final Logger log = LoggerFactory.getLogger(InMemoryClusterView.class);

    private final String name;
    private final Map<Integer, Node> members = new HashMap<>();
    private final Map<ClusterListenerKey, ClusterListener> listeners = new ConcurrentHashMap<>();
    private final AtomicLong nextListenerId = new AtomicLong(1);
    private final Executor notifier;
    private final ExecutorService ownedNotifier;

    private volatile Set<Node> snapshot = Set.of();
    private volatile boolean started;
    private volatile boolean connected;
    private volatile boolean shutdown;

    public InMemoryClusterView(String name, Collection<Node> initialNodes) {
        this(name, initialNodes, null);
    }

    /**
     * Creates a view delivering events through the given executor.
     *
     * @param executor Event delivery executor, or null for a dedicated notification thread
     */
    public InMemoryClusterView(String name, Collection<Node> initialNodes, Executor executor) {
        this.name = Objects.requireNonNull(name, "Cluster name is required");
        if (executor == null) {
            this.ownedNotifier = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "cluster-notifier");
                t.setDaemon(true);
                return t;
            });
            this.notifier = ownedNotifier;
        } else {
            this.ownedNotifier = null;
            this.notifier = executor;
        }
        if (initialNodes != null) {
            for (Node node : initialNodes) {
                members.put(node.getId(), node);
            }
        }
        this.snapshot = Set.copyOf(members.values());
    }

    public String getName() {
        return name;
    }

    @Override
    public synchronized void start() {
        ensureNotShutdown();
        if (started) {
            return;
        }
        started = true;
        connected = true;
        log.info("Cluster view connected: cluster={}, nodes={}", name, snapshot.size());
        publish(ClusterEvent.connected(snapshot));
    }

    @Override
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        connected = false;
        log.info("Cluster view shut down: cluster={}", name);
        publish(ClusterEvent.shutdown());
        if (ownedNotifier != null) {
            // Already queued events are still delivered
            ownedNotifier.shutdown();
        }
    }

    @Override
    public Set<Node> getNodes() {
        return snapshot;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public ClusterListenerKey addListener(ClusterListener listener) {
        Objects.requireNonNull(listener, "Listener is required");
        ClusterListenerKey key = new ClusterListenerKey(nextListenerId.getAndIncrement());
        listeners.put(key, listener);
        log.debug("Cluster listener added: cluster={}, key={}", name, key.id());
        return key;
    }

    @Override
    public void removeListener(ClusterListenerKey key) {
        if (key != null && listeners.remove(key) != null) {
            log.debug("Cluster listener removed: cluster={}, key={}", name, key.id());
        }
    }

    /**
     * Adds a node or replaces the member with the same id.
     */
    public synchronized void addNode(Node node) {
        ensureNotShutdown();
        Node previous = members.put(node.getId(), node);
        if (previous == null) {
            log.info("Node joined: cluster={}, node={}", name, node);
            membershipChanged();
        } else if (!sameState(previous, node)) {
            log.info("Node updated: cluster={}, node={}", name, node);
            membershipChanged();
        }
    }

    /**
     * Removes a node by id.
     */
    public synchronized Optional<Node> removeNode(int nodeId) {
        ensureNotShutdown();
        Node removed = members.remove(nodeId);
        if (removed != null) {
            log.info("Node left: cluster={}, node={}", name, removed);
            membershipChanged();
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Replaces the whole membership, emitting at most one event.
     */
    public synchronized void replaceNodes(Collection<Node> newNodes) {
        ensureNotShutdown();
        Map<Integer, Node> replacement = new HashMap<>();
        for (Node node : newNodes) {
            replacement.put(node.getId(), node);
        }

        boolean changed = replacement.size() != members.size();
        if (!changed) {
            for (Node node : replacement.values()) {
                Node existing = members.get(node.getId());
                if (existing == null || !sameState(existing, node)) {
                    changed = true;
                    break;
                }
            }
        }

        if (changed) {
            members.clear();
            members.putAll(replacement);
            log.info("Cluster membership replaced: cluster={}, nodes={}", name, members.size());
            membershipChanged();
        }
    }

    /**
     * Marks a member as eligible or ineligible for balanced traffic.
     *
     * @return false if no member has that id
     */
    public synchronized boolean markNodeAvailable(int nodeId, boolean available) {
        ensureNotShutdown();
        Node existing = members.get(nodeId);
        if (existing == null) {
            return false;
        }
        if (existing.isAvailable() != available) {
            members.put(nodeId, existing.withAvailable(available));
            log.info("Node availability changed: cluster={}, nodeId={}, available={}", name, nodeId, available);
            membershipChanged();
        }
        return true;
    }

    /**
     * Simulates losing the connection to the cluster.
     */
    public synchronized void disconnect() {
        ensureNotShutdown();
        if (connected) {
            connected = false;
            log.warn("Cluster view disconnected: cluster={}", name);
            publish(ClusterEvent.disconnected());
        }
    }

    /**
     * Restores the connection after {@link #disconnect()}.
     */
    public synchronized void reconnect() {
        ensureNotShutdown();
        if (started && !connected) {
            connected = true;
            log.info("Cluster view reconnected: cluster={}, nodes={}", name, snapshot.size());
            publish(ClusterEvent.connected(snapshot));
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    private void membershipChanged() {
        snapshot = Set.copyOf(members.values());
        if (connected) {
            publish(ClusterEvent.nodesChanged(snapshot));
        }
    }

    private void publish(ClusterEvent event) {
        try {
            notifier.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Cluster event dropped, notifier unavailable: cluster={}, type={}", name, event.type());
        }
    }

    private void deliver(ClusterEvent event) {
        for (ClusterListener listener : listeners.values()) {
            try {
                listener.handleClusterEvent(event);
            } catch (Exception e) {
                log.error("Error notifying cluster listener: cluster={}, type={}", name, event.type(), e);
            }
        }
    }

    private void ensureNotShutdown() {
        if (shutdown) {
            throw new ClusterShutdownException("Cluster view has been shut down: " + name);
        }
    }

    private static boolean sameState(Node a, Node b) {
        return a.isAvailable() == b.isAvailable() && a.getUrl().equals(b.getUrl());
    }
}
