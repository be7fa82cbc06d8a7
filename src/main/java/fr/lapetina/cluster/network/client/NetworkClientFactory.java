package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.exception.ClusterShutdownException;
import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.exception.NetworkNotStartedException;
import fr.lapetina.cluster.network.domain.model.Node;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancer;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactory;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterEvent;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterListenerKey;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterView;
import fr.lapetina.cluster.network.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.cluster.network.infrastructure.transport.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle-gated owner of the cluster subscription and of the load balancer.
 *
 * <p>Once started, the factory listens to its {@link ClusterView} and rebuilds
 * the load balancer on every {@code CONNECTED} or {@code NODES_CHANGED} event.
 * The current {@link LoadBalancerSnapshot} is swapped atomically, so readers
 * always see a balancer together with the node set it was built from. A node
 * set rejected by the {@link LoadBalancerFactory} replaces the snapshot with
 * the rejection, so balanced sends fail instead of using an outdated balancer.
 *
 * <p>Lifecycle transitions are serialized by a single lock. The factory owns
 * the cluster view and the transport: shutting it down shuts both down.
 *
 * <pre>{@code
 * NetworkClientFactory factory = new NetworkClientFactory(clusterView, transport, new RoundRobinLoadBalancerFactory());
 * factory.start();
 * NetworkClient client = factory.newClient();
 * client.sendMessage(Message.of("greeting", payload));
 * }</pre>
 */
public final class NetworkClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkClientFactory.class);

    private final ClusterView clusterView;
    private final TransportClient transportClient;
    private final LoadBalancerFactory loadBalancerFactory;
    private final MetricsRegistry metrics;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicReference<LoadBalancerSnapshot> loadBalancer =
            new AtomicReference<>(LoadBalancerSnapshot.EMPTY);
    private final AtomicLong nextSnapshotVersion = new AtomicLong(1);

    private volatile LifecycleState state = LifecycleState.NOT_STARTED;

    // Guarded by lifecycleLock
    private ClusterListenerKey listenerKey;

    public NetworkClientFactory(
            ClusterView clusterView,
            TransportClient transportClient,
            LoadBalancerFactory loadBalancerFactory,
            MetricsRegistry metrics
    ) {
        this.clusterView = Objects.requireNonNull(clusterView, "Cluster view is required");
        this.transportClient = Objects.requireNonNull(transportClient, "Transport client is required");
        this.loadBalancerFactory = Objects.requireNonNull(loadBalancerFactory, "Load balancer factory is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
    }

    public NetworkClientFactory(
            ClusterView clusterView,
            TransportClient transportClient,
            LoadBalancerFactory loadBalancerFactory
    ) {
        this(clusterView, transportClient, loadBalancerFactory, MetricsRegistry.inMemory());
    }

    /**
     * Starts the cluster view, subscribes to it and builds the first load balancer.
     * Calling it again while started does nothing.
     *
     * <p>If subscribing or reading the membership fails, the listener is removed
     * and the factory stays {@link LifecycleState#NOT_STARTED}. The cluster view
     * is left started; a later call starts it again, which it treats as a no-op.
     *
     * @throws ClusterShutdownException if the factory has been shut down
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.SHUT_DOWN) {
                throw new ClusterShutdownException("Cannot start a network client factory after shutdown");
            }
            if (state == LifecycleState.STARTED) {
                return;
            }

            log.info("Starting network client factory");
            ClusterListenerKey key = null;
            try {
                clusterView.start();
                key = clusterView.addListener(this::handleClusterEvent);
                long version = nextSnapshotVersion.getAndIncrement();
                install(buildSnapshot(version, clusterView.getNodes()));
            } catch (RuntimeException e) {
                if (key != null) {
                    clusterView.removeListener(key);
                }
                log.error("Failed to start network client factory", e);
                throw e;
            }

            listenerKey = key;
            state = LifecycleState.STARTED;
            log.info("Network client factory started: nodes={}, connected={}",
                    clusterView.getNodes().size(), clusterView.isConnected());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Creates a client bound to this factory.
     *
     * @throws NetworkNotStartedException if {@link #start()} has not completed
     * @throws ClusterShutdownException if the factory has been shut down
     */
    public NetworkClient newClient() {
        LifecycleState current = state;
        if (current == LifecycleState.NOT_STARTED) {
            throw new NetworkNotStartedException();
        }
        if (current == LifecycleState.SHUT_DOWN) {
            throw new ClusterShutdownException();
        }
        return new NetworkClient(this);
    }

    /**
     * Unsubscribes from the cluster view and shuts down the cluster view and the transport.
     *
     * Both resources are released even if one of them fails; the first failure
     * is rethrown once both have been attempted. Calling it again does nothing.
     */
    public void shutdown() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.SHUT_DOWN) {
                return;
            }
            log.info("Shutting down network client factory");
            state = LifecycleState.SHUT_DOWN;

            RuntimeException failure = null;
            if (listenerKey != null) {
                try {
                    clusterView.removeListener(listenerKey);
                } catch (RuntimeException e) {
                    failure = recordFailure(failure, e, "cluster listener");
                }
                listenerKey = null;
            }

            try {
                clusterView.shutdown();
            } catch (RuntimeException e) {
                failure = recordFailure(failure, e, "cluster view");
            }

            try {
                transportClient.shutdown();
            } catch (RuntimeException e) {
                failure = recordFailure(failure, e, "transport client");
            }

            if (failure != null) {
                throw failure;
            }
            log.info("Network client factory shut down");
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public LifecycleState getState() {
        return state;
    }

    public boolean isStarted() {
        return state == LifecycleState.STARTED;
    }

    public boolean isShutdown() {
        return state == LifecycleState.SHUT_DOWN;
    }

    /**
     * Returns the load balancer snapshot currently used for balanced sends.
     */
    public LoadBalancerSnapshot getLoadBalancerSnapshot() {
        return loadBalancer.get();
    }

    ClusterView clusterView() {
        return clusterView;
    }

    TransportClient transportClient() {
        return transportClient;
    }

    MetricsRegistry metrics() {
        return metrics;
    }

    /**
     * Invoked on the cluster view's delivery thread.
     */
    void handleClusterEvent(ClusterEvent event) {
        if (state == LifecycleState.SHUT_DOWN) {
            log.debug("Ignoring cluster event after shutdown: type={}", event.type());
            return;
        }

        if (event.carriesNodes()) {
            long version = nextSnapshotVersion.getAndIncrement();
            log.info("Cluster membership received: type={}, nodes={}, version={}",
                    event.type(), event.nodes().size(), version);
            install(buildSnapshot(version, event.nodes()));
        } else if (event.type() == ClusterEvent.Type.DISCONNECTED) {
            log.warn("Cluster disconnected, sends will fail until reconnection");
        } else {
            log.info("Cluster view reported shutdown");
        }
    }

    private LoadBalancerSnapshot buildSnapshot(long version, Set<Node> nodes) {
        try {
            LoadBalancer balancer = loadBalancerFactory.newLoadBalancer(nodes);
            metrics.incrementRebuilds("success");
            log.debug("Load balancer built: version={}, nodes={}", version, nodes.size());
            return LoadBalancerSnapshot.ready(version, nodes, balancer);
        } catch (InvalidClusterException e) {
            metrics.incrementRebuilds("rejected");
            log.warn("Node set rejected by load balancer factory: version={}, nodes={}, reason={}",
                    version, nodes.size(), e.getMessage());
            return LoadBalancerSnapshot.rejected(version, nodes, e);
        } catch (RuntimeException e) {
            metrics.incrementRebuilds("rejected");
            log.error("Load balancer factory failed: version={}, nodes={}", version, nodes.size(), e);
            return LoadBalancerSnapshot.rejected(version, nodes,
                    new InvalidClusterException("Load balancer factory failed: " + e.getMessage(), e));
        }
    }

    private void install(LoadBalancerSnapshot candidate) {
        LoadBalancerSnapshot installed = loadBalancer.accumulateAndGet(candidate, LoadBalancerSnapshot::latest);
        if (installed != candidate) {
            log.debug("Load balancer snapshot superseded: version={}, current={}",
                    candidate.version(), installed.version());
        }
        // Gauge follows the installed snapshot, not the candidate
        metrics.setClusterNodes(loadBalancer.get().nodes().size());
    }

    private static RuntimeException recordFailure(RuntimeException first, RuntimeException next, String resource) {
        log.warn("Error shutting down {}", resource, next);
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }
}
