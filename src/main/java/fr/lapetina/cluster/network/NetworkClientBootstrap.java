package fr.lapetina.cluster.network;

import fr.lapetina.cluster.network.client.NetworkClient;
import fr.lapetina.cluster.network.client.NetworkClientFactory;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactories;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactory;
import fr.lapetina.cluster.network.domain.strategy.RoundRobinLoadBalancerFactory;
import fr.lapetina.cluster.network.infrastructure.cluster.InMemoryClusterView;
import fr.lapetina.cluster.network.infrastructure.config.ConfigLoader;
import fr.lapetina.cluster.network.infrastructure.config.NetworkClientConfig;
import fr.lapetina.cluster.network.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.cluster.network.infrastructure.transport.HttpTransportClient;
import fr.lapetina.cluster.network.infrastructure.transport.TransportClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates a fully-wired {@link NetworkClientFactory} from configuration.
 * This is the primary entry point for obtaining clients of a statically
 * configured cluster.
 *
 * <p>Usage:
 * <pre>{@code
 * try (NetworkClientBootstrap bootstrap = NetworkClientBootstrap.create("cluster.yaml").start()) {
 *     NetworkClient client = bootstrap.newClient();
 *     client.sendMessage(Message.of("greeting", payload));
 * }
 * }</pre>
 */
public class NetworkClientBootstrap implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkClientBootstrap.class);

    private final ConfigLoader configLoader;
    private final NetworkClientConfig config;
    private final MetricsRegistry metricsRegistry;
    private final InMemoryClusterView clusterView;
    private final TransportClient transportClient;
    private final LoadBalancerFactory loadBalancerFactory;
    private final NetworkClientFactory clientFactory;

    protected NetworkClientBootstrap(String configPath, TransportClient transportOverride) {
        this(configPath, transportOverride, null);
    }

    /**
     * @param clusterEventExecutor Delivers cluster events, or null for the cluster view's own notification thread
     */
    protected NetworkClientBootstrap(String configPath, TransportClient transportOverride, Executor clusterEventExecutor) {
        log.info("Initializing NetworkClientBootstrap from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? MetricsRegistry.prometheus(config.getMetrics().getPrefix())
                : MetricsRegistry.inMemory();

        // Initialize cluster membership
        this.clusterView = new InMemoryClusterView(
                config.getCluster().getName(),
                config.getCluster().toNodes(),
                clusterEventExecutor
        );

        // Initialize transport (allow override for testing)
        this.transportClient = transportOverride != null ? transportOverride : createTransportClient();

        // Resolve load balancing policy
        this.loadBalancerFactory = createLoadBalancerFactory(config.getLoadBalancer());

        this.clientFactory = new NetworkClientFactory(
                clusterView,
                transportClient,
                loadBalancerFactory,
                metricsRegistry
        );

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("NetworkClientBootstrap initialized: cluster={}, nodes={}",
                clusterView.getName(), clusterView.getNodes().size());
    }

    /**
     * Creates a bootstrap from the specified configuration file.
     */
    public static NetworkClientBootstrap create(String configPath) {
        return new NetworkClientBootstrap(configPath, null);
    }

    /**
     * Creates a bootstrap from the default configuration (cluster.yaml).
     */
    public static NetworkClientBootstrap create() {
        return create("cluster.yaml");
    }

    /**
     * Starts the client factory and configuration watching. Calling it again does nothing.
     */
    public NetworkClientBootstrap start() {
        clientFactory.start();
        configLoader.startWatching();
        log.info("Network client started");
        return this;
    }

    /**
     * Creates a client from the underlying factory.
     */
    public NetworkClient newClient() {
        return clientFactory.newClient();
    }

    public NetworkClientFactory getClientFactory() {
        return clientFactory;
    }

    public InMemoryClusterView getClusterView() {
        return clusterView;
    }

    public TransportClient getTransportClient() {
        return transportClient;
    }

    public LoadBalancerFactory getLoadBalancerFactory() {
        return loadBalancerFactory;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public NetworkClientConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private TransportClient createTransportClient() {
        NetworkClientConfig.TransportConfig transport = config.getTransport();
        return new HttpTransportClient(
                Duration.ofMillis(transport.getConnectTimeoutMs()),
                Duration.ofMillis(transport.getRequestTimeoutMs()),
                transport.getMessagePath(),
                transport.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(transport.getCircuitBreakerRecoveryMs())
        );
    }

    private static LoadBalancerFactory createLoadBalancerFactory(NetworkClientConfig.LoadBalancerConfig lbConfig) {
        String type = lbConfig.getType();
        int minimum = lbConfig.getMinimumAvailableNodes();
        return LoadBalancerFactories.create(type, minimum)
                .map(factory -> {
                    log.info("Using load balancing policy: type={}, minimumAvailableNodes={}", type, minimum);
                    return factory;
                })
                .orElseGet(() -> {
                    log.warn("Unknown load balancing policy, falling back: type={}, fallback={}",
                            type, RoundRobinLoadBalancerFactory.NAME);
                    return new RoundRobinLoadBalancerFactory(minimum);
                });
    }

    private void onConfigChanged(NetworkClientConfig oldConfig, NetworkClientConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        if (clusterView.isShutdown()) {
            log.warn("Cluster view is shut down, configuration change ignored");
            return;
        }

        // Membership changes reach the factory as NODES_CHANGED
        clusterView.replaceNodes(newConfig.getCluster().toNodes());

        if (oldConfig != null && !sameLoadBalancer(oldConfig, newConfig)) {
            log.warn("Load balancing policy changed, restart required to apply: type={}, minimumAvailableNodes={}",
                    newConfig.getLoadBalancer().getType(), newConfig.getLoadBalancer().getMinimumAvailableNodes());
        }

        log.info("Configuration updates applied: nodes={}", clusterView.getNodes().size());
    }

    private static boolean sameLoadBalancer(NetworkClientConfig a, NetworkClientConfig b) {
        return Objects.equals(a.getLoadBalancer().getType(), b.getLoadBalancer().getType())
                && a.getLoadBalancer().getMinimumAvailableNodes() == b.getLoadBalancer().getMinimumAvailableNodes();
    }

    @Override
    public void close() {
        log.info("Shutting down NetworkClientBootstrap...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            clientFactory.close();
        } catch (Exception e) {
            log.warn("Error closing network client factory", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("NetworkClientBootstrap shut down");
    }
}
