package fr.lapetina.cluster.network.infrastructure.metrics;

import fr.lapetina.cluster.network.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized routing metrics using Micrometer.
 *
 * Provides:
 * - Dispatch counters per send mode and node
 * - Routing error counters by type
 * - Load balancer rebuild counters by outcome
 * - Cluster size gauge
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "cluster_network";

    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> sendCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rebuildCounters = new ConcurrentHashMap<>();

    private final AtomicInteger clusterNodes = new AtomicInteger(0);

    public MetricsRegistry(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        Gauge.builder(prefix + "_cluster_nodes", clusterNodes, AtomicInteger::get)
                .description("Number of nodes in the current cluster snapshot")
                .register(registry);

        log.debug("MetricsRegistry initialized: prefix={}, registry={}", prefix, registry.getClass().getSimpleName());
    }

    /**
     * Creates a registry backed by a Prometheus meter registry.
     */
    public static MetricsRegistry prometheus(String prefix) {
        return new MetricsRegistry(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix);
    }

    /**
     * Creates an in-memory registry, for embedded use and tests.
     */
    public static MetricsRegistry inMemory() {
        return new MetricsRegistry(new SimpleMeterRegistry(), DEFAULT_PREFIX);
    }

    /**
     * Counts a message handed to the transport.
     *
     * @param mode Send mode: {@code balanced}, {@code targeted} or {@code broadcast}
     */
    public void incrementMessagesSent(String mode, int nodeId) {
        String node = String.valueOf(nodeId);
        sendCounters.computeIfAbsent(mode + ":" + node, k ->
                Counter.builder(prefix + "_messages_sent_total")
                        .description("Messages handed to the transport")
                        .tag("mode", mode)
                        .tag("node", node)
                        .register(registry)
        ).increment();
    }

    public void incrementRoutingErrors(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_routing_errors_total")
                        .description("Routing failures raised to callers")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a load balancer rebuild.
     *
     * @param outcome {@code success} or {@code rejected}
     */
    public void incrementRebuilds(String outcome) {
        rebuildCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_load_balancer_rebuilds_total")
                        .description("Load balancer rebuilds triggered by membership changes")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void setClusterNodes(int value) {
        clusterNodes.set(value);
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
