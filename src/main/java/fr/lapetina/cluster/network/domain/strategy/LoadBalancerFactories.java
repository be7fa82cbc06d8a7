package fr.lapetina.cluster.network.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * Registry of load balancer factories by policy name.
 *
 * A registered supplier receives the {@code minimumAvailableNodes}
 * setting from configuration.
 */
public final class LoadBalancerFactories {

    private static final Map<String, IntFunction<LoadBalancerFactory>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(RoundRobinLoadBalancerFactory.NAME, RoundRobinLoadBalancerFactory::new);
        register(RandomLoadBalancerFactory.NAME, RandomLoadBalancerFactory::new);
    }

    private LoadBalancerFactories() {
        // Utility class
    }

    /**
     * Registers a custom policy.
     *
     * @param name Policy name (used in configuration)
     * @param supplier Creates a factory for a given minimum of available nodes
     */
    public static void register(String name, IntFunction<LoadBalancerFactory> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a factory by policy name.
     *
     * @return Factory instance, or empty if the name is unknown
     */
    public static Optional<LoadBalancerFactory> create(String name, int minimumAvailableNodes) {
        if (name == null) {
            return Optional.empty();
        }
        IntFunction<LoadBalancerFactory> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.apply(minimumAvailableNodes));
    }

    /**
     * Returns all registered policy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
