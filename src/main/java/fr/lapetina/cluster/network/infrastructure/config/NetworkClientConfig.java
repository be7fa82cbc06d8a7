package fr.lapetina.cluster.network.infrastructure.config;

import fr.lapetina.cluster.network.domain.model.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the network client.
 * Designed to be populated from YAML.
 */
public class NetworkClientConfig {

    private ClusterConfig cluster = new ClusterConfig();
    private LoadBalancerConfig loadBalancer = new LoadBalancerConfig();
    private TransportConfig transport = new TransportConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ClusterConfig getCluster() { return cluster; }
    public void setCluster(ClusterConfig cluster) { this.cluster = cluster; }

    public LoadBalancerConfig getLoadBalancer() { return loadBalancer; }
    public void setLoadBalancer(LoadBalancerConfig loadBalancer) { this.loadBalancer = loadBalancer; }

    public TransportConfig getTransport() { return transport; }
    public void setTransport(TransportConfig transport) { this.transport = transport; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Cluster identity and static membership.
     */
    public static class ClusterConfig {
        private String name = "default";
        private List<NodeConfig> nodes = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<NodeConfig> getNodes() { return nodes; }
        public void setNodes(List<NodeConfig> nodes) { this.nodes = nodes != null ? nodes : new ArrayList<>(); }

        /**
         * Converts the configured members to domain nodes.
         */
        public List<Node> toNodes() {
            return nodes.stream().map(NodeConfig::toNode).toList();
        }
    }

    /**
     * Individual cluster member.
     */
    public static class NodeConfig {
        private int id;
        private String url;
        private boolean available = true;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public boolean isAvailable() { return available; }
        public void setAvailable(boolean available) { this.available = available; }

        public Node toNode() {
            if (url == null || url.isBlank()) {
                throw new ConfigLoader.ConfigurationException("Node " + id + " has no url");
            }
            return Node.builder().id(id).url(url).available(available).build();
        }
    }

    /**
     * Load balancing policy selection.
     */
    public static class LoadBalancerConfig {
        private String type = "round-robin";
        private int minimumAvailableNodes = 0;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getMinimumAvailableNodes() { return minimumAvailableNodes; }
        public void setMinimumAvailableNodes(int minimumAvailableNodes) { this.minimumAvailableNodes = minimumAvailableNodes; }
    }

    /**
     * HTTP transport settings.
     */
    public static class TransportConfig {
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 30000;
        private String messagePath = "/messages";
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getMessagePath() { return messagePath; }
        public void setMessagePath(String messagePath) { this.messagePath = messagePath; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "cluster_network";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
