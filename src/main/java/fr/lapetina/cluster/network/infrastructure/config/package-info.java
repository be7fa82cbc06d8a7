/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.cluster.network.infrastructure.config.NetworkClientConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.cluster.network.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.cluster.network.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code cluster} - Cluster name and static membership</li>
 *   <li>{@code loadBalancer} - Policy name and minimum number of available nodes</li>
 *   <li>{@code transport} - HTTP timeouts, message path and circuit breaker</li>
 *   <li>{@code metrics} - Metric name prefix</li>
 * </ul>
 *
 * <p>A reload that changes {@code cluster.nodes} is applied to the running cluster view,
 * which reports it as a membership change. Other sections only take effect on restart.
 */
package fr.lapetina.cluster.network.infrastructure.config;
