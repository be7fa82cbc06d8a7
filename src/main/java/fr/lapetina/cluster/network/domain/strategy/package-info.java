/**
 * Load balancing policies for choosing the node of a balanced send.
 *
 * <p>A {@link fr.lapetina.cluster.network.domain.strategy.LoadBalancer} is built by a
 * {@link fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactory} from one immutable
 * node set and never outlives it: every membership change yields a new balancer.
 *
 * <h2>Available Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through available nodes by ascending id</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random choice among available nodes</td></tr>
 * </table>
 *
 * <h2>Custom Policies</h2>
 * <p>Implement {@link fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactory} and register it
 * with {@link fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactories}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancerFactory factory = LoadBalancerFactories.create("round-robin", 1).orElseThrow();
 * Optional<Node> node = factory.newLoadBalancer(nodes).nextNode();
 * }</pre>
 */
package fr.lapetina.cluster.network.domain.strategy;
