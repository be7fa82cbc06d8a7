/**
 * Cluster Network Client - Cluster-aware message routing for a set of HTTP nodes.
 *
 * <p>This library keeps a live view of cluster membership, rebuilds a load balancer
 * whenever membership changes and routes messages to one node, a chosen node or every node.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.cluster.network.NetworkClientBootstrap} - Main entry point for creating
 *       a fully-configured client factory from YAML configuration</li>
 *   <li>{@link fr.lapetina.cluster.network.client.NetworkClientFactory} - Lifecycle and load balancer owner</li>
 *   <li>{@link fr.lapetina.cluster.network.client.NetworkClient} - Broadcast, targeted and balanced sends</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (NetworkClientBootstrap bootstrap = NetworkClientBootstrap.create("cluster.yaml").start()) {
 *     NetworkClient client = bootstrap.newClient();
 *
 *     Message message = Message.of("greeting", "Hello!".getBytes(StandardCharsets.UTF_8));
 *     CompletableFuture<MessageResponse> future = client.sendMessage(message);
 *
 *     MessageResponse response = future.get();
 *     System.out.println(response.statusCode());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Load balancer rebuilt on every membership change</li>
 *   <li>Pluggable load balancing policies (round-robin, random)</li>
 *   <li>Circuit breaker pattern for fault tolerance</li>
 *   <li>Hot-reload of cluster membership from configuration</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.cluster.network.NetworkClientBootstrap
 * @see fr.lapetina.cluster.network.client.NetworkClientFactory
 */
package fr.lapetina.cluster.network;
