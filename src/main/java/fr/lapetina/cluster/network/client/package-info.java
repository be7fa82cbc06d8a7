/**
 * Client-side routing core: lifecycle-gated factory and stateless clients.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.cluster.network.client.NetworkClientFactory} - Owns the cluster subscription,
 *       keeps the load balancer in step with membership and mints clients</li>
 *   <li>{@link fr.lapetina.cluster.network.client.NetworkClient} - Broadcast, targeted and balanced sends</li>
 *   <li>{@link fr.lapetina.cluster.network.client.LoadBalancerSnapshot} - Balancer or rejection, with its node set</li>
 *   <li>{@link fr.lapetina.cluster.network.client.BroadcastHandle} - Per-node futures of a broadcast</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>The cluster view delivers events on its own thread while callers send concurrently.
 * The only shared mutable state is the load balancer snapshot, held in an
 * {@code AtomicReference} and replaced as a whole. Sends that race a rebuild use
 * either the previous or the new snapshot, never a mix of both.
 */
package fr.lapetina.cluster.network.client;
