/**
 * Domain model classes shared by the routing core and its collaborators.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.cluster.network.domain.model.Node} - Immutable cluster member, identified by id</li>
 *   <li>{@link fr.lapetina.cluster.network.domain.model.Message} - Immutable message to be delivered</li>
 *   <li>{@link fr.lapetina.cluster.network.domain.model.MessageResponse} - Acknowledgement from a node</li>
 *   <li>{@link fr.lapetina.cluster.network.domain.model.ErrorType} - Routing failure kinds</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every class in this package is immutable. Byte arrays are copied on the way in and out.
 */
package fr.lapetina.cluster.network.domain.model;
