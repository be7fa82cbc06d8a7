package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.exception.ClusterDisconnectedException;
import fr.lapetina.cluster.network.domain.exception.ClusterShutdownException;
import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.exception.InvalidNodeException;
import fr.lapetina.cluster.network.domain.exception.NoNodesAvailableException;
import fr.lapetina.cluster.network.domain.model.ErrorType;
import fr.lapetina.cluster.network.domain.model.Message;
import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancer;
import fr.lapetina.cluster.network.domain.strategy.LoadBalancerFactory;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterEvent;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterListener;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterListenerKey;
import fr.lapetina.cluster.network.infrastructure.cluster.ClusterView;
import fr.lapetina.cluster.network.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.cluster.network.infrastructure.transport.TransportClient;
import fr.lapetina.cluster.network.infrastructure.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NetworkClientTest {

    private static final Node NODE_1 = Node.of(1, "http://localhost:9001");
    private static final Node NODE_2 = Node.of(2, "http://localhost:9002");
    private static final Node NODE_3 = Node.of(3, "http://localhost:9003");
    private static final Set<Node> NODES = Set.of(NODE_1, NODE_2, NODE_3);

    private ClusterView clusterView;
    private TransportClient transportClient;
    private LoadBalancerFactory loadBalancerFactory;
    private LoadBalancer loadBalancer;
    private MetricsRegistry metrics;
    private NetworkClientFactory factory;
    private ClusterListener listener;

    private final Message message = Message.of("greeting", "hello".getBytes(StandardCharsets.UTF_8));

    @BeforeEach
    void setUp() {
        clusterView = mock(ClusterView.class);
        transportClient = mock(TransportClient.class);
        loadBalancerFactory = mock(LoadBalancerFactory.class);
        loadBalancer = mock(LoadBalancer.class);
        metrics = new MetricsRegistry(new SimpleMeterRegistry(), "test");

        when(clusterView.getNodes()).thenReturn(NODES);
        when(clusterView.isConnected()).thenReturn(true);
        when(clusterView.addListener(any())).thenAnswer(invocation -> {
            listener = invocation.getArgument(0);
            return new ClusterListenerKey(1);
        });
        when(loadBalancerFactory.newLoadBalancer(any())).thenReturn(loadBalancer);
        when(transportClient.sendMessage(any(), any())).thenAnswer(invocation -> {
            Node node = invocation.getArgument(0);
            Message sent = invocation.getArgument(1);
            return CompletableFuture.completedFuture(MessageResponse.of(sent.messageId(), node.getId(), 200));
        });

        factory = new NetworkClientFactory(clusterView, transportClient, loadBalancerFactory, metrics);
    }

    private NetworkClient startedClient() {
        factory.start();
        return factory.newClient();
    }

    private double routingErrors(ErrorType type) {
        return metrics.getRegistry().get("test_routing_errors_total").tag("type", type.name()).counter().count();
    }

    @Nested
    @DisplayName("sendMessageToNode")
    class SendMessageToNode {

        @Test
        @DisplayName("should send to the specified member")
        void shouldSendToMember() throws Exception {
            NetworkClient client = startedClient();

            MessageResponse response = client.sendMessageToNode(message, NODE_1).get(5, TimeUnit.SECONDS);

            assertThat(response.nodeId()).isEqualTo(1);
            assertThat(response.messageId()).isEqualTo(message.messageId());
            verify(transportClient, times(1)).sendMessage(NODE_1, message);
            verifyNoMoreInteractions(transportClient);
        }

        @Test
        @DisplayName("should reject a node that is not a member")
        void shouldRejectUnknownNode() {
            NetworkClient client = startedClient();
            Node stranger = Node.of(4, "http://localhost:9004");

            assertThatThrownBy(() -> client.sendMessageToNode(message, stranger))
                    .isInstanceOfSatisfying(InvalidNodeException.class,
                            e -> assertThat(e.getNode()).isSameAs(stranger));

            verify(transportClient, never()).sendMessage(any(), any());
            assertThat(routingErrors(ErrorType.INVALID_NODE)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should send to the member as currently reported by the cluster")
        void shouldUseCurrentMemberInstance() {
            NetworkClient client = startedClient();
            Node staleCopy = Node.of(2, "http://old-host:9002");

            client.sendMessageToNode(message, staleCopy);

            ArgumentCaptor<Node> captor = ArgumentCaptor.forClass(Node.class);
            verify(transportClient).sendMessage(captor.capture(), eq(message));
            assertThat(captor.getValue().getUrl()).isEqualTo(NODE_2.getUrl());
        }

        @Test
        @DisplayName("should pass transport failures through untouched")
        void shouldPassTransportFailures() {
            TransportException failure = new TransportException(TransportException.Reason.IO_ERROR, 1, "refused");
            doReturn(CompletableFuture.failedFuture(failure)).when(transportClient).sendMessage(any(), any());
            NetworkClient client = startedClient();

            CompletableFuture<MessageResponse> future = client.sendMessageToNode(message, NODE_1);

            assertThat(future).isCompletedExceptionally();
            assertThat(future.handle((r, e) -> e).join()).isSameAs(failure);
        }
    }

    @Nested
    @DisplayName("sendMessage")
    class SendMessage {

        @Test
        @DisplayName("should send to the node chosen by the load balancer")
        void shouldSendToChosenNode() {
            when(loadBalancer.nextNode()).thenReturn(Optional.of(NODE_3));
            NetworkClient client = startedClient();

            assertThat(client.sendMessage(message)).isNotNull();

            verify(loadBalancer).nextNode();
            verify(transportClient).sendMessage(NODE_3, message);
        }

        @Test
        @DisplayName("should fail when the load balancer has no node")
        void shouldFailWithoutNode() {
            when(loadBalancer.nextNode()).thenReturn(Optional.empty());
            NetworkClient client = startedClient();

            assertThatThrownBy(() -> client.sendMessage(message)).isInstanceOf(NoNodesAvailableException.class);

            verify(loadBalancer).nextNode();
            verify(transportClient, never()).sendMessage(any(), any());
        }

        @Test
        @DisplayName("should fail with the factory's reason when the node set was rejected")
        void shouldFailOnRejectedCluster() {
            when(loadBalancerFactory.newLoadBalancer(any())).thenThrow(new InvalidClusterException("need 2 nodes"));
            NetworkClient client = startedClient();

            assertThatThrownBy(() -> client.sendMessage(message))
                    .isInstanceOf(InvalidClusterException.class)
                    .hasMessage("need 2 nodes");

            verify(transportClient, never()).sendMessage(any(), any());
            assertThat(routingErrors(ErrorType.INVALID_CLUSTER)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should recover once a valid node set arrives")
        void shouldRecoverAfterRejection() {
            LoadBalancer recovered = mock(LoadBalancer.class);
            when(recovered.nextNode()).thenReturn(Optional.of(NODE_1));
            when(loadBalancerFactory.newLoadBalancer(any()))
                    .thenThrow(new InvalidClusterException("need 2 nodes"))
                    .thenReturn(recovered);
            NetworkClient client = startedClient();

            listener.handleClusterEvent(ClusterEvent.nodesChanged(NODES));
            client.sendMessage(message);

            verify(transportClient).sendMessage(NODE_1, message);
        }

        @Test
        @DisplayName("should use the load balancer of the latest membership")
        void shouldFollowMembershipChanges() {
            LoadBalancer next = mock(LoadBalancer.class);
            when(next.nextNode()).thenReturn(Optional.of(NODE_2));
            NetworkClient client = startedClient();
            when(loadBalancerFactory.newLoadBalancer(any())).thenReturn(next);

            listener.handleClusterEvent(ClusterEvent.nodesChanged(Set.of(NODE_2)));
            client.sendMessage(message);

            verify(loadBalancer, never()).nextNode();
            verify(transportClient).sendMessage(NODE_2, message);
        }
    }

    @Nested
    @DisplayName("broadcastMessage")
    class BroadcastMessage {

        @Test
        @DisplayName("should send once to every member")
        void shouldSendToEveryMember() throws Exception {
            NetworkClient client = startedClient();

            BroadcastHandle handle = client.broadcastMessage(message);

            assertThat(handle.size()).isEqualTo(3);
            assertThat(handle.getMessageId()).isEqualTo(message.messageId());
            for (Node node : NODES) {
                verify(transportClient, times(1)).sendMessage(node, message);
            }
            assertThat(handle.all().get(5, TimeUnit.SECONDS))
                    .extracting(MessageResponse::nodeId)
                    .containsExactlyInAnyOrder(1, 2, 3);
            assertThat(metrics.getRegistry().get("test_messages_sent_total")
                    .tag("mode", "broadcast").counters()).hasSize(3);
        }

        @Test
        @DisplayName("should include members the load balancer skips")
        void shouldIncludeUnavailableMembers() {
            Node down = Node.builder().id(9).url("http://localhost:9009").available(false).build();
            when(clusterView.getNodes()).thenReturn(Set.of(NODE_1, down));
            NetworkClient client = startedClient();

            BroadcastHandle handle = client.broadcastMessage(message);

            assertThat(handle.responseFrom(9)).isPresent();
            verify(transportClient).sendMessage(down, message);
        }

        @Test
        @DisplayName("should return an empty handle for an empty cluster")
        void shouldHandleEmptyCluster() {
            when(clusterView.getNodes()).thenReturn(Set.of());
            NetworkClient client = startedClient();

            BroadcastHandle handle = client.broadcastMessage(message);

            assertThat(handle.size()).isZero();
            assertThat(handle.isDone()).isTrue();
            verify(transportClient, never()).sendMessage(any(), any());
        }
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        @DisplayName("should fail every operation while disconnected")
        void shouldFailWhenDisconnected() {
            when(clusterView.isConnected()).thenReturn(false);
            NetworkClient client = startedClient();

            assertThatThrownBy(() -> client.broadcastMessage(message)).isInstanceOf(ClusterDisconnectedException.class);
            assertThatThrownBy(() -> client.sendMessageToNode(message, NODE_1)).isInstanceOf(ClusterDisconnectedException.class);
            assertThatThrownBy(() -> client.sendMessage(message)).isInstanceOf(ClusterDisconnectedException.class);

            verify(transportClient, never()).sendMessage(any(), any());
            verify(loadBalancer, never()).nextNode();
            assertThat(routingErrors(ErrorType.CLUSTER_DISCONNECTED)).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should fail every operation after shutdown")
        void shouldFailAfterShutdown() {
            NetworkClient client = startedClient();
            factory.shutdown();

            assertThatThrownBy(() -> client.broadcastMessage(message)).isInstanceOf(ClusterShutdownException.class);
            assertThatThrownBy(() -> client.sendMessageToNode(message, NODE_1)).isInstanceOf(ClusterShutdownException.class);
            assertThatThrownBy(() -> client.sendMessage(message)).isInstanceOf(ClusterShutdownException.class);

            verify(transportClient, never()).sendMessage(any(), any());
        }

        @Test
        @DisplayName("should report shutdown before disconnection")
        void shouldPreferShutdownOverDisconnection() {
            NetworkClient client = startedClient();
            when(clusterView.isConnected()).thenReturn(false);
            factory.shutdown();

            assertThatThrownBy(() -> client.sendMessage(message)).isInstanceOf(ClusterShutdownException.class);
        }

        @Test
        @DisplayName("should report shutdown when the cluster view was shut down underneath")
        void shouldHonourClusterViewShutdown() {
            NetworkClient client = startedClient();
            when(clusterView.isShutdown()).thenReturn(true);
            when(clusterView.isConnected()).thenReturn(false);

            assertThatThrownBy(() -> client.sendMessageToNode(message, NODE_1))
                    .isInstanceOf(ClusterShutdownException.class);
        }

        @Test
        @DisplayName("should check preconditions before membership")
        void shouldCheckPreconditionsFirst() {
            when(clusterView.isConnected()).thenReturn(false);
            NetworkClient client = startedClient();

            assertThatThrownBy(() -> client.sendMessageToNode(message, Node.of(4, "http://localhost:9004")))
                    .isInstanceOf(ClusterDisconnectedException.class);
        }
    }
}
