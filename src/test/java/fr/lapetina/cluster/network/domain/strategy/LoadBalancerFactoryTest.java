package fr.lapetina.cluster.network.domain.strategy;

import fr.lapetina.cluster.network.domain.exception.InvalidClusterException;
import fr.lapetina.cluster.network.domain.model.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadBalancerFactoryTest {

    private Set<Node> testNodes;

    @BeforeEach
    void setUp() {
        testNodes = Set.of(
                Node.of(3, "http://localhost:9003"),
                Node.of(1, "http://localhost:9001"),
                Node.builder().id(2).url("http://localhost:9002").available(false).build()
        );
    }

    @Nested
    @DisplayName("RoundRobinLoadBalancerFactory")
    class RoundRobinTests {

        @Test
        @DisplayName("should cycle through available nodes in id order")
        void shouldCycleInIdOrder() {
            LoadBalancer balancer = new RoundRobinLoadBalancerFactory().newLoadBalancer(testNodes);

            int[] selections = new int[6];
            for (int i = 0; i < selections.length; i++) {
                selections[i] = balancer.nextNode().map(Node::getId).orElse(-1);
            }

            // node-2 is unavailable
            assertThat(selections).containsExactly(1, 3, 1, 3, 1, 3);
        }

        @Test
        @DisplayName("should return empty when no node is available")
        void shouldReturnEmptyWithoutAvailableNodes() {
            Set<Node> down = Set.of(Node.builder().id(1).url("http://localhost:9001").available(false).build());

            assertThat(new RoundRobinLoadBalancerFactory().newLoadBalancer(down).nextNode()).isEmpty();
            assertThat(new RoundRobinLoadBalancerFactory().newLoadBalancer(Set.of()).nextNode()).isEmpty();
        }

        @Test
        @DisplayName("should spread concurrent selections evenly")
        void shouldBeThreadSafe() throws InterruptedException {
            LoadBalancer balancer = new RoundRobinLoadBalancerFactory().newLoadBalancer(testNodes);
            Map<Integer, Integer> counts = new ConcurrentHashMap<>();
            ExecutorService executor = Executors.newFixedThreadPool(4);
            CountDownLatch done = new CountDownLatch(400);

            for (int i = 0; i < 400; i++) {
                executor.execute(() -> {
                    balancer.nextNode().ifPresent(node -> counts.merge(node.getId(), 1, Integer::sum));
                    done.countDown();
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(counts).containsOnlyKeys(1, 3);
            assertThat(counts.get(1)).isEqualTo(200);
            assertThat(counts.get(3)).isEqualTo(200);
        }

        @Test
        @DisplayName("should keep selecting from its construction snapshot")
        void shouldBeConfinedToSnapshot() {
            Set<Node> mutable = new HashSet<>(testNodes);
            LoadBalancer balancer = new RoundRobinLoadBalancerFactory().newLoadBalancer(mutable);

            mutable.add(Node.of(9, "http://localhost:9009"));

            for (int i = 0; i < 10; i++) {
                assertThat(balancer.nextNode()).get().extracting(Node::getId).isNotEqualTo(9);
            }
        }
    }

    @Nested
    @DisplayName("RandomLoadBalancerFactory")
    class RandomTests {

        @Test
        @DisplayName("should eventually select every available node")
        void shouldSelectEveryAvailableNode() {
            LoadBalancer balancer = new RandomLoadBalancerFactory().newLoadBalancer(testNodes);
            Set<Integer> selected = new HashSet<>();

            for (int i = 0; i < 200; i++) {
                balancer.nextNode().ifPresent(node -> selected.add(node.getId()));
            }

            assertThat(selected).containsExactlyInAnyOrder(1, 3);
        }

        @Test
        @DisplayName("should return empty for an empty cluster")
        void shouldReturnEmpty() {
            assertThat(new RandomLoadBalancerFactory().newLoadBalancer(Set.of()).nextNode()).isEmpty();
        }
    }

    @Nested
    @DisplayName("minimumAvailableNodes")
    class MinimumAvailableNodesTests {

        @Test
        @DisplayName("should reject a node set with too few available nodes")
        void shouldRejectSmallCluster() {
            LoadBalancerFactory factory = new RoundRobinLoadBalancerFactory(3);

            assertThatThrownBy(() -> factory.newLoadBalancer(testNodes))
                    .isInstanceOf(InvalidClusterException.class)
                    .hasMessageContaining("2 available nodes out of 3")
                    .hasMessageContaining("at least 3");
        }

        @Test
        @DisplayName("should accept a node set meeting the minimum")
        void shouldAcceptSufficientCluster() {
            assertThat(new RandomLoadBalancerFactory(2).newLoadBalancer(testNodes).nextNode()).isPresent();
        }

        @Test
        @DisplayName("should reject a null node set")
        void shouldRejectNull() {
            assertThatThrownBy(() -> new RoundRobinLoadBalancerFactory().newLoadBalancer(null))
                    .isInstanceOf(InvalidClusterException.class);
        }

        @Test
        @DisplayName("should refuse a negative minimum")
        void shouldRefuseNegativeMinimum() {
            assertThatThrownBy(() -> new RoundRobinLoadBalancerFactory(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("LoadBalancerFactories")
    class RegistryTests {

        @Test
        @DisplayName("should create built-in policies by name")
        void shouldCreateBuiltIns() {
            assertThat(LoadBalancerFactories.create("round-robin", 0)).get()
                    .isInstanceOf(RoundRobinLoadBalancerFactory.class);
            assertThat(LoadBalancerFactories.create("RANDOM", 2)).get()
                    .isInstanceOfSatisfying(RandomLoadBalancerFactory.class,
                            factory -> assertThat(factory.getMinimumAvailableNodes()).isEqualTo(2));
        }

        @Test
        @DisplayName("should return empty for unknown or missing names")
        void shouldReturnEmptyForUnknown() {
            assertThat(LoadBalancerFactories.create("least-loaded", 0)).isEmpty();
            assertThat(LoadBalancerFactories.create(null, 0)).isEmpty();
        }

        @Test
        @DisplayName("should accept custom policies")
        void shouldRegisterCustomPolicy() {
            LoadBalancerFactories.register("first-node", minimum -> nodes -> {
                List<Node> sorted = nodes.stream().sorted((a, b) -> Integer.compare(a.getId(), b.getId())).toList();
                return () -> sorted.stream().findFirst();
            });

            LoadBalancer balancer = LoadBalancerFactories.create("first-node", 0).orElseThrow().newLoadBalancer(testNodes);

            assertThat(balancer.nextNode()).get().extracting(Node::getId).isEqualTo(1);
            assertThat(LoadBalancerFactories.getRegisteredNames()).contains("round-robin", "random", "first-node");
        }
    }
}
