package fr.lapetina.cluster.network.client;

import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;
import fr.lapetina.cluster.network.infrastructure.transport.TransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BroadcastHandleTest {

    private static final Node NODE_1 = Node.of(1, "http://localhost:9001");
    private static final Node NODE_2 = Node.of(2, "http://localhost:9002");

    @Test
    @DisplayName("should complete all() with every acknowledgement")
    void shouldCollectAllResponses() {
        Map<Node, CompletableFuture<MessageResponse>> responses = new LinkedHashMap<>();
        responses.put(NODE_1, CompletableFuture.completedFuture(MessageResponse.of("m-1", 1, 200)));
        responses.put(NODE_2, CompletableFuture.completedFuture(MessageResponse.of("m-1", 2, 202)));

        BroadcastHandle handle = new BroadcastHandle("m-1", responses);

        List<MessageResponse> all = handle.all().join();
        assertThat(all).extracting(MessageResponse::nodeId).containsExactly(1, 2);
        assertThat(handle.isDone()).isTrue();
    }

    @Test
    @DisplayName("should wait for pending sends")
    void shouldWaitForPendingSends() {
        CompletableFuture<MessageResponse> pending = new CompletableFuture<>();
        Map<Node, CompletableFuture<MessageResponse>> responses = new LinkedHashMap<>();
        responses.put(NODE_1, CompletableFuture.completedFuture(MessageResponse.of("m-1", 1, 200)));
        responses.put(NODE_2, pending);

        BroadcastHandle handle = new BroadcastHandle("m-1", responses);
        CompletableFuture<List<MessageResponse>> all = handle.all();

        assertThat(handle.isDone()).isFalse();
        assertThat(all).isNotDone();

        pending.complete(MessageResponse.of("m-1", 2, 200));

        assertThat(all).isCompleted();
        assertThat(handle.isDone()).isTrue();
    }

    @Test
    @DisplayName("should fail all() without masking the per-node outcomes")
    void shouldExposeIndividualFailures() {
        TransportException failure = new TransportException(TransportException.Reason.TIMEOUT, 2, null);
        Map<Node, CompletableFuture<MessageResponse>> responses = new LinkedHashMap<>();
        responses.put(NODE_1, CompletableFuture.completedFuture(MessageResponse.of("m-1", 1, 200)));
        responses.put(NODE_2, CompletableFuture.failedFuture(failure));

        BroadcastHandle handle = new BroadcastHandle("m-1", responses);

        assertThatThrownBy(() -> handle.all().join())
                .isInstanceOf(CompletionException.class)
                .hasCause(failure);
        assertThat(handle.responseFrom(1).orElseThrow()).isCompletedWithValueMatching(MessageResponse::isSuccess);
        assertThat(handle.responseFrom(2).orElseThrow()).isCompletedExceptionally();
        assertThat(handle.responseFrom(3)).isEmpty();
    }

    @Test
    @DisplayName("should not be affected by later changes to the source map")
    void shouldCopyResponses() {
        Map<Node, CompletableFuture<MessageResponse>> responses = new LinkedHashMap<>();
        responses.put(NODE_1, CompletableFuture.completedFuture(MessageResponse.of("m-1", 1, 200)));

        BroadcastHandle handle = new BroadcastHandle("m-1", responses);
        responses.put(NODE_2, new CompletableFuture<>());

        assertThat(handle.size()).isEqualTo(1);
        assertThatThrownBy(() -> handle.getResponses().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
