package fr.lapetina.cluster.network.infrastructure.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.cluster.network.domain.model.Message;
import fr.lapetina.cluster.network.domain.model.MessageResponse;
import fr.lapetina.cluster.network.domain.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * HTTP transport delivering messages to cluster nodes.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Each message is
 * POSTed as JSON to {@code <node url><messagePath>}; any 2xx status is an
 * acknowledgement. Includes a circuit breaker per node.
 */
public class HttpTransportClient implements TransportClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTransportClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<Integer, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private final Duration requestTimeout;
    private final String messagePath;
    private final int failureThreshold;
    private final Duration circuitBreakerRecoveryTimeout;

    private volatile boolean shutdown;

    public HttpTransportClient(
            Duration connectTimeout,
            Duration requestTimeout,
            String messagePath,
            int failureThreshold,
            Duration circuitBreakerRecoveryTimeout
    ) {
        this.requestTimeout = requestTimeout;
        this.messagePath = normalizePath(messagePath);
        this.failureThreshold = failureThreshold;
        this.circuitBreakerRecoveryTimeout = circuitBreakerRecoveryTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public HttpTransportClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(30), "/messages", 5, Duration.ofSeconds(30));
    }

    @Override
    public CompletableFuture<MessageResponse> sendMessage(Node node, Message message) {
        if (shutdown) {
            return CompletableFuture.failedFuture(
                    new TransportException(TransportException.Reason.SHUT_DOWN, node.getId(), null));
        }

        CircuitBreaker breaker = getOrCreateCircuitBreaker(node.getId());
        if (!breaker.allowRequest()) {
            log.warn("Message blocked by circuit breaker: nodeId={}, messageId={}",
                    node.getId(), message.messageId());
            return CompletableFuture.failedFuture(
                    new TransportException(TransportException.Reason.CIRCUIT_OPEN, node.getId(), null));
        }

        MDC.put("messageId", message.messageId());
        MDC.put("nodeId", String.valueOf(node.getId()));
        try {
            HttpRequest httpRequest = buildHttpRequest(node, message);
            Instant startTime = Instant.now();

            log.debug("Sending message: nodeId={}, messageId={}, type={}, endpoint={}",
                    node.getId(), message.messageId(), message.type(), httpRequest.uri());

            return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                    .handle((response, ex) -> ex != null
                            ? handleException(node, message, ex, breaker)
                            : handleResponse(node, message, response, startTime, breaker))
                    .thenCompose(Function.identity());

        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build message request: nodeId={}, messageId={}", node.getId(), message.messageId(), e);
            return CompletableFuture.failedFuture(new TransportException(
                    TransportException.Reason.IO_ERROR, node.getId(), -1, "Failed to build request", e));
        } finally {
            MDC.remove("messageId");
            MDC.remove("nodeId");
        }
    }

    private HttpRequest buildHttpRequest(Node node, Message message) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(buildUri(node))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Message-ID", message.messageId())
                .header("X-Message-Type", message.type())
                .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(message)))
                .build();
    }

    private URI buildUri(Node node) {
        String base = node.getUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + messagePath);
    }

    private CompletableFuture<MessageResponse> handleResponse(
            Node node,
            Message message,
            HttpResponse<byte[]> response,
            Instant startTime,
            CircuitBreaker breaker
    ) {
        Duration latency = Duration.between(startTime, Instant.now());
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            breaker.recordSuccess();
            log.debug("Message delivered: nodeId={}, messageId={}, status={}, latencyMs={}",
                    node.getId(), message.messageId(), statusCode, latency.toMillis());
            return CompletableFuture.completedFuture(new MessageResponse(
                    message.messageId(), node.getId(), statusCode, response.body(), latency));
        }

        // Client errors are the sender's fault, not the node's
        if (statusCode >= 500) {
            breaker.recordFailure();
        }
        log.warn("Message rejected by node: nodeId={}, messageId={}, status={}, latencyMs={}",
                node.getId(), message.messageId(), statusCode, latency.toMillis());
        return CompletableFuture.failedFuture(new TransportException(
                TransportException.Reason.HTTP_ERROR, node.getId(), statusCode, "HTTP " + statusCode, null));
    }

    private CompletableFuture<MessageResponse> handleException(
            Node node,
            Message message,
            Throwable ex,
            CircuitBreaker breaker
    ) {
        breaker.recordFailure();

        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        TransportException.Reason reason;
        if (cause instanceof HttpTimeoutException) {
            reason = TransportException.Reason.TIMEOUT;
        } else if (cause instanceof IOException) {
            reason = TransportException.Reason.IO_ERROR;
        } else {
            reason = TransportException.Reason.IO_ERROR;
            log.error("Unexpected transport failure: nodeId={}, messageId={}", node.getId(), message.messageId(), cause);
        }

        log.warn("Message delivery failed: nodeId={}, messageId={}, reason={}, error={}",
                node.getId(), message.messageId(), reason, cause.getMessage());

        return CompletableFuture.failedFuture(new TransportException(
                reason, node.getId(), -1, cause.getMessage(), cause));
    }

    private CircuitBreaker getOrCreateCircuitBreaker(int nodeId) {
        return circuitBreakers.computeIfAbsent(nodeId, id ->
                new CircuitBreaker(id, failureThreshold, circuitBreakerRecoveryTimeout, 2)
        );
    }

    /**
     * Gets the circuit breaker for a node, or null if nothing was sent to it yet.
     */
    public CircuitBreaker getCircuitBreaker(int nodeId) {
        return circuitBreakers.get(nodeId);
    }

    /**
     * Closes the circuit breaker of a node.
     */
    public void resetCircuitBreaker(int nodeId) {
        CircuitBreaker breaker = circuitBreakers.get(nodeId);
        if (breaker != null) {
            breaker.reset();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void shutdown() {
        if (!shutdown) {
            shutdown = true;
            circuitBreakers.clear();
            log.info("HTTP transport shut down");
        }
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
