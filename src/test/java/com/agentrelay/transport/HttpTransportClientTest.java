package com.agentrelay.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.agentrelay.transport.CommunicationException.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a mock agent served by the JDK {@link HttpServer}.
 */
class HttpTransportClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(40), 0);

    interface Responder {
        void respond(HttpExchange exchange, long id, String task) throws IOException;
    }

    private HttpServer server;
    private ExecutorService serverExecutor;
    private URI endpoint;
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> lastCorrelationId = new AtomicReference<>();
    private final CountDownLatch release = new CountDownLatch(1);
    private volatile Responder responder;
    private HttpTransportClient client;

    @BeforeEach
    void startAgent() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/rpc", exchange -> {
            requests.incrementAndGet();
            lastCorrelationId.set(exchange.getRequestHeaders().getFirst("X-Correlation-Id"));
            var body = MAPPER.readTree(exchange.getRequestBody());
            responder.respond(exchange, body.get("id").asLong(), body.at("/params/task_text").asText());
        });
        server.createContext("/rpc/health", exchange -> send(exchange, 200, "{\"status\":\"ok\"}"));
        server.start();
        endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/rpc");
    }

    @AfterEach
    void stopAgent() {
        release.countDown();
        if (client != null) client.close();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private static void send(HttpExchange exchange, int status, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String ok(long id, String text) {
        return "{\"jsonrpc\":\"2.0\",\"result\":{\"text\":\"" + text + "\"},\"id\":" + id + "}";
    }

    private HttpTransportClient client(RetryPolicy policy, Duration grace) {
        client = new HttpTransportClient(endpoint, policy, Duration.ofSeconds(2), grace);
        return client;
    }

    private static CommunicationException failure(CompletableFuture<String> f) {
        var ex = assertThrows(ExecutionException.class, () -> f.get(10, TimeUnit.SECONDS));
        return assertInstanceOf(CommunicationException.class, ex.getCause());
    }

    @Test
    void delegatesTaskAndReturnsResultText() throws Exception {
        responder = (ex, id, task) -> send(ex, 200, ok(id, "done: " + task));

        var text = client(RetryPolicy.none(), Duration.ofSeconds(1))
                .delegate("refund order 42", "cid-1", Duration.ofSeconds(5))
                .get(5, TimeUnit.SECONDS);

        assertEquals("done: refund order 42", text);
        assertEquals("cid-1", lastCorrelationId.get());
    }

    @Test
    void retriesTransientStatusThenSucceeds() throws Exception {
        responder = (ex, id, task) -> {
            if (requests.get() < 3) send(ex, 503, "busy");
            else send(ex, 200, ok(id, "finally"));
        };

        var text = client(FAST_RETRY, Duration.ofSeconds(1))
                .delegate("t", "cid", Duration.ofSeconds(5))
                .get(5, TimeUnit.SECONDS);

        assertEquals("finally", text);
        assertEquals(3, requests.get());
    }

    @Test
    void givesUpAfterMaxRetries() {
        responder = (ex, id, task) -> send(ex, 502, "bad gateway");
        var policy = new RetryPolicy(2, Duration.ofMillis(5), Duration.ofMillis(10), 0);

        var error = failure(client(policy, Duration.ofSeconds(1)).delegate("t", "cid", Duration.ofSeconds(5)));

        assertEquals(PROTOCOL_ERROR, error.kind());
        assertEquals(3, requests.get());
    }

    @Test
    void remoteErrorIsSurfacedWithoutRetry() {
        responder = (ex, id, task) -> send(ex, 200,
                "{\"error\":{\"code\":-32001,\"message\":\"order not found\"},\"id\":" + id + "}");

        var error = failure(client(FAST_RETRY, Duration.ofSeconds(1)).delegate("t", "cid", Duration.ofSeconds(5)));

        assertEquals(REMOTE_ERROR, error.kind());
        assertEquals(1, requests.get());
    }

    @Test
    void slowAgentTimesOut() {
        responder = (ex, id, task) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            send(ex, 200, ok(id, "late"));
        };

        var error = failure(client(RetryPolicy.none(), Duration.ofSeconds(1))
                .delegate("t", "cid", Duration.ofMillis(200)));

        assertEquals(TIMEOUT, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void refusedConnectIsRetryableConnectionRefused() {
        var error = HttpTransportClient.classify(new CompletionException(new ConnectException("Connection refused")));

        assertEquals(CONNECTION_REFUSED, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void connectTimeoutIsTimeout() {
        var error = HttpTransportClient.classify(new HttpConnectTimeoutException("HTTP connect timed out"));

        assertEquals(TIMEOUT, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void otherFailuresAreProtocolErrors() {
        var error = HttpTransportClient.classify(new IllegalStateException("bad state"));

        assertEquals(PROTOCOL_ERROR, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void healthCheckHitsHealthEndpoint() {
        assertTrue(client(RetryPolicy.none(), Duration.ofSeconds(1)).healthCheck().join());
    }

    @Test
    void closedClientIsUnhealthy() {
        var c = client(RetryPolicy.none(), Duration.ofSeconds(1));
        c.close();

        assertFalse(c.healthCheck().join());
    }

    @Test
    void closeFailsCallsStillInFlightAfterGrace() throws Exception {
        var received = new CountDownLatch(1);
        responder = (ex, id, task) -> {
            received.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            send(ex, 200, ok(id, "too late"));
        };
        var c = client(RetryPolicy.none(), Duration.ofMillis(100));
        var pending = c.delegate("t", "cid", Duration.ofSeconds(30));
        assertTrue(received.await(5, TimeUnit.SECONDS));

        c.close();

        var error = failure(pending);
        assertEquals(CONNECTION_REFUSED, error.kind());
        assertTrue(error.getMessage().contains("closed"));
        assertTrue(c.isClosed());

        var afterClose = failure(c.delegate("t2", "cid", Duration.ofSeconds(1)));
        assertEquals(CONNECTION_REFUSED, afterClose.kind());
    }
}
