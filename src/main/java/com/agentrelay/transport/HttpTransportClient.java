package com.agentrelay.transport;

import com.agentrelay.shared.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.agentrelay.transport.CommunicationException.Kind.CONNECTION_REFUSED;
import static com.agentrelay.transport.CommunicationException.Kind.PROTOCOL_ERROR;
import static com.agentrelay.transport.CommunicationException.Kind.TIMEOUT;

/**
 * Delegates tasks to one remote agent over HTTP. The underlying {@link HttpClient}
 * keeps its connections alive between calls, so one instance per endpoint is the
 * connection pool for that agent.
 */
public class HttpTransportClient implements TransportClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTransportClient.class);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    private final URI endpoint;
    private final RetryPolicy retryPolicy;
    private final Duration shutdownGrace;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final AtomicLong idSeq = new AtomicLong(1);
    private final Set<CompletableFuture<String>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public HttpTransportClient(URI endpoint, TransportConfig config) {
        this(endpoint, RetryPolicy.from(config), config.connectTimeout(), config.shutdownGrace());
    }

    public HttpTransportClient(URI endpoint, RetryPolicy retryPolicy, Duration connectTimeout, Duration shutdownGrace) {
        this.endpoint = endpoint;
        this.retryPolicy = retryPolicy;
        this.shutdownGrace = shutdownGrace;
        var threadSeq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "relay-http-" + endpoint.getHost() + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .executor(executor)
                .build();
    }

    @Override
    public URI endpoint() {
        return endpoint;
    }

    @Override
    public CompletableFuture<String> delegate(String taskText, String correlationId, Duration timeout) {
        if (closed) {
            return CompletableFuture.failedFuture(closedError());
        }
        long id = idSeq.getAndIncrement();
        var request = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "application/json")
                .header("X-Correlation-Id", correlationId)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(RpcCodec.encode(taskText, correlationId, id)))
                .build();

        var result = new CompletableFuture<String>();
        inFlight.add(result);
        result.whenComplete((r, e) -> inFlight.remove(result));
        attempt(request, id, 0, result);
        return result;
    }

    private void attempt(HttpRequest request, long id, int attempt, CompletableFuture<String> result) {
        if (result.isDone()) return;
        if (closed) {
            result.completeExceptionally(closedError());
            return;
        }
        CompletableFuture<HttpResponse<String>> send;
        try {
            send = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            result.completeExceptionally(new CommunicationException(CONNECTION_REFUSED, e.toString(), false, e));
            return;
        }
        send.whenComplete((resp, err) -> {
            try {
                if (err != null) throw classify(err);
                result.complete(RpcCodec.decode(resp.statusCode(), resp.body(), id));
            } catch (CommunicationException e) {
                if (retryPolicy.shouldRetry(e, attempt) && !closed) {
                    long backoff = retryPolicy.backoffMillis(attempt);
                    log.debug("Delegation to {} failed ({}), retry {}/{} in {}ms",
                            endpoint, e.getMessage(), attempt + 1, retryPolicy.maxRetries(), backoff);
                    CompletableFuture.delayedExecutor(backoff, TimeUnit.MILLISECONDS)
                            .execute(() -> attempt(request, id, attempt + 1, result));
                } else {
                    result.completeExceptionally(e);
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(new CommunicationException(PROTOCOL_ERROR, e.toString(), false, e));
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        if (closed) return CompletableFuture.completedFuture(false);
        var base = endpoint.toString().replaceAll("/+$", "");
        var request = HttpRequest.newBuilder()
                .uri(URI.create(base + "/health"))
                .timeout(HEALTH_TIMEOUT)
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(resp -> resp.statusCode() == 200)
                .exceptionally(e -> {
                    log.debug("Health check for {} failed: {}", endpoint, e.getMessage());
                    return false;
                });
    }

    /**
     * Waits up to the shutdown grace for in-flight calls, then fails the rest.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        var pending = inFlight.toArray(new CompletableFuture<?>[0]);
        if (pending.length > 0) {
            try {
                CompletableFuture.allOf(pending).get(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Transport {} closing with {} calls still in flight", endpoint, inFlight.size());
            } catch (ExecutionException e) {
                log.debug("In-flight call to {} failed during shutdown: {}", endpoint, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (var f : inFlight) f.completeExceptionally(closedError());
        executor.shutdownNow();
        log.info("Transport to {} closed", endpoint);
    }

    boolean isClosed() {
        return closed;
    }

    private CommunicationException closedError() {
        return new CommunicationException(CONNECTION_REFUSED, "transport to " + endpoint + " closed", false, null);
    }

    static CommunicationException classify(Throwable err) {
        var cause = err;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof CommunicationException ce) return ce;
        if (cause instanceof HttpTimeoutException) {
            return new CommunicationException(TIMEOUT, cause.getMessage(), true, cause);
        }
        if (cause instanceof ConnectException) {
            return new CommunicationException(CONNECTION_REFUSED, String.valueOf(cause.getMessage()), true, cause);
        }
        if (cause instanceof IOException) {
            return new CommunicationException(CONNECTION_REFUSED, "connection error: " + cause.getMessage(), true, cause);
        }
        return new CommunicationException(PROTOCOL_ERROR, cause.toString(), false, cause);
    }
}
