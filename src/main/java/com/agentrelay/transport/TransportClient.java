package com.agentrelay.transport;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public interface TransportClient extends Closeable {

    URI endpoint();

    /**
     * Sends {@code taskText} to the remote agent. The future fails with
     * {@link CommunicationException} once retries are exhausted or the agent
     * reports an error.
     */
    CompletableFuture<String> delegate(String taskText, String correlationId, Duration timeout);

    CompletableFuture<Boolean> healthCheck();

    @Override
    void close();
}
