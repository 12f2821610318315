package com.codingbridge.client.transport;

import java.util.concurrent.CompletableFuture;

/** One live (or in-progress) connection. Writes issued before the handshake completes wait for it. */
public interface TransportConnection {

    /** Completes when the frame has been written, exceptionally when it could not be. */
    CompletableFuture<Void> sendText(String text);

    /** Sends a liveness probe; completes when the matching pong arrives. */
    CompletableFuture<Void> ping();

    /** Closes the connection without notifying the listener. Idempotent. */
    void close();
}
