package com.codingbridge.client;

import com.codingbridge.client.transport.AgentTransport;
import com.codingbridge.client.transport.TransportConnection;
import com.codingbridge.client.transport.TransportListener;
import com.codingbridge.protocol.Frames;
import com.codingbridge.protocol.ProtocolException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Scriptable transport: tests drive pongs, frames, failures and write outcomes by hand. */
final class FakeTransport implements AgentTransport {

    final List<FakeConnection> opened = new ArrayList<>();

    @Override
    public TransportConnection open(URI endpoint, TransportListener listener) {
        FakeConnection c = new FakeConnection(endpoint, listener);
        opened.add(c);
        return c;
    }

    FakeConnection last() {
        return opened.get(opened.size() - 1);
    }

    static final class FakeConnection implements TransportConnection {
        final URI endpoint;
        final TransportListener listener;
        final List<String> sent = new ArrayList<>();
        final List<CompletableFuture<Void>> pendingWrites = new ArrayList<>();
        CompletableFuture<Void> pong;
        boolean closed;

        /** When false, writes stay pending until completed via {@link #completeWrite}. */
        boolean autoAck = true;
        /** When non-null, writes fail immediately with this cause. */
        Throwable failWrites;

        FakeConnection(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            sent.add(text);
            if (failWrites != null) return CompletableFuture.failedFuture(failWrites);
            if (autoAck) return CompletableFuture.completedFuture(null);
            CompletableFuture<Void> f = new CompletableFuture<>();
            pendingWrites.add(f);
            return f;
        }

        @Override
        public CompletableFuture<Void> ping() {
            pong = new CompletableFuture<>();
            return pong;
        }

        @Override
        public void close() {
            closed = true;
        }

        void pong() {
            pong.complete(null);
        }

        void deliver(String json) {
            try {
                listener.onFrame(Frames.decode(json));
            } catch (ProtocolException e) {
                throw new IllegalArgumentException(e);
            }
        }

        void fail(Throwable cause) {
            listener.onFailure(cause);
        }

        void completeWrite(int index, Throwable failure) {
            if (failure == null) pendingWrites.get(index).complete(null);
            else pendingWrites.get(index).completeExceptionally(failure);
        }

        String lastSent() {
            return sent.get(sent.size() - 1);
        }
    }
}
