package com.codingbridge.client.transport;

import com.codingbridge.protocol.InboundFrame;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

import java.nio.channels.ClosedChannelException;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TransportConnection} over one Netty channel.
 *
 * Writes are chained on the handshake future, so frames sent while the
 * upgrade is in progress go out once it completes. Pings are matched to
 * pongs in FIFO order.
 */
public final class NettyTransportConnection implements TransportConnection {

    private final TransportListener listener;
    private final CompletableFuture<Void> handshake = new CompletableFuture<>();
    private final Queue<CompletableFuture<Void>> pendingPongs = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile boolean closedByUser;
    private volatile Channel channel;

    public NettyTransportConnection(TransportListener listener) {
        this.listener = listener;
    }

    void attach(Channel channel) {
        this.channel = channel;
    }

    // ── TransportConnection ───────────────────────────────────────────────────

    @Override
    public CompletableFuture<Void> sendText(String text) {
        return handshake.thenCompose(v -> write(new TextWebSocketFrame(text)));
    }

    @Override
    public CompletableFuture<Void> ping() {
        CompletableFuture<Void> pong = new CompletableFuture<>();
        handshake.thenCompose(v -> {
            pendingPongs.add(pong);
            return write(new PingWebSocketFrame());
        }).whenComplete((v, err) -> {
            if (err != null) pong.completeExceptionally(err);
        });
        return pong;
    }

    @Override
    public void close() {
        closedByUser = true;
        Channel ch = channel;
        if (ch != null) {
            if (ch.isActive() && handshake.isDone() && !handshake.isCompletedExceptionally()) {
                ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
            } else {
                ch.close();
            }
        }
        fail(new ClosedChannelException());
    }

    // ── Pipeline callbacks (I/O thread) ───────────────────────────────────────

    void handshakeComplete() {
        handshake.complete(null);
    }

    void frameReceived(InboundFrame frame) {
        if (!finished.get()) listener.onFrame(frame);
    }

    void pongReceived() {
        CompletableFuture<Void> pong = pendingPongs.poll();
        if (pong != null) pong.complete(null);
    }

    /** First failure wins; later ones (e.g. channelInactive after exceptionCaught) are ignored. */
    void fail(Throwable cause) {
        if (!finished.compareAndSet(false, true)) return;
        handshake.completeExceptionally(cause);
        CompletableFuture<Void> pong;
        while ((pong = pendingPongs.poll()) != null) pong.completeExceptionally(cause);
        if (!closedByUser) listener.onFailure(cause);
    }

    private CompletableFuture<Void> write(WebSocketFrame frame) {
        Channel ch = channel;
        if (ch == null || !ch.isActive() || finished.get()) {
            frame.release();
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        CompletableFuture<Void> written = new CompletableFuture<>();
        ch.writeAndFlush(frame).addListener(f -> {
            if (f.isSuccess()) written.complete(null);
            else written.completeExceptionally(f.cause());
        });
        return written;
    }
}
