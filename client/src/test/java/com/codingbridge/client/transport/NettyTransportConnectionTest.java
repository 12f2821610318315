package com.codingbridge.client.transport;

import com.codingbridge.protocol.FrameType;
import com.codingbridge.protocol.InboundFrame;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class NettyTransportConnectionTest {

    private final List<InboundFrame> frames = new ArrayList<>();
    private final List<Throwable> failures = new ArrayList<>();

    private final TransportListener listener = new TransportListener() {
        @Override public void onFrame(InboundFrame frame)   { frames.add(frame); }
        @Override public void onFailure(Throwable cause)    { failures.add(cause); }
    };

    private InboundFrameDecoder decoder;
    private NettyTransportConnection conn;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        decoder = new InboundFrameDecoder();
        conn = new NettyTransportConnection(listener);
        ch = new EmbeddedChannel(decoder, new WebSocketClientHandler(conn));
        conn.attach(ch);
    }

    private void handshake() {
        ch.pipeline().fireUserEventTriggered(ClientHandshakeStateEvent.HANDSHAKE_COMPLETE);
    }

    // -----------------------------------------------------------------------
    // Test 1: text and binary frames decode into InboundFrames
    // -----------------------------------------------------------------------
    @Test
    void framesAreDecoded() {
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"claude-complete\",\"sessionId\":\"abc\"}"));
        ch.writeInbound(new BinaryWebSocketFrame(Unpooled.copiedBuffer(
                "{\"type\":\"projects_updated\"}", StandardCharsets.UTF_8)));

        assertEquals(2, frames.size());
        assertEquals(FrameType.CLAUDE_COMPLETE, frames.get(0).type());
        assertEquals("abc", frames.get(0).sessionId());
        assertEquals(FrameType.PROJECTS_UPDATED, frames.get(1).type());
    }

    // -----------------------------------------------------------------------
    // Test 2: malformed frames are dropped without failing the connection
    // -----------------------------------------------------------------------
    @Test
    void malformedFramesAreDropped() {
        ch.writeInbound(new TextWebSocketFrame("not json"));
        ch.writeInbound(new TextWebSocketFrame("{\"data\":{}}"));
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"token-budget\",\"data\":{\"used\":1,\"total\":2}}"));

        assertEquals(2, decoder.droppedCount());
        assertEquals(1, frames.size());
        assertTrue(failures.isEmpty());
        assertTrue(ch.isActive());
    }

    // -----------------------------------------------------------------------
    // Test 3: writes wait for the handshake
    // -----------------------------------------------------------------------
    @Test
    void sendWaitsForHandshake() {
        CompletableFuture<Void> sent = conn.sendText("{\"type\":\"claude-command\"}");
        assertNull(ch.readOutbound());
        assertFalse(sent.isDone());

        handshake();

        TextWebSocketFrame out = ch.readOutbound();
        assertEquals("{\"type\":\"claude-command\"}", out.text());
        out.release();
        assertTrue(sent.isDone());
        assertFalse(sent.isCompletedExceptionally());
    }

    // -----------------------------------------------------------------------
    // Test 4: ping completes on the matching pong
    // -----------------------------------------------------------------------
    @Test
    void pingCompletesOnPong() {
        handshake();
        CompletableFuture<Void> pong = conn.ping();

        PingWebSocketFrame ping = ch.readOutbound();
        assertNotNull(ping);
        ping.release();
        assertFalse(pong.isDone());

        ch.writeInbound(new PongWebSocketFrame());

        assertTrue(pong.isDone());
        assertFalse(pong.isCompletedExceptionally());
    }

    // -----------------------------------------------------------------------
    // Test 5: remote close reported once, later writes fail
    // -----------------------------------------------------------------------
    @Test
    void remoteCloseReportedOnce() {
        handshake();
        CompletableFuture<Void> pong = conn.ping();
        ((PingWebSocketFrame) ch.readOutbound()).release();

        ch.pipeline().fireExceptionCaught(new IOException("connection reset"));

        assertEquals(1, failures.size());
        assertEquals("connection reset", failures.get(0).getMessage());
        assertFalse(ch.isActive());
        assertTrue(pong.isCompletedExceptionally());
        assertTrue(conn.sendText("late").isCompletedExceptionally());
    }

    // -----------------------------------------------------------------------
    // Test 6: local close never calls the listener
    // -----------------------------------------------------------------------
    @Test
    void localCloseIsSilent() {
        conn.close();

        assertFalse(ch.isActive());
        assertTrue(failures.isEmpty());
    }

    // -----------------------------------------------------------------------
    // Test 7: handshake timeout fails the connection
    // -----------------------------------------------------------------------
    @Test
    void handshakeTimeoutFails() {
        CompletableFuture<Void> sent = conn.sendText("queued");

        ch.pipeline().fireUserEventTriggered(ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT);

        assertEquals(1, failures.size());
        assertInstanceOf(WebSocketHandshakeException.class, failures.get(0));
        assertTrue(sent.isCompletedExceptionally());
    }
}
