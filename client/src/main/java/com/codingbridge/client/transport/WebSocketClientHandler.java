package com.codingbridge.client.transport;

import com.codingbridge.protocol.InboundFrame;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;

/**
 * Last handler in the client pipeline: forwards decoded frames, pongs,
 * handshake progress and channel failure to its {@link NettyTransportConnection}.
 * One instance per channel.
 */
public final class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final NettyTransportConnection connection;

    public WebSocketClientHandler(NettyTransportConnection connection) {
        this.connection = connection;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof InboundFrame frame) {
            connection.frameReceived(frame);
        } else if (msg instanceof PongWebSocketFrame) {
            connection.pongReceived();
        } else {
            log.debug("Ignoring inbound {}", msg.getClass().getSimpleName());
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            log.info("WebSocket handshake complete on {}", ctx.channel().remoteAddress());
            connection.handshakeComplete();
        } else if (evt == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            connection.fail(new WebSocketHandshakeException("WebSocket handshake timed out"));
            ctx.close();
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        connection.fail(new ClosedChannelException());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Transport error on {}: {}", ctx.channel().remoteAddress(), cause.toString());
        connection.fail(cause);
        ctx.close();
    }
}
