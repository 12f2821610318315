package com.codingbridge.client.transport;

import com.codingbridge.common.BridgeConfig;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket client transport on Netty NIO.
 *
 * Pipeline per connection:
 *   [SslHandler]                      (wss only)
 *   → HttpClientCodec
 *   → HttpObjectAggregator           (upgrade response)
 *   → WebSocketClientCompressionHandler
 *   → WebSocketClientProtocolHandler (handshake, close, pongs passed up)
 *   → WebSocketFrameAggregator       (continuation frames)
 *   → InboundFrameDecoder            (JSON → InboundFrame, off the session thread)
 *   → WebSocketClientHandler         (hand-off to the connection)
 */
public final class NettyWebSocketTransport implements AgentTransport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);
    private static final int HTTP_AGGREGATE_BYTES = 64 * 1024;

    private final NioEventLoopGroup ioGroup;
    private final int               connectTimeoutMillis;
    private final int               maxFrameBytes;

    public NettyWebSocketTransport(BridgeConfig cfg) {
        this(cfg.ioThreads, cfg.connectTimeoutMillis, cfg.maxFrameBytes);
    }

    public NettyWebSocketTransport(int ioThreads, int connectTimeoutMillis, int maxFrameBytes) {
        this.ioGroup              = new NioEventLoopGroup(ioThreads, new DefaultThreadFactory("ws-io", true));
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.maxFrameBytes        = maxFrameBytes;
    }

    @Override
    public TransportConnection open(URI endpoint, TransportListener listener) {
        NettyTransportConnection connection = new NettyTransportConnection(listener);

        boolean secure = "wss".equalsIgnoreCase(endpoint.getScheme());
        String  host   = endpoint.getHost();
        int     port   = endpoint.getPort() != -1 ? endpoint.getPort() : (secure ? 443 : 80);

        SslContext ssl;
        try {
            ssl = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            log.error("Cannot build TLS context for {}: {}", host, e.getMessage());
            connection.fail(e);
            return connection;
        }

        WebSocketClientProtocolConfig wsConfig = WebSocketClientProtocolConfig.newBuilder()
                .webSocketUri(endpoint)
                .version(WebSocketVersion.V13)
                .allowExtensions(true)
                .maxFramePayloadLength(maxFrameBytes)
                .handshakeTimeoutMillis(connectTimeoutMillis)
                .dropPongFrames(false)
                .build();

        Bootstrap b = new Bootstrap()
                .group(ioGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        p.addLast(new HttpClientCodec())
                         .addLast(new HttpObjectAggregator(HTTP_AGGREGATE_BYTES))
                         .addLast(WebSocketClientCompressionHandler.INSTANCE)
                         .addLast(new WebSocketClientProtocolHandler(wsConfig))
                         .addLast(new WebSocketFrameAggregator(maxFrameBytes))
                         .addLast(new InboundFrameDecoder())
                         .addLast(new WebSocketClientHandler(connection));
                    }
                });

        log.debug("Opening {}:{} (tls={})", host, port, secure);
        ChannelFuture future = b.connect(host, port);
        connection.attach(future.channel());
        future.addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Connect to {}:{} failed: {}", host, port, f.cause().getMessage());
                connection.fail(f.cause());
            }
        });
        return connection;
    }

    @Override
    public void close() {
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
