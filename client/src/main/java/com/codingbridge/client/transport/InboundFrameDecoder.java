package com.codingbridge.client.transport;

import com.codingbridge.protocol.Frames;
import com.codingbridge.protocol.InboundFrame;
import com.codingbridge.protocol.ProtocolException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes text (and UTF-8 binary) WebSocket frames into {@link InboundFrame}s on the I/O thread.
 *
 * Malformed frames are logged and dropped; control frames pass through untouched.
 */
public final class InboundFrameDecoder extends MessageToMessageDecoder<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(InboundFrameDecoder.class);
    private static final int LOG_PREVIEW = 120;

    private long dropped;

    @Override
    public boolean acceptInboundMessage(Object msg) {
        return msg instanceof TextWebSocketFrame || msg instanceof BinaryWebSocketFrame;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, WebSocketFrame frame, List<Object> out) {
        String text = frame.content().toString(StandardCharsets.UTF_8);
        try {
            InboundFrame decoded = Frames.decode(text);
            if (log.isDebugEnabled()) log.debug("<< {}", decoded.rawType());
            out.add(decoded);
        } catch (ProtocolException e) {
            dropped++;
            log.warn("Dropping malformed frame ({}): {}", e.getMessage(), preview(text));
        }
    }

    public long droppedCount() {
        return dropped;
    }

    private static String preview(String text) {
        return text.length() > LOG_PREVIEW ? text.substring(0, LOG_PREVIEW) + "..." : text;
    }
}
