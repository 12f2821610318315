package com.codingbridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * One decoded server frame: {@code {type, sessionId?, data?, error?, code?, exitCode?}}.
 *
 * {@code data} is never null; absent payloads are a {@link MissingNode} so callers
 * can navigate with {@code path()} without null checks.
 */
public record InboundFrame(FrameType type,
                           String rawType,
                           String sessionId,
                           JsonNode data,
                           String error,
                           String code,
                           Integer exitCode) {

    public InboundFrame {
        if (data == null) data = MissingNode.getInstance();
    }

    public static InboundFrame of(FrameType type, String sessionId, JsonNode data) {
        return new InboundFrame(type, type.wire, sessionId, data, null, null, null);
    }

    public static InboundFrame error(String error, String code) {
        return new InboundFrame(FrameType.CLAUDE_ERROR, FrameType.CLAUDE_ERROR.wire, null, null, error, code, null);
    }
}
