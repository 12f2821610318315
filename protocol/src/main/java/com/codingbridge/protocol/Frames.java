package com.codingbridge.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Converts between JSON text exchanged with the agent server and typed frames.
 *
 * Server → client: {@link #decode(String)} produces an {@link InboundFrame}
 * Client → server: {@link #command}, {@link #abort}, {@link #approvalResponse}
 *
 * Optional fields are omitted rather than sent as null.
 */
public final class Frames {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Frames() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ── Server → Client ──────────────────────────────────────────────────────

    public static InboundFrame decode(String json) throws ProtocolException {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException("Frame has no type");
        }
        String rawType = typeNode.asText();
        return new InboundFrame(
                FrameType.fromWire(rawType),
                rawType,
                text(node, "sessionId"),
                node.get("data"),
                text(node, "error"),
                text(node, "code"),
                node.hasNonNull("exitCode") && node.get("exitCode").canConvertToInt()
                        ? node.get("exitCode").asInt()
                        : null);
    }

    // ── Client → Server ──────────────────────────────────────────────────────

    /**
     * {@code {type:"claude-command", command, options:{cwd, sessionId?, model?, permissionMode?, images?}}}.
     * The session id must already be validated; an invalid one is dropped here as a last guard.
     */
    public static String command(String command, String cwd, String sessionId, String model,
                                 PermissionMode permissionMode, List<ImagePayload> images) throws ProtocolException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", FrameType.CLAUDE_COMMAND.wire);
        root.put("command", command);

        ObjectNode options = root.putObject("options");
        options.put("cwd", cwd);
        String validated = SessionIds.validate(sessionId);
        if (validated != null) options.put("sessionId", validated);
        if (model != null) options.put("model", model);
        if (permissionMode != null) options.put("permissionMode", permissionMode.wire);
        if (images != null && !images.isEmpty()) {
            ArrayNode arr = options.putArray("images");
            for (ImagePayload img : images) {
                ObjectNode o = arr.addObject();
                o.put("mediaType", img.mediaType());
                o.put("base64Data", img.base64Data());
            }
        }
        return write(root);
    }

    /** {@code {type:"abort-session", sessionId, provider:"claude"}}. */
    public static String abort(String sessionId) throws ProtocolException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", FrameType.ABORT_SESSION.wire);
        root.put("sessionId", sessionId);
        root.put("provider", "claude");
        return write(root);
    }

    /**
     * {@code {type:"permission-response", requestId, allow, decision, alwaysAllow}}.
     * {@code decision} mirrors {@code allow} as "allow"/"deny" for servers that key on it.
     */
    public static String approvalResponse(String requestId, boolean allow, boolean alwaysAllow) throws ProtocolException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", FrameType.PERMISSION_RESPONSE.wire);
        root.put("requestId", requestId);
        root.put("allow", allow);
        root.put("decision", allow ? "allow" : "deny");
        root.put("alwaysAllow", alwaysAllow);
        return write(root);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }

    private static String write(JsonNode node) throws ProtocolException {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to serialize frame", e);
        }
    }
}
