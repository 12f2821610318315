package com.codingbridge.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Wire frame type names carried in the {@code type} field of every JSON frame.
 *
 * Inbound (server -> client): session lifecycle, streamed agent output, side channels.
 * Outbound (client -> server): commands, aborts, approval answers.
 */
public enum FrameType {
    // Inbound
    SESSION_CREATED     ("session-created"),
    CLAUDE_RESPONSE     ("claude-response"),
    TOKEN_BUDGET        ("token-budget"),
    CLAUDE_COMPLETE     ("claude-complete"),
    CLAUDE_ERROR        ("claude-error"),
    SESSION_ABORTED     ("session-aborted"),
    PERMISSION_REQUEST  ("permission-request"),
    SESSIONS_UPDATED    ("sessions-updated"),
    PROJECTS_UPDATED    ("projects_updated"),

    // Outbound
    CLAUDE_COMMAND      ("claude-command"),
    ABORT_SESSION       ("abort-session"),
    PERMISSION_RESPONSE ("permission-response"),

    UNKNOWN             ("");

    public final String wire;

    FrameType(String wire) { this.wire = wire; }

    private static final Map<String, FrameType> BY_WIRE = new HashMap<>();
    static {
        for (FrameType t : values()) {
            if (t != UNKNOWN) BY_WIRE.put(t.wire, t);
        }
    }

    /** Unknown names map to {@link #UNKNOWN} so newer servers do not break older clients. */
    public static FrameType fromWire(String wire) {
        if (wire == null) return UNKNOWN;
        FrameType t = BY_WIRE.get(wire);
        return t != null ? t : UNKNOWN;
    }
}
