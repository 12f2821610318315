package com.codingbridge.protocol;

import java.util.regex.Pattern;

/**
 * Session identifier validation.
 *
 * Only canonical 8-4-4-4-12 hex UUIDs go on the wire. Anything else, including
 * locally generated placeholders used before the server has minted a session,
 * is treated as absent.
 */
public final class SessionIds {

    private static final Pattern UUID_SHAPE = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private SessionIds() {}

    /** @return the identifier unchanged if well formed, otherwise null */
    public static String validate(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return null;
        return UUID_SHAPE.matcher(sessionId).matches() ? sessionId : null;
    }

    public static boolean isValid(String sessionId) {
        return validate(sessionId) != null;
    }

    /** Short form for log lines. */
    public static String abbreviate(String sessionId) {
        if (sessionId == null) return "none";
        return sessionId.length() > 8 ? sessionId.substring(0, 8) + "..." : sessionId;
    }
}
