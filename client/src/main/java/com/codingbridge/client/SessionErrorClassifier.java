package com.codingbridge.client;

import com.codingbridge.protocol.InboundFrame;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a {@code claude-error} means the bound session is gone on the server.
 *
 * A structured {@code code} on the frame is authoritative. Servers that send only
 * free text are matched against known phrases.
 */
final class SessionErrorClassifier {

    static final Set<String> SESSION_CODES = Set.of(
            "SESSION_NOT_FOUND", "SESSION_EXPIRED", "SESSION_INVALID", "RESUME_FAILED");

    static final List<String> SESSION_PHRASES = List.of(
            "session", "process exited with code 1", "failed to resume", "resume failed");

    boolean isSessionInvalid(InboundFrame frame) {
        if (frame.code() != null) {
            return SESSION_CODES.contains(frame.code().toUpperCase(Locale.ROOT));
        }
        String error = frame.error();
        if (error == null) return false;
        String lower = error.toLowerCase(Locale.ROOT);
        for (String phrase : SESSION_PHRASES) {
            if (lower.contains(phrase)) return true;
        }
        return false;
    }
}
