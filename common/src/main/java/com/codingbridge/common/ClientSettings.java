package com.codingbridge.common;

import java.net.URI;

/**
 * Settings the session core reads at runtime.
 *
 * Values are re-read on use, so an implementation backed by mutable
 * user preferences takes effect without reconnecting.
 */
public interface ClientSettings {

    /** WebSocket endpoint, or null when the configured URL is unusable. */
    URI webSocketUri();

    /** Seconds of inbound silence tolerated while a command is in flight. */
    int processingTimeoutSecs();

    /** Quiescence window before buffered streaming text is published. */
    long textFlushMillis();
}
