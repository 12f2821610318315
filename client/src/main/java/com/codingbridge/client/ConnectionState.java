package com.codingbridge.client;

/**
 * Connection lifecycle as seen by the UI.
 *
 * {@code attempt} is positive only while {@link Phase#RECONNECTING} and zero otherwise.
 */
public record ConnectionState(Phase phase, int attempt) {

    public enum Phase { DISCONNECTED, CONNECTING, CONNECTED, RECONNECTING }

    public static final ConnectionState DISCONNECTED = new ConnectionState(Phase.DISCONNECTED, 0);
    public static final ConnectionState CONNECTING   = new ConnectionState(Phase.CONNECTING, 0);
    public static final ConnectionState CONNECTED    = new ConnectionState(Phase.CONNECTED, 0);

    public ConnectionState {
        if (phase == null) throw new IllegalArgumentException("phase is required");
        if (phase == Phase.RECONNECTING ? attempt < 1 : attempt != 0) {
            throw new IllegalArgumentException("attempt " + attempt + " invalid for " + phase);
        }
    }

    public static ConnectionState reconnecting(int attempt) {
        return new ConnectionState(Phase.RECONNECTING, attempt);
    }

    public boolean isConnected() {
        return phase == Phase.CONNECTED;
    }

    public boolean isConnecting() {
        return phase == Phase.CONNECTING || phase == Phase.RECONNECTING;
    }

    public String displayText() {
        return switch (phase) {
            case DISCONNECTED -> "Disconnected";
            case CONNECTING   -> "Connecting...";
            case CONNECTED    -> "Connected";
            case RECONNECTING -> "Reconnecting (" + attempt + ")...";
        };
    }
}
