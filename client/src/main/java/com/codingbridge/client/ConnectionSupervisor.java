package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.model.ErrorKind;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.transport.AgentTransport;
import com.codingbridge.client.transport.TransportConnection;
import com.codingbridge.client.transport.TransportListener;
import com.codingbridge.common.ClientSettings;
import com.codingbridge.protocol.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the one transport connection and the {@link ConnectionState} machine.
 *
 *   DISCONNECTED ──connect()──▶ CONNECTING ──pong / first frame──▶ CONNECTED
 *        ▲                          │                                  │
 *        │                       failure                            failure
 *   disconnect()                    ▼                                  ▼
 *        └──────────────────── RECONNECTING(n) ◀──────────────────────┘
 *                                   │ backoff timer
 *                                   └──▶ connect()
 *
 * Every connection gets a fresh generation number. Transport callbacks and send
 * completions capture the generation they were created under and re-enter the
 * session executor; if the generation has moved on they are dropped, so a late
 * callback from an abandoned socket can never mutate state.
 *
 * All methods must be called on the session executor.
 */
public final class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    /** Hooks the rest of the session core hangs off connection transitions. */
    interface Observer {
        void onConnected();

        /** The live connection went away; {@code cause} is null for a local reset. */
        void onConnectionLost(Throwable cause);

        void onFrame(InboundFrame frame);
    }

    /** Completion of one outbound write, run on the session executor with the failure or null. */
    @FunctionalInterface
    public interface SendCallback {
        void onComplete(Throwable failure);
    }

    private final SerialExecutor  executor;
    private final ClientSettings  settings;
    private final AgentTransport  transport;
    private final ReconnectPolicy policy;
    private final SessionState    state;
    private final SessionEvents   events;
    private final Observer        observer;

    private volatile ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private long                generation;
    private TransportConnection connection;
    private ScheduledTask       reconnectTask;
    private int                 reconnectAttempt;
    private long                staleCallbacks;

    ConnectionSupervisor(SerialExecutor executor, ClientSettings settings, AgentTransport transport,
                         ReconnectPolicy policy, SessionState state, SessionEvents events, Observer observer) {
        this.executor  = executor;
        this.settings  = settings;
        this.transport = transport;
        this.policy    = policy;
        this.state     = state;
        this.events    = events;
        this.observer  = observer;
    }

    public ConnectionState state() {
        return connectionState;
    }

    /** Callbacks dropped because their generation was superseded. */
    public long staleCallbackCount() {
        return staleCallbacks;
    }

    /** A connection is open or opening; writes issued now go out once the handshake completes. */
    boolean canSend() {
        return connection != null && connectionState.phase() != ConnectionState.Phase.DISCONNECTED;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    /** Opens a new connection, abandoning any existing one. */
    void connect() {
        reconnectTask = ScheduledTask.cancel(reconnectTask);
        long gen = ++generation;
        if (connection != null) {
            connection.close();
            connection = null;
            observer.onConnectionLost(null);
        }

        URI endpoint = settings.webSocketUri();
        if (endpoint == null) {
            log.error("Cannot connect: no usable WebSocket URL configured");
            reconnectAttempt = 0;
            state.setLastError("Invalid WebSocket URL");
            transition(ConnectionState.DISCONNECTED);
            events.onError(new SessionError(ErrorKind.TRANSPORT, "Invalid WebSocket URL"));
            return;
        }

        if (connectionState.phase() == ConnectionState.Phase.RECONNECTING) {
            log.info("Reconnecting to {} (attempt {})", redact(endpoint), reconnectAttempt);
        } else {
            log.info("Connecting to {}", redact(endpoint));
            transition(ConnectionState.CONNECTING);
        }

        TransportConnection conn = transport.open(endpoint, new GenerationListener(gen));
        connection = conn;
        conn.ping().whenComplete((v, err) -> executor.execute(() -> onPingResult(gen, err)));
    }

    /** Terminal: cancels reconnection and leaves the supervisor idle until the next {@link #connect()}. */
    void disconnect() {
        reconnectTask = ScheduledTask.cancel(reconnectTask);
        reconnectAttempt = 0;
        generation++;
        TransportConnection conn = connection;
        connection = null;
        if (conn != null) conn.close();
        if (connectionState.phase() != ConnectionState.Phase.DISCONNECTED) {
            log.info("Disconnected");
        }
        transition(ConnectionState.DISCONNECTED);
        observer.onConnectionLost(null);
    }

    /**
     * Writes one text frame on the current connection. The callback runs on the
     * session executor, and not at all if the connection is replaced first.
     */
    void send(String text, SendCallback callback) {
        TransportConnection conn = connection;
        long gen = generation;
        if (conn == null) {
            executor.execute(() -> callback.onComplete(new ClosedChannelException()));
            return;
        }
        conn.sendText(text).whenComplete((v, err) -> executor.execute(() -> {
            if (gen != generation) {
                staleCallbacks++;
                log.debug("Dropping send completion from superseded connection #{}", gen);
                return;
            }
            callback.onComplete(err);
        }));
    }

    // ── Transport events (already on the session executor) ────────────────────

    private void onPingResult(long gen, Throwable err) {
        if (isStale(gen)) return;
        if (err != null) {
            log.debug("Liveness probe on connection #{} failed: {}", gen, err.toString());
            return;
        }
        if (!connectionState.isConnected()) markConnected();
    }

    private void onFrame(long gen, InboundFrame frame) {
        if (isStale(gen)) return;
        if (!connectionState.isConnected()) markConnected();
        observer.onFrame(frame);
    }

    private void onFailure(long gen, Throwable cause) {
        if (isStale(gen)) return;
        log.warn("Connection #{} lost: {}", gen, describe(cause));
        connection.close();
        connection = null;
        state.setLastError(describe(cause));
        observer.onConnectionLost(cause);
        scheduleReconnect();
    }

    private void markConnected() {
        reconnectAttempt = 0;
        log.info("Connected");
        transition(ConnectionState.CONNECTED);
        state.setLastError(null);
        observer.onConnected();
    }

    private void scheduleReconnect() {
        if (reconnectTask != null) {
            log.debug("Reconnect already scheduled");
            return;
        }
        reconnectAttempt++;
        transition(ConnectionState.reconnecting(reconnectAttempt));
        long delay = policy.delayMillis(reconnectAttempt);
        log.info("Reconnecting in {} ms (attempt {})", delay, reconnectAttempt);
        reconnectTask = executor.schedule(() -> {
            reconnectTask = null;
            if (!connectionState.isConnected()) connect();
        }, delay, TimeUnit.MILLISECONDS);
    }

    private boolean isStale(long gen) {
        if (gen == generation && connection != null) return false;
        staleCallbacks++;
        log.debug("Dropping callback from superseded connection #{} (current #{})", gen, generation);
        return true;
    }

    private void transition(ConnectionState next) {
        if (next.equals(connectionState)) return;
        connectionState = next;
        events.onConnectionStateChanged(next);
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "Connection closed";
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }

    /** Strips the query (auth token) for logging. */
    private static String redact(URI uri) {
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() != -1 ? ":" + uri.getPort() : "") + uri.getPath();
    }

    private final class GenerationListener implements TransportListener {
        private final long gen;

        GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onFrame(InboundFrame frame) {
            executor.execute(() -> ConnectionSupervisor.this.onFrame(gen, frame));
        }

        @Override
        public void onFailure(Throwable cause) {
            executor.execute(() -> ConnectionSupervisor.this.onFailure(gen, cause));
        }
    }
}
