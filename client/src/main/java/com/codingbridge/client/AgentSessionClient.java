package com.codingbridge.client;

import com.codingbridge.client.exec.EventLoopSerialExecutor;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.host.AppPresence;
import com.codingbridge.client.host.NotificationSink;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.host.TranscriptWriter;
import com.codingbridge.client.transport.AgentTransport;
import com.codingbridge.common.ClientSettings;
import com.codingbridge.common.LatencyStats;
import com.codingbridge.protocol.AgentModel;
import com.codingbridge.protocol.InboundFrame;
import com.codingbridge.protocol.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Realtime agent-session client.
 *
 *   UI ──submit/abort/approve──▶ OutboundQueue ──▶ ConnectionSupervisor ──▶ transport
 *   UI ◀──SessionListener── StreamAssembler ◀── frames ◀──────────────────┘
 *                     ProcessWatchdog · SessionRecoveryCoordinator
 *
 * Public methods may be called from any thread; each is handed to the session
 * executor, which is the only thread that mutates session state. Listener
 * callbacks run on that executor.
 */
public final class AgentSessionClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionClient.class);

    private final SerialExecutor executor;
    private final boolean        ownsExecutor;
    private final SessionState   state  = new SessionState();
    private final SessionEvents  events = new SessionEvents();
    private final LatencyStats   turnLatency = new LatencyStats("turn");

    private final ConnectionSupervisor       supervisor;
    private final StreamingTextBuffer        textBuffer;
    private final ProcessWatchdog            watchdog;
    private final OutboundQueue              queue;
    private final ApprovalExchange           approvals;
    private final ModelSwitchExchange        modelSwitch;
    private final AbortExchange              abort;
    private final SessionRecoveryCoordinator recovery;
    private final StreamAssembler            assembler;
    private final TranscriptRecorder         transcript;

    private AgentSessionClient(Builder b) {
        this.ownsExecutor = b.executor == null;
        this.executor     = b.executor != null ? b.executor : new EventLoopSerialExecutor("agent-session");

        TurnLifecycle lifecycle = new Lifecycle();
        BackgroundNotifier notifier = new BackgroundNotifier(b.notifications, b.presence);

        this.transcript  = new TranscriptRecorder(b.transcript, state, executor);
        this.supervisor  = new ConnectionSupervisor(executor, b.settings, b.transport, b.reconnectPolicy,
                state, events, new ConnectionObserver());
        this.textBuffer  = new StreamingTextBuffer(executor, b.settings, state, events, transcript);
        this.watchdog    = new ProcessWatchdog(executor, b.settings, state, events, this::onStall);
        this.queue       = new OutboundQueue(executor, state, events, supervisor, textBuffer, watchdog, transcript);
        this.approvals   = new ApprovalExchange(state, events, supervisor, notifier);
        this.modelSwitch = new ModelSwitchExchange(executor, state, events, queue);
        queue.onCommandSent(modelSwitch::onCommandSent);
        this.abort       = new AbortExchange(executor, state, events, supervisor, lifecycle);
        this.recovery    = new SessionRecoveryCoordinator(executor, state, supervisor, watchdog, lifecycle);
        this.assembler   = new StreamAssembler(executor, state, events, textBuffer, modelSwitch, approvals,
                abort, new SessionErrorClassifier(), notifier, transcript, lifecycle);
    }

    public static Builder builder(ClientSettings settings, AgentTransport transport) {
        return new Builder(settings, transport);
    }

    // ── Observation ───────────────────────────────────────────────────────────

    public void addListener(SessionListener listener)    { events.add(listener); }
    public void removeListener(SessionListener listener) { events.remove(listener); }

    public SessionState state()                { return state; }
    public ConnectionState connectionState()   { return supervisor.state(); }
    public LatencyStats turnLatency()          { return turnLatency; }

    ConnectionSupervisor supervisor()          { return supervisor; }
    OutboundQueue queue()                      { return queue; }
    SessionRecoveryCoordinator recovery()      { return recovery; }

    // ── Connection ────────────────────────────────────────────────────────────

    public void connect() {
        executor.execute(supervisor::connect);
    }

    public void disconnect() {
        executor.execute(() -> {
            recovery.clearPending();
            queue.cancelTimers();
            supervisor.disconnect();
        });
    }

    // ── Commands ──────────────────────────────────────────────────────────────

    public void submit(String command, String projectPath) {
        submit(PendingCommand.builder(command, projectPath).build());
    }

    public void submit(PendingCommand command) {
        Objects.requireNonNull(command, "command");
        executor.execute(() -> queue.submit(command));
    }

    public void abortSession() {
        executor.execute(abort::abort);
    }

    /** Unbinds the session so the next command lets the server mint a new one. */
    public void clearSession() {
        executor.execute(() -> {
            log.info("Clearing session {}", SessionIds.abbreviate(state.sessionId()));
            state.setSessionId(null);
            state.setTokenUsage(null);
        });
    }

    // ── Interaction ───────────────────────────────────────────────────────────

    public void respondToApproval(String requestId, boolean allow, boolean alwaysAllow) {
        executor.execute(() -> approvals.respond(requestId, allow, alwaysAllow));
    }

    public void approvePending(boolean alwaysAllow) {
        executor.execute(() -> approvals.approvePending(alwaysAllow));
    }

    public void denyPending() {
        executor.execute(approvals::denyPending);
    }

    public void switchModel(AgentModel model, String customId, String projectPath) {
        executor.execute(() -> modelSwitch.switchModel(model, customId, projectPath));
    }

    // ── Recovery ──────────────────────────────────────────────────────────────

    public void attachToSession(String sessionId, String projectPath) {
        executor.execute(() -> recovery.attachToSession(sessionId, projectPath));
    }

    public void recoverFromBackground(String sessionId, String projectPath) {
        executor.execute(() -> recovery.recoverFromBackground(sessionId, projectPath));
    }

    @Override
    public void close() {
        disconnect();
        if (ownsExecutor && executor instanceof EventLoopSerialExecutor loop) loop.close();
    }

    // ── Wiring ────────────────────────────────────────────────────────────────

    private void onStall() {
        textBuffer.finishTurn();
        state.setReattaching(false);
        modelSwitch.cancel();
        transcript.record(TranscriptEntry.Kind.ERROR, state.lastError());
        watchdog.disarm();
        queue.drain();
    }

    /** In-flight turn state that cannot survive losing the connection. */
    private void dropInFlight() {
        state.setProcessing(false);
        state.setReattaching(false);
        state.setLastActiveToolName(null);
        watchdog.disarm();
        textBuffer.reset();
        queue.onConnectionLost();
    }

    private final class ConnectionObserver implements ConnectionSupervisor.Observer {
        @Override
        public void onConnected() {
            recovery.onConnected();
            queue.drain();
        }

        @Override
        public void onConnectionLost(Throwable cause) {
            dropInFlight();
        }

        @Override
        public void onFrame(InboundFrame frame) {
            watchdog.recordActivity();
            assembler.handle(frame);
        }
    }

    private final class Lifecycle implements TurnLifecycle {
        @Override
        public void turnEnded() {
            if (watchdog.isArmed()) turnLatency.record(watchdog.sinceArmedMillis());
            watchdog.disarm();
            queue.drain();
        }

        @Override
        public void resetAll() {
            state.setProcessing(false);
            state.setAborting(false);
            state.setReattaching(false);
            state.setLastActiveToolName(null);
            state.setLastError(null);
            textBuffer.reset();
            modelSwitch.cancel();
            watchdog.disarm();
            queue.clear();
            approvals.clear();
            abort.cancelTimer();
        }
    }

    public static final class Builder {
        private final ClientSettings settings;
        private final AgentTransport transport;
        private SerialExecutor   executor;
        private ReconnectPolicy  reconnectPolicy = new ReconnectPolicy();
        private NotificationSink notifications   = NotificationSink.NONE;
        private AppPresence      presence        = AppPresence.ALWAYS_FOREGROUND;
        private TranscriptWriter transcript      = TranscriptWriter.NONE;

        private Builder(ClientSettings settings, AgentTransport transport) {
            this.settings  = Objects.requireNonNull(settings, "settings");
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        /** Session executor; by default the client owns a dedicated event loop thread. */
        public Builder executor(SerialExecutor executor)            { this.executor = executor; return this; }
        public Builder reconnectPolicy(ReconnectPolicy policy)      { this.reconnectPolicy = policy; return this; }
        public Builder notifications(NotificationSink sink)         { this.notifications = sink; return this; }
        public Builder presence(AppPresence presence)               { this.presence = presence; return this; }
        public Builder transcript(TranscriptWriter writer)          { this.transcript = writer; return this; }

        public AgentSessionClient build() {
            return new AgentSessionClient(this);
        }
    }
}
