package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.protocol.Frames;
import com.codingbridge.protocol.ProtocolException;
import com.codingbridge.protocol.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Re-attaches to a session that kept running on the server while this client
 * was away (backgrounded, disconnected).
 *
 * Attaching sends a lightweight {@code /status} command on the session; the
 * first response frame marks the session attached and output resumes on the
 * normal stream path. When not connected, the target is remembered, a
 * connection is opened, and the attach goes out 200 ms after it comes up.
 */
final class SessionRecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionRecoveryCoordinator.class);

    static final String ATTACH_COMMAND      = "/status";
    static final long   SETTLE_DELAY_MILLIS = 200;

    private final SerialExecutor       executor;
    private final SessionState         state;
    private final ConnectionSupervisor supervisor;
    private final ProcessWatchdog      watchdog;
    private final TurnLifecycle        lifecycle;

    private String        pendingSessionId;
    private String        pendingProjectPath;
    private ScheduledTask settleTask;

    SessionRecoveryCoordinator(SerialExecutor executor, SessionState state, ConnectionSupervisor supervisor,
                               ProcessWatchdog watchdog, TurnLifecycle lifecycle) {
        this.executor   = executor;
        this.state      = state;
        this.supervisor = supervisor;
        this.watchdog   = watchdog;
        this.lifecycle  = lifecycle;
    }

    boolean attachToSession(String sessionId, String projectPath) {
        if (!supervisor.canSend()) {
            log.warn("Cannot attach to session: not connected");
            return false;
        }
        String validated = SessionIds.validate(sessionId);
        if (validated == null) {
            log.warn("Cannot attach: malformed session id {}", sessionId);
            return false;
        }
        if (state.isProcessing()) {
            log.warn("Cannot attach to {} while a command is in flight", SessionIds.abbreviate(validated));
            return false;
        }

        String json;
        try {
            json = Frames.command(ATTACH_COMMAND, projectPath, validated, null, null, null);
        } catch (ProtocolException e) {
            log.error("Cannot encode attach request: {}", e.getMessage());
            return false;
        }

        log.info("Reattaching to session {}", SessionIds.abbreviate(validated));
        state.setSessionId(validated);
        state.setReattaching(true);
        state.setProcessing(true);
        watchdog.arm();
        supervisor.send(json, failure -> {
            if (failure != null && state.isReattaching()) {
                log.error("Attach request not delivered: {}", failure.toString());
                state.setReattaching(false);
                state.setProcessing(false);
                lifecycle.turnEnded();
            }
        });
        return true;
    }

    void recoverFromBackground(String sessionId, String projectPath) {
        if (supervisor.state().isConnected()) {
            attachToSession(sessionId, projectPath);
            return;
        }
        log.info("Recovering session {} after reconnect", SessionIds.abbreviate(sessionId));
        pendingSessionId   = sessionId;
        pendingProjectPath = projectPath;
        if (!supervisor.canSend()) supervisor.connect();
    }

    void onConnected() {
        if (pendingSessionId == null) return;
        String sessionId   = pendingSessionId;
        String projectPath = pendingProjectPath;
        pendingSessionId   = null;
        pendingProjectPath = null;
        settleTask = ScheduledTask.cancel(settleTask);
        settleTask = executor.schedule(() -> {
            settleTask = null;
            attachToSession(sessionId, projectPath);
        }, SETTLE_DELAY_MILLIS, TimeUnit.MILLISECONDS);
    }

    boolean hasPendingRecovery() {
        return pendingSessionId != null || settleTask != null;
    }

    void clearPending() {
        pendingSessionId   = null;
        pendingProjectPath = null;
        settleTask = ScheduledTask.cancel(settleTask);
    }
}
