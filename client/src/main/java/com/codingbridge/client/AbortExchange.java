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
 * Cancels the running turn. The abort completes on {@code session-aborted}, on a
 * failed write, or after 3 s, whichever comes first; each resets all turn
 * state and emits {@code onAborted} once.
 */
final class AbortExchange {

    private static final Logger log = LoggerFactory.getLogger(AbortExchange.class);

    static final long ABORT_TIMEOUT_MILLIS = 3_000;

    private final SerialExecutor       executor;
    private final SessionState         state;
    private final SessionEvents        events;
    private final ConnectionSupervisor supervisor;
    private final TurnLifecycle        lifecycle;

    private ScheduledTask timeoutTask;

    AbortExchange(SerialExecutor executor, SessionState state, SessionEvents events,
                  ConnectionSupervisor supervisor, TurnLifecycle lifecycle) {
        this.executor   = executor;
        this.state      = state;
        this.events     = events;
        this.supervisor = supervisor;
        this.lifecycle  = lifecycle;
    }

    void abort() {
        if (state.isAborting()) {
            log.debug("Abort already pending");
            return;
        }
        String sessionId = SessionIds.validate(state.sessionId());
        if (sessionId == null) {
            log.info("Abort with no session bound, resetting locally");
            finish();
            return;
        }

        String json;
        try {
            json = Frames.abort(sessionId);
        } catch (ProtocolException e) {
            log.error("Cannot encode abort: {}", e.getMessage());
            finish();
            return;
        }

        log.info("Aborting session {}", SessionIds.abbreviate(sessionId));
        state.setAborting(true);
        supervisor.send(json, failure -> {
            if (failure != null && state.isAborting()) {
                log.error("Abort request not delivered: {}", failure.toString());
                finish();
            }
        });
        timeoutTask = executor.schedule(() -> {
            timeoutTask = null;
            if (state.isAborting()) {
                log.warn("No abort confirmation after {} ms, resetting", ABORT_TIMEOUT_MILLIS);
                finish();
            }
        }, ABORT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    /** Server confirmed ({@code session-aborted}); a confirmation arriving after a forced reset is ignored. */
    void onAborted() {
        if (!state.isAborting() && !state.isProcessing()) {
            log.debug("session-aborted with nothing to abort");
            return;
        }
        finish();
    }

    void cancelTimer() {
        timeoutTask = ScheduledTask.cancel(timeoutTask);
    }

    private void finish() {
        lifecycle.resetAll();
        events.onAborted();
    }
}
