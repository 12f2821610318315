package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.model.ErrorKind;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.common.ClientSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Detects a stalled turn: armed when a command goes out, polls every 5 s, and
 * force-completes the turn as a {@link ErrorKind#TIMEOUT} once no inbound
 * frame has arrived for {@link ClientSettings#processingTimeoutSecs()}.
 *
 * The timeout is read on every poll, so a changed setting applies to the turn in flight.
 */
final class ProcessWatchdog {

    private static final Logger log = LoggerFactory.getLogger(ProcessWatchdog.class);

    static final long POLL_INTERVAL_MILLIS = 5_000;

    private final SerialExecutor executor;
    private final ClientSettings settings;
    private final SessionState   state;
    private final SessionEvents  events;
    private final Runnable       onStall;

    private ScheduledTask pollTask;
    private long          armedAt;
    private long          lastActivityAt;

    ProcessWatchdog(SerialExecutor executor, ClientSettings settings, SessionState state,
                    SessionEvents events, Runnable onStall) {
        this.executor = executor;
        this.settings = settings;
        this.state    = state;
        this.events   = events;
        this.onStall  = onStall;
    }

    void arm() {
        pollTask = ScheduledTask.cancel(pollTask);
        armedAt = lastActivityAt = executor.currentTimeMillis();
        schedulePoll();
    }

    void recordActivity() {
        lastActivityAt = executor.currentTimeMillis();
    }

    void disarm() {
        pollTask = ScheduledTask.cancel(pollTask);
    }

    boolean isArmed() {
        return pollTask != null;
    }

    /** Millis since the last {@link #arm()}, for turn latency. */
    long sinceArmedMillis() {
        return executor.currentTimeMillis() - armedAt;
    }

    private void schedulePoll() {
        pollTask = executor.schedule(this::poll, POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
    }

    private void poll() {
        pollTask = null;
        if (!state.isProcessing()) return;

        long elapsed = executor.currentTimeMillis() - lastActivityAt;
        long timeoutMillis = settings.processingTimeoutSecs() * 1_000L;
        if (elapsed < timeoutMillis) {
            schedulePoll();
            return;
        }

        String tool = state.lastActiveToolName();
        String message = "Request timed out after " + formatElapsed(elapsed)
                + " (" + settings.processingTimeoutSecs() + "s) with no response from server"
                + (tool != null ? " (last tool: " + tool + ")" : "");
        log.warn(message);

        state.setProcessing(false);
        state.setLastActiveToolName(null);
        state.setLastError(message);
        events.onError(new SessionError(ErrorKind.TIMEOUT, message));
        onStall.run();
    }

    static String formatElapsed(long millis) {
        long secs = millis / 1_000;
        return secs >= 60 ? (secs / 60) + "m " + (secs % 60) + "s" : secs + "s";
    }
}
