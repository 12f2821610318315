package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.common.ClientSettings;

import java.util.concurrent.TimeUnit;

/**
 * Accumulates streamed text for the current segment and publishes it as
 * {@link SessionState#currentText()} after a short quiet period, so the UI
 * re-renders per burst rather than per token.
 *
 * A segment ends at a tool invocation ({@link #commit()}) or at the end of
 * the turn ({@link #finishTurn()}).
 */
final class StreamingTextBuffer {

    private final SerialExecutor     executor;
    private final ClientSettings     settings;
    private final SessionState       state;
    private final SessionEvents      events;
    private final TranscriptRecorder transcript;

    private final StringBuilder buffer = new StringBuilder();
    private ScheduledTask       flushTask;

    StreamingTextBuffer(SerialExecutor executor, ClientSettings settings, SessionState state,
                        SessionEvents events, TranscriptRecorder transcript) {
        this.executor   = executor;
        this.settings   = settings;
        this.state      = state;
        this.events     = events;
        this.transcript = transcript;
    }

    void append(String delta) {
        if (delta == null || delta.isEmpty()) return;
        buffer.append(delta);
        flushTask = ScheduledTask.cancel(flushTask);
        flushTask = executor.schedule(this::flush, settings.textFlushMillis(), TimeUnit.MILLISECONDS);
    }

    /** Publishes the buffered text now if it differs from what is already visible. */
    void flush() {
        flushTask = ScheduledTask.cancel(flushTask);
        if (buffer.length() == 0) return;
        String snapshot = buffer.toString();
        if (snapshot.equals(state.currentText())) return;
        state.setCurrentText(snapshot);
        events.onText(snapshot);
    }

    /** Ends the segment before a tool invocation: flush, emit the commit, start a new segment. */
    void commit() {
        flush();
        String text = state.currentText();
        if (!text.isEmpty()) {
            events.onTextCommit(text);
            transcript.record(TranscriptEntry.Kind.ASSISTANT, text);
            state.setCurrentText("");
        }
        buffer.setLength(0);
    }

    /** Ends the turn: flush and persist the final segment; it stays visible until the next turn starts. */
    void finishTurn() {
        flush();
        transcript.record(TranscriptEntry.Kind.ASSISTANT, state.currentText());
        clear();
    }

    /** Drops buffered text without publishing it. */
    void clear() {
        flushTask = ScheduledTask.cancel(flushTask);
        buffer.setLength(0);
    }

    /** Drops buffered and visible text. */
    void reset() {
        clear();
        state.setCurrentText("");
    }
}
