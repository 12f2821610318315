package com.codingbridge.client;

import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.host.TranscriptWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stamps transcript entries with the bound session and clock; writer failures are logged, never propagated. */
final class TranscriptRecorder {

    private static final Logger log = LoggerFactory.getLogger(TranscriptRecorder.class);

    private final TranscriptWriter writer;
    private final SessionState     state;
    private final SerialExecutor   executor;

    TranscriptRecorder(TranscriptWriter writer, SessionState state, SerialExecutor executor) {
        this.writer   = writer;
        this.state    = state;
        this.executor = executor;
    }

    void record(TranscriptEntry.Kind kind, String text) {
        if (text == null || text.isEmpty()) return;
        try {
            writer.append(new TranscriptEntry(kind, state.sessionId(), text, executor.currentTimeMillis()));
        } catch (RuntimeException e) {
            log.warn("Transcript write failed ({}): {}", kind, e.toString());
        }
    }
}
