package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.model.ErrorKind;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.protocol.Frames;
import com.codingbridge.protocol.ImagePayload;
import com.codingbridge.protocol.ProtocolException;
import com.codingbridge.protocol.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * FIFO of user commands with one turn in flight at a time.
 *
 *   submit ─▶ [head, ...] ─drain─▶ sendHead ─ok─▶ removed, turn open
 *                                     │
 *                                   fail ─▶ retry after 1s / 2s / 4s ─▶ sendHead
 *                                     │
 *                                 3rd fail ─▶ removed, DELIVERY_EXHAUSTED
 *
 * The head is removed only once its frame is written, or once it has failed
 * three times. The next command goes out after the open turn reaches a
 * terminal event, never while one is still streaming.
 *
 * All methods must be called on the session executor.
 */
final class OutboundQueue {

    private static final Logger log = LoggerFactory.getLogger(OutboundQueue.class);

    static final int    MAX_ATTEMPTS               = 3;
    static final long[] RETRY_DELAYS_MILLIS        = {1_000, 2_000, 4_000};
    static final long   CONNECT_GRACE_MILLIS       = 500;
    static final long   RETRY_CONNECT_GRACE_MILLIS = 300;

    private final SerialExecutor       executor;
    private final SessionState         state;
    private final SessionEvents        events;
    private final ConnectionSupervisor supervisor;
    private final StreamingTextBuffer  textBuffer;
    private final ProcessWatchdog      watchdog;
    private final TranscriptRecorder   transcript;

    private final Deque<PendingCommand> queue = new ArrayDeque<>();
    private boolean       sendInFlight;
    private ScheduledTask retryTask;
    private ScheduledTask graceTask;
    private Consumer<PendingCommand> sentListener = command -> {};

    OutboundQueue(SerialExecutor executor, SessionState state, SessionEvents events,
                  ConnectionSupervisor supervisor, StreamingTextBuffer textBuffer,
                  ProcessWatchdog watchdog, TranscriptRecorder transcript) {
        this.executor   = executor;
        this.state      = state;
        this.events     = events;
        this.supervisor = supervisor;
        this.textBuffer = textBuffer;
        this.watchdog   = watchdog;
        this.transcript = transcript;
    }

    void submit(PendingCommand command) {
        queue.addLast(command);
        log.debug("Queued {} ({} pending)", command, queue.size());
        transcript.record(TranscriptEntry.Kind.USER, command.command());
        drain();
    }

    /** Starts the head command if nothing is in flight. */
    void drain() {
        if (queue.isEmpty() || busy()) return;
        sendHead();
    }

    void onCommandSent(Consumer<PendingCommand> listener) {
        this.sentListener = listener;
    }

    int size() {
        return queue.size();
    }

    PendingCommand peek() {
        return queue.peekFirst();
    }

    boolean isSendInFlight() {
        return sendInFlight;
    }

    boolean isRetryPending() {
        return retryTask != null;
    }

    /** The connection dropped: an unacknowledged write counts as a failed attempt and is resent on reconnection. */
    void onConnectionLost() {
        graceTask = ScheduledTask.cancel(graceTask);
        if (!sendInFlight) return;
        sendInFlight = false;
        PendingCommand head = queue.peekFirst();
        if (head == null) return;
        int attempts = head.recordFailedAttempt();
        log.warn("Connection lost while sending {} (attempt {}/{})", head.id(), attempts, MAX_ATTEMPTS);
        if (attempts >= MAX_ATTEMPTS) exhaust(head, false);
    }

    /** Stops retry and connect-grace timers; queued commands wait for the next connection. */
    void cancelTimers() {
        retryTask = ScheduledTask.cancel(retryTask);
        graceTask = ScheduledTask.cancel(graceTask);
    }

    /** Drops everything queued and every pending timer. */
    void clear() {
        if (!queue.isEmpty()) log.info("Discarding {} queued command(s)", queue.size());
        queue.clear();
        cancelTimers();
        sendInFlight = false;
    }

    // ── Sending ───────────────────────────────────────────────────────────────

    private boolean busy() {
        return state.isProcessing() || sendInFlight || retryTask != null || graceTask != null;
    }

    private void sendHead() {
        PendingCommand head = queue.peekFirst();
        if (head == null) return;

        if (!supervisor.canSend()) {
            log.info("Not connected, connecting before sending {}", head.id());
            supervisor.connect();
            graceTask = executor.schedule(() -> {
                graceTask = null;
                if (supervisor.canSend()) sendHead();
                else failNotConnected(head);
            }, CONNECT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            return;
        }

        textBuffer.reset();
        state.setProcessing(true);
        state.setLastActiveToolName(null);
        watchdog.arm();

        String json;
        try {
            json = Frames.command(head.command(), head.projectPath(), resolveSessionId(head),
                    head.model(), head.permissionMode(), images(head));
        } catch (ProtocolException e) {
            log.error("Cannot encode {}: {}", head.id(), e.getMessage());
            onSendFailed(head, e);
            return;
        }

        sendInFlight = true;
        log.debug("Sending {} (attempt {})", head.id(), head.attempts() + 1);
        supervisor.send(json, failure -> {
            sendInFlight = false;
            if (failure == null) onSent(head);
            else onSendFailed(head, failure);
        });
    }

    private String resolveSessionId(PendingCommand head) {
        String explicit = SessionIds.validate(head.sessionId());
        if (explicit != null) return explicit;
        if (head.sessionId() != null) log.warn("Ignoring malformed resume session id for {}", head.id());
        return SessionIds.validate(state.sessionId());
    }

    private static List<ImagePayload> images(PendingCommand head) {
        return head.images().stream().map(ImagePayload::of).toList();
    }

    private void onSent(PendingCommand head) {
        queue.remove(head);
        retryTask = ScheduledTask.cancel(retryTask);
        state.setLastError(null);
        log.debug("Sent {}", head.id());
        sentListener.accept(head);
    }

    private void onSendFailed(PendingCommand head, Throwable cause) {
        if (!queue.contains(head)) {
            log.debug("Send failure for discarded command {}", head.id());
            return;
        }
        int attempts = head.recordFailedAttempt();
        if (attempts >= MAX_ATTEMPTS) {
            exhaust(head, true);
            return;
        }

        long delay = RETRY_DELAYS_MILLIS[attempts - 1];
        log.warn("Send of {} failed ({}), retrying in {} ms", head.id(), cause.toString(), delay);
        state.setLastError("Retrying... (attempt " + (attempts + 1) + "/" + MAX_ATTEMPTS + ")");
        retryTask = ScheduledTask.cancel(retryTask);
        retryTask = executor.schedule(() -> {
            retryTask = null;
            if (!supervisor.canSend()) supervisor.connect();
            graceTask = executor.schedule(() -> {
                graceTask = null;
                sendHead();
            }, RETRY_CONNECT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void exhaust(PendingCommand head, boolean advance) {
        queue.remove(head);
        retryTask = ScheduledTask.cancel(retryTask);
        log.error("Giving up on {} after {} attempts", head.id(), MAX_ATTEMPTS);
        String message = "Message failed after " + MAX_ATTEMPTS + " attempts. Please try again.";
        state.setProcessing(false);
        state.setLastError("Message failed after " + MAX_ATTEMPTS + " attempts");
        watchdog.disarm();
        transcript.record(TranscriptEntry.Kind.ERROR, message);
        events.onError(new SessionError(ErrorKind.DELIVERY_EXHAUSTED, message));
        if (advance) drain();
    }

    private void failNotConnected(PendingCommand head) {
        queue.remove(head);
        String message = "Not connected to server";
        log.warn("Dropping {}: {}", head.id(), message);
        state.setLastError(message);
        transcript.record(TranscriptEntry.Kind.ERROR, message);
        events.onError(new SessionError(ErrorKind.NOT_CONNECTED, message));
        drain();
    }
}
