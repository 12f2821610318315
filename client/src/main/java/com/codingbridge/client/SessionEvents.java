package com.codingbridge.client;

import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.SessionsUpdate;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.client.model.ToolResult;
import com.codingbridge.protocol.AgentModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans events out to registered listeners. A listener that throws is logged
 * and skipped; it never disturbs session bookkeeping or other listeners.
 */
final class SessionEvents implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(SessionEvents.class);

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    void add(SessionListener l)    { listeners.add(l); }
    void remove(SessionListener l) { listeners.remove(l); }

    private void emit(String event, Consumer<SessionListener> call) {
        for (SessionListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.error("Listener {} failed handling {}", l.getClass().getName(), event, e);
            }
        }
    }

    @Override public void onConnectionStateChanged(ConnectionState s) { emit("connectionState", l -> l.onConnectionStateChanged(s)); }
    @Override public void onSessionCreated(String sid)                { emit("sessionCreated", l -> l.onSessionCreated(sid)); }
    @Override public void onText(String text)                         { emit("text", l -> l.onText(text)); }
    @Override public void onTextCommit(String text)                   { emit("textCommit", l -> l.onTextCommit(text)); }
    @Override public void onToolUse(ToolInvocation tool)              { emit("toolUse", l -> l.onToolUse(tool)); }
    @Override public void onToolResult(ToolResult result)             { emit("toolResult", l -> l.onToolResult(result)); }
    @Override public void onThinking(String thinking)                 { emit("thinking", l -> l.onThinking(thinking)); }
    @Override public void onQuestion(QuestionRequest q)               { emit("question", l -> l.onQuestion(q)); }
    @Override public void onComplete(String sid)                      { emit("complete", l -> l.onComplete(sid)); }
    @Override public void onError(SessionError error)                 { emit("error", l -> l.onError(error)); }
    @Override public void onSessionRecovered()                        { emit("sessionRecovered", SessionListener::onSessionRecovered); }
    @Override public void onSessionAttached()                         { emit("sessionAttached", SessionListener::onSessionAttached); }
    @Override public void onAborted()                                 { emit("aborted", SessionListener::onAborted); }
    @Override public void onApprovalRequest(ApprovalRequest r)        { emit("approvalRequest", l -> l.onApprovalRequest(r)); }
    @Override public void onModelChanged(AgentModel m, String id)     { emit("modelChanged", l -> l.onModelChanged(m, id)); }
    @Override public void onTokenUsage(TokenUsage usage)              { emit("tokenUsage", l -> l.onTokenUsage(usage)); }
    @Override public void onSessionsUpdated(SessionsUpdate update)    { emit("sessionsUpdated", l -> l.onSessionsUpdated(update)); }
    @Override public void onProjectsUpdated()                         { emit("projectsUpdated", SessionListener::onProjectsUpdated); }
}
