package com.codingbridge.client;

import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.SessionsUpdate;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.client.model.ToolResult;
import com.codingbridge.protocol.AgentModel;

import java.util.ArrayList;
import java.util.List;

/** Records every event as a short "name:detail" string, plus typed payloads where tests need them. */
final class RecordingListener implements SessionListener {

    final List<String> events = new ArrayList<>();
    final List<SessionError> errors = new ArrayList<>();
    final List<ToolInvocation> tools = new ArrayList<>();
    final List<QuestionRequest> questions = new ArrayList<>();
    final List<ApprovalRequest> approvals = new ArrayList<>();
    final List<ConnectionState> states = new ArrayList<>();

    @Override public void onConnectionStateChanged(ConnectionState s) { states.add(s); }
    @Override public void onSessionCreated(String sid)            { events.add("session-created:" + sid); }
    @Override public void onText(String text)                     { events.add("text:" + text); }
    @Override public void onTextCommit(String text)               { events.add("text-commit:" + text); }
    @Override public void onToolUse(ToolInvocation tool)          { tools.add(tool); events.add("tool-use:" + tool.name()); }
    @Override public void onToolResult(ToolResult result)         { events.add("tool-result:" + result.content()); }
    @Override public void onThinking(String thinking)             { events.add("thinking:" + thinking); }
    @Override public void onQuestion(QuestionRequest q)           { questions.add(q); events.add("question:" + q.requestId()); }
    @Override public void onComplete(String sid)                  { events.add("complete:" + sid); }
    @Override public void onError(SessionError error)             { errors.add(error); events.add("error:" + error.kind()); }
    @Override public void onSessionRecovered()                    { events.add("session-recovered"); }
    @Override public void onSessionAttached()                     { events.add("session-attached"); }
    @Override public void onAborted()                             { events.add("aborted"); }
    @Override public void onApprovalRequest(ApprovalRequest r)    { approvals.add(r); events.add("approval:" + r.id()); }
    @Override public void onModelChanged(AgentModel m, String id) { events.add("model:" + m + ":" + id); }
    @Override public void onTokenUsage(TokenUsage usage)          { events.add("tokens:" + usage.used() + "/" + usage.total()); }
    @Override public void onSessionsUpdated(SessionsUpdate u)     { events.add("sessions-updated:" + u.action()); }
    @Override public void onProjectsUpdated()                     { events.add("projects-updated"); }

    long count(String prefix) {
        return events.stream().filter(e -> e.startsWith(prefix)).count();
    }

    List<String> without(String prefix) {
        return events.stream().filter(e -> !e.startsWith(prefix)).toList();
    }
}
