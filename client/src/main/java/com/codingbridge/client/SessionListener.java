package com.codingbridge.client;

import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.SessionsUpdate;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.client.model.ToolResult;
import com.codingbridge.protocol.AgentModel;

/**
 * Session events, delivered on the session executor in the order they occur.
 * All methods default to no-ops so listeners override only what they render.
 */
public interface SessionListener {

    default void onConnectionStateChanged(ConnectionState state) {}

    /** The server minted (or confirmed) the session identifier now bound. */
    default void onSessionCreated(String sessionId) {}

    /** Stable snapshot of the current assistant text segment (cumulative, not a delta). */
    default void onText(String text) {}

    /** The current text segment is final, a tool invocation follows. */
    default void onTextCommit(String text) {}

    default void onToolUse(ToolInvocation tool) {}

    default void onToolResult(ToolResult result) {}

    default void onThinking(String thinking) {}

    default void onQuestion(QuestionRequest question) {}

    /** Turn finished normally; {@code sessionId} is the bound identifier, may be null. */
    default void onComplete(String sessionId) {}

    default void onError(SessionError error) {}

    /** The bound session was invalid on the server and has been cleared; the next command starts fresh. */
    default void onSessionRecovered() {}

    /** First frame arrived after a reattachment request. */
    default void onSessionAttached() {}

    default void onAborted() {}

    default void onApprovalRequest(ApprovalRequest request) {}

    default void onModelChanged(AgentModel model, String modelId) {}

    default void onTokenUsage(TokenUsage usage) {}

    default void onSessionsUpdated(SessionsUpdate update) {}

    default void onProjectsUpdated() {}
}
