package com.codingbridge.client;

import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.ErrorKind;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.SessionsUpdate;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.client.model.ToolResult;
import com.codingbridge.protocol.AgentModel;
import com.codingbridge.protocol.InboundFrame;
import com.codingbridge.protocol.SessionIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns decoded server frames into session events and state changes.
 *
 * Content blocks inside a response are handled strictly in order:
 *   text        → streaming buffer (debounced onText)
 *   tool_use    → commit buffered text, then onToolUse / onQuestion
 *   tool_result → onToolResult
 *   thinking    → onThinking
 *
 * so a text segment is always committed before the tool invocation that follows it.
 *
 * All methods must be called on the session executor.
 */
final class StreamAssembler {

    private static final Logger log = LoggerFactory.getLogger(StreamAssembler.class);

    private final SerialExecutor         executor;
    private final SessionState           state;
    private final SessionEvents          events;
    private final StreamingTextBuffer    textBuffer;
    private final ModelSwitchExchange    modelSwitch;
    private final ApprovalExchange       approvals;
    private final AbortExchange          abort;
    private final SessionErrorClassifier classifier;
    private final BackgroundNotifier     notifier;
    private final TranscriptRecorder     transcript;
    private final TurnLifecycle          lifecycle;

    StreamAssembler(SerialExecutor executor, SessionState state, SessionEvents events,
                    StreamingTextBuffer textBuffer, ModelSwitchExchange modelSwitch,
                    ApprovalExchange approvals, AbortExchange abort, SessionErrorClassifier classifier,
                    BackgroundNotifier notifier, TranscriptRecorder transcript, TurnLifecycle lifecycle) {
        this.executor    = executor;
        this.state       = state;
        this.events      = events;
        this.textBuffer  = textBuffer;
        this.modelSwitch = modelSwitch;
        this.approvals   = approvals;
        this.abort       = abort;
        this.classifier  = classifier;
        this.notifier    = notifier;
        this.transcript  = transcript;
        this.lifecycle   = lifecycle;
    }

    void handle(InboundFrame frame) {
        switch (frame.type()) {
            case SESSION_CREATED    -> onSessionCreated(frame);
            case CLAUDE_RESPONSE    -> onResponse(frame.data());
            case TOKEN_BUDGET       -> onTokenBudget(frame.data());
            case CLAUDE_COMPLETE    -> onComplete(frame);
            case CLAUDE_ERROR       -> onError(frame);
            case SESSION_ABORTED    -> onSessionAborted();
            case PERMISSION_REQUEST -> onPermissionRequest(frame.data());
            case SESSIONS_UPDATED   -> onSessionsUpdated(frame.data());
            case PROJECTS_UPDATED   -> events.onProjectsUpdated();
            default -> log.debug("Ignoring frame type '{}'", frame.rawType());
        }
    }

    // ── Session lifecycle ─────────────────────────────────────────────────────

    private void onSessionCreated(InboundFrame frame) {
        String sessionId = SessionIds.validate(frame.sessionId());
        if (sessionId == null) {
            log.warn("session-created without a usable session id: {}", frame.sessionId());
            return;
        }
        log.info("Session {} created", SessionIds.abbreviate(sessionId));
        state.setSessionId(sessionId);
        events.onSessionCreated(sessionId);
    }

    private void onComplete(InboundFrame frame) {
        textBuffer.flush();
        confirmAttached();
        state.setProcessing(false);
        state.setLastActiveToolName(null);
        String sessionId = SessionIds.validate(frame.sessionId());
        if (sessionId != null) state.setSessionId(sessionId);

        modelSwitch.onTurnCompleted(state.currentText());
        String finalText = state.currentText();
        textBuffer.finishTurn();
        notifier.taskComplete(finalText);
        log.debug("Turn complete (session {})", SessionIds.abbreviate(state.sessionId()));
        events.onComplete(state.sessionId());
        lifecycle.turnEnded();
    }

    private void onError(InboundFrame frame) {
        textBuffer.finishTurn();
        textBuffer.reset();
        state.setProcessing(false);
        state.setReattaching(false);
        state.setLastActiveToolName(null);
        modelSwitch.cancel();

        String message = frame.error() != null ? frame.error() : "Unknown error";
        if (classifier.isSessionInvalid(frame) && state.sessionId() != null) {
            log.warn("Session {} no longer valid on server ({}), starting fresh",
                    SessionIds.abbreviate(state.sessionId()), message);
            state.setSessionId(null);
            state.setLastError("Session expired, starting fresh...");
            events.onSessionRecovered();
        } else {
            log.warn("Server error: {}", message);
            state.setLastError(message);
            transcript.record(TranscriptEntry.Kind.ERROR, message);
            events.onError(new SessionError(ErrorKind.SERVER, message));
        }
        lifecycle.turnEnded();
    }

    private void onSessionAborted() {
        textBuffer.flush();
        log.info("Server confirmed abort");
        abort.onAborted();
    }

    private void confirmAttached() {
        if (!state.isReattaching()) return;
        state.setReattaching(false);
        log.info("Attached to session {}", SessionIds.abbreviate(state.sessionId()));
        events.onSessionAttached();
    }

    // ── Assistant output ──────────────────────────────────────────────────────

    private void onResponse(JsonNode data) {
        confirmAttached();
        if (!data.isObject()) {
            log.debug("claude-response without data object");
            return;
        }
        String type = text(data, "type");
        JsonNode message = data.get("message");
        if ("assistant".equals(type) && message != null && message.isObject()) {
            processContent(message);
            return;
        }

        String kind = type != null ? type : text(data, "role");
        if (kind == null) {
            if (data.has("content")) processContent(data);
            return;
        }
        switch (kind) {
            case "system"    -> onSystem(data);
            case "assistant" -> processContent(data);
            case "user"      -> onUserEcho(data);
            case "result"    -> log.debug("Ignoring result summary");
            default          -> log.debug("Ignoring response of type '{}'", kind);
        }
    }

    /** {@code {type:"system", subtype:"init", session_id, model}}. */
    private void onSystem(JsonNode data) {
        if (!"init".equals(text(data, "subtype"))) return;
        String sessionId = SessionIds.validate(text(data, "session_id"));
        if (sessionId != null && state.sessionId() == null) {
            log.info("Session {} bound from init", SessionIds.abbreviate(sessionId));
            state.setSessionId(sessionId);
            events.onSessionCreated(sessionId);
        }
        String modelId = text(data, "model");
        if (modelId != null) state.setCurrentModel(AgentModel.fromModelId(modelId), modelId);
    }

    /** Tool results come back wrapped in a user-role message. */
    private void onUserEcho(JsonNode data) {
        JsonNode content = data.has("content") ? data.get("content") : data.path("message").path("content");
        if (!content.isArray()) return;
        for (JsonNode part : content) {
            if ("tool_result".equals(text(part, "type"))) emitToolResult(part);
        }
    }

    private void processContent(JsonNode node) {
        JsonNode content = node.get("content");
        if (content != null && content.isArray()) {
            for (JsonNode block : content) processBlock(block);
        } else if (content != null && content.isTextual()) {
            textBuffer.append(content.asText());
        } else {
            JsonNode message = node.get("message");
            if (message != null && message.isObject()) processContent(message);
        }
    }

    private void processBlock(JsonNode block) {
        String type = text(block, "type");
        if (type == null) return;
        switch (type) {
            case "text" -> {
                String text = text(block, "text");
                if (text == null || text.isEmpty()) return;
                modelSwitch.onText(text);
                textBuffer.append(text);
            }
            case "tool_use"    -> onToolUse(block);
            case "tool_result" -> emitToolResult(block);
            case "thinking" -> {
                String thinking = text(block, "thinking");
                if (thinking == null || thinking.isEmpty()) return;
                transcript.record(TranscriptEntry.Kind.THINKING, thinking);
                events.onThinking(thinking);
            }
            default -> log.debug("Ignoring content block '{}'", type);
        }
    }

    private void onToolUse(JsonNode block) {
        textBuffer.commit();
        String id = text(block, "id");
        String name = text(block, "name");
        if (name == null) name = "tool";
        JsonNode input = block.path("input");
        state.setLastActiveToolName(name);

        if (QuestionRequest.TOOL_NAME.equals(name)) {
            QuestionRequest question = QuestionRequest.from(id, input);
            if (question != null) {
                transcript.record(TranscriptEntry.Kind.QUESTION, question.questions().get(0).question());
                notifier.questionAsked(question);
                events.onQuestion(question);
                return;
            }
            log.debug("{} without parseable questions, reporting as tool use", name);
        }
        ToolInvocation tool = ToolInvocation.of(id, name, input);
        transcript.record(TranscriptEntry.Kind.TOOL_USE, name + (tool.summary().isEmpty() ? "" : " " + tool.summary()));
        events.onToolUse(tool);
    }

    private void emitToolResult(JsonNode block) {
        String toolUseId = text(block, "tool_use_id");
        boolean error = block.path("is_error").asBoolean(false);
        JsonNode content = block.get("content");
        if (content == null) return;
        if (content.isTextual()) {
            toolResult(toolUseId, content.asText(), error);
        } else if (content.isArray()) {
            for (JsonNode part : content) {
                String text = text(part, "text");
                if (text != null) toolResult(toolUseId, text, error);
            }
        }
    }

    private void toolResult(String toolUseId, String content, boolean error) {
        transcript.record(TranscriptEntry.Kind.TOOL_RESULT, content);
        events.onToolResult(new ToolResult(toolUseId, content, error));
    }

    // ── Side channels ─────────────────────────────────────────────────────────

    private void onTokenBudget(JsonNode data) {
        JsonNode used = data.get("used");
        JsonNode total = data.get("total");
        if (used == null || total == null || !used.canConvertToInt() || !total.canConvertToInt()) {
            log.debug("token-budget without used/total");
            return;
        }
        TokenUsage usage = new TokenUsage(used.asInt(), total.asInt());
        state.setTokenUsage(usage);
        events.onTokenUsage(usage);
    }

    private void onPermissionRequest(JsonNode data) {
        ApprovalRequest request = ApprovalRequest.from(data, executor.currentTimeMillis());
        if (request == null) {
            log.warn("permission-request without requestId/toolName, dropped");
            return;
        }
        approvals.offer(request);
    }

    private void onSessionsUpdated(JsonNode data) {
        String projectName = text(data, "projectName");
        String sessionId = text(data, "sessionId");
        String action = text(data, "action");
        if (projectName == null || sessionId == null || action == null) {
            log.debug("sessions-updated missing projectName/sessionId/action");
            return;
        }
        events.onSessionsUpdated(new SessionsUpdate(projectName, sessionId, action));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
