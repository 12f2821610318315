package com.codingbridge.client;

import com.codingbridge.client.host.Notification;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.model.ErrorKind;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.protocol.AgentModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codingbridge.client.SessionHarness.REPO;
import static com.codingbridge.client.SessionHarness.SID;
import static org.junit.jupiter.api.Assertions.*;

class StreamAssemblerTest {

    private SessionHarness h;

    @BeforeEach
    void setUp() {
        h = new SessionHarness();
        h.connect();
        h.client.submit("look around", REPO);
    }

    // -----------------------------------------------------------------------
    // Test 1: text committed before the tool that follows it
    // -----------------------------------------------------------------------
    @Test
    void textCommitPrecedesToolUse() {
        h.assistant("""
                [{"type":"text","text":"Let me check the files."},
                 {"type":"tool_use","id":"toolu_1","name":"Bash","input":{"command":"ls -la"}}]
                """);

        List<String> order = h.rec.without("text:");
        assertEquals(List.of("text-commit:Let me check the files.", "tool-use:Bash"), order);
        assertEquals("", h.state().currentText(), "New segment starts empty");
        assertEquals("Bash", h.state().lastActiveToolName());

        ToolInvocation tool = h.rec.tools.get(0);
        assertEquals("toolu_1", tool.id());
        assertEquals("command: ls -la", tool.summary());
        assertEquals("ls -la", tool.input().get("command").asText());
    }

    // -----------------------------------------------------------------------
    // Test 2: streamed text is published after a quiet period, cumulatively
    // -----------------------------------------------------------------------
    @Test
    void textIsDebouncedAndCumulative() {
        h.assistantText("Hello");
        h.exec.advance(20);
        h.assistantText(", world");
        assertEquals(0, h.rec.count("text:"));

        h.exec.advance(49);
        assertEquals(0, h.rec.count("text:"), "Window restarts on each delta");
        h.exec.advance(1);

        assertEquals(List.of("text:Hello, world"), h.rec.events);
        assertEquals("Hello, world", h.state().currentText());
    }

    // -----------------------------------------------------------------------
    // Test 3: completion flushes, binds the session and ends the turn
    // -----------------------------------------------------------------------
    @Test
    void completeFlushesAndBindsSession() {
        h.assistantText("Done.");
        h.complete(SID);

        assertEquals(List.of("text:Done.", "complete:" + SID), h.rec.events);
        assertFalse(h.state().isProcessing());
        assertNull(h.state().lastActiveToolName());
        assertEquals(SID, h.state().sessionId());
        assertEquals("Done.", h.state().currentText(), "Final text stays visible");
        assertEquals(1, h.client.turnLatency().count());
        assertTrue(h.transcript.stream().anyMatch(
                e -> e.kind() == TranscriptEntry.Kind.ASSISTANT && e.text().equals("Done.")));
    }

    // -----------------------------------------------------------------------
    // Test 4: system/init binds a session when none is bound and records the model
    // -----------------------------------------------------------------------
    @Test
    void systemInitBindsSessionAndModel() {
        h.deliver("""
                {"type":"claude-response","data":{"type":"system","subtype":"init",
                 "session_id":"%s","model":"claude-opus-4-1-20250805"}}
                """.formatted(SID));

        assertEquals(SID, h.state().sessionId());
        assertEquals(AgentModel.OPUS, h.state().currentModel());
        assertEquals("claude-opus-4-1-20250805", h.state().currentModelId());
        assertEquals(List.of("session-created:" + SID), h.rec.events);
    }

    // -----------------------------------------------------------------------
    // Test 5: tool results in user echoes, as a string or as text parts
    // -----------------------------------------------------------------------
    @Test
    void toolResultsFromUserEcho() {
        h.deliver("""
                {"type":"claude-response","data":{"type":"user","content":[
                  {"type":"tool_result","tool_use_id":"toolu_1","content":"total 8"},
                  {"type":"tool_result","tool_use_id":"toolu_2","content":[{"type":"text","text":"line a"},{"type":"text","text":"line b"}]}
                ]}}
                """);

        assertEquals(List.of("tool-result:total 8", "tool-result:line a", "tool-result:line b"), h.rec.events);
    }

    // -----------------------------------------------------------------------
    // Test 6: thinking blocks and plain string content
    // -----------------------------------------------------------------------
    @Test
    void thinkingAndStringContent() {
        h.deliver("""
                {"type":"claude-response","data":{"role":"assistant","content":[{"type":"thinking","thinking":"Plan first"}]}}
                """);
        h.deliver("""
                {"type":"claude-response","data":{"content":"plain"}}
                """);
        h.exec.advance(50);

        assertEquals(List.of("thinking:Plan first", "text:plain"), h.rec.events);
    }

    // -----------------------------------------------------------------------
    // Test 7: AskUserQuestion becomes a question, unparseable input a tool event
    // -----------------------------------------------------------------------
    @Test
    void askUserQuestionIsExtracted() {
        h.foreground = false;
        h.assistant("""
                [{"type":"tool_use","id":"toolu_q","name":"AskUserQuestion","input":{"questions":[
                  {"question":"Which database?","header":"DB","multiSelect":false,
                   "options":[{"label":"Postgres","description":"relational"},{"label":"Redis"}]}]}}]
                """);

        QuestionRequest q = h.rec.questions.get(0);
        assertEquals("toolu_q", q.requestId());
        assertEquals("Which database?", q.questions().get(0).question());
        assertEquals(2, q.questions().get(0).options().size());
        assertNull(q.questions().get(0).options().get(1).description());
        assertEquals(Notification.Kind.QUESTION_ASKED, h.notifications.get(0).kind());

        h.assistant("""
                [{"type":"tool_use","id":"toolu_r","name":"AskUserQuestion","input":{"questions":"nope"}}]
                """);
        assertEquals("tool-use:AskUserQuestion", h.rec.events.get(h.rec.events.size() - 1));
    }

    // -----------------------------------------------------------------------
    // Test 8: server says the session is gone → unbind silently and start fresh
    // -----------------------------------------------------------------------
    @Test
    void invalidSessionErrorRecovers() {
        h.sessionCreated(SID);
        h.rec.events.clear();

        h.deliver("""
                {"type":"claude-error","error":"No conversation found with session ID abc"}
                """);

        assertNull(h.state().sessionId());
        assertEquals("Session expired, starting fresh...", h.state().lastError());
        assertEquals(List.of("session-recovered"), h.rec.events);
        assertTrue(h.rec.errors.isEmpty());
        assertFalse(h.state().isProcessing());
    }

    // -----------------------------------------------------------------------
    // Test 9: structured code decides over the message text
    // -----------------------------------------------------------------------
    @Test
    void structuredCodeIsAuthoritative() {
        h.sessionCreated(SID);

        h.deliver("""
                {"type":"claude-error","error":"Too many session requests","code":"RATE_LIMITED"}
                """);

        assertEquals(SID, h.state().sessionId());
        assertEquals(ErrorKind.SERVER, h.rec.errors.get(0).kind());
        assertEquals("Too many session requests", h.state().lastError());
    }

    // -----------------------------------------------------------------------
    // Test 10: ordinary error flushes text, surfaces, and advances the queue
    // -----------------------------------------------------------------------
    @Test
    void serverErrorEndsTurnAndAdvancesQueue() {
        h.client.submit("next", REPO);
        h.assistantText("partial");

        h.deliver("""
                {"type":"claude-error","error":"Tool crashed"}
                """);

        assertEquals(List.of("text:partial", "error:SERVER"), h.rec.events);
        assertEquals("", h.state().currentText());
        assertTrue(h.state().isProcessing(), "Next command already in flight");
        assertEquals("next", SessionHarness.json(h.conn().lastSent()).get("command").asText());
    }

    // -----------------------------------------------------------------------
    // Test 11: side channels
    // -----------------------------------------------------------------------
    @Test
    void sideChannelsAreForwarded() {
        h.deliver("{\"type\":\"token-budget\",\"data\":{\"used\":42,\"total\":100}}");
        h.deliver("{\"type\":\"token-budget\",\"data\":{\"used\":50,\"total\":100}}");
        h.deliver("{\"type\":\"sessions-updated\",\"data\":{\"projectName\":\"repo\",\"sessionId\":\"s1\",\"action\":\"created\"}}");
        h.deliver("{\"type\":\"sessions-updated\",\"data\":{\"projectName\":\"repo\"}}");
        h.deliver("{\"type\":\"projects_updated\"}");
        h.deliver("{\"type\":\"brand-new-thing\",\"data\":{}}");

        assertEquals(List.of("tokens:42/100", "tokens:50/100", "sessions-updated:created", "projects-updated"),
                h.rec.events);
        assertEquals(50, h.state().tokenUsage().used());
    }

    // -----------------------------------------------------------------------
    // Test 12: completion notification only while backgrounded
    // -----------------------------------------------------------------------
    @Test
    void completionNotifiesOnlyInBackground() {
        h.complete(SID);
        assertTrue(h.notifications.isEmpty());

        h.client.submit("again", REPO);
        h.foreground = false;
        h.complete(SID);

        assertEquals(1, h.notifications.size());
        assertEquals("Task Complete", h.notifications.get(0).title());
    }
}
