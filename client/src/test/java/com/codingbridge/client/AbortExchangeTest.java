package com.codingbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.codingbridge.client.SessionHarness.REPO;
import static com.codingbridge.client.SessionHarness.SID;
import static com.codingbridge.client.SessionHarness.json;
import static org.junit.jupiter.api.Assertions.*;

class AbortExchangeTest {

    private SessionHarness h;
    private FakeTransport.FakeConnection c;

    @BeforeEach
    void setUp() {
        h = new SessionHarness();
        c = h.connect();
        h.sessionCreated(SID);
        h.client.submit("long running job", REPO);
        h.client.submit("queued behind it", REPO);
        h.deliver("""
                {"type":"permission-request","data":{"requestId":"req-1","toolName":"Bash"}}
                """);
    }

    // -----------------------------------------------------------------------
    // Test 1: server confirmation resets everything once
    // -----------------------------------------------------------------------
    @Test
    void serverConfirmationResets() {
        h.client.abortSession();

        JsonNode frame = json(c.lastSent());
        assertEquals("abort-session", frame.get("type").asText());
        assertEquals(SID, frame.get("sessionId").asText());
        assertEquals("claude", frame.get("provider").asText());
        assertTrue(h.state().isAborting());

        h.deliver("{\"type\":\"session-aborted\",\"sessionId\":\"" + SID + "\"}");

        assertEquals(1, h.rec.count("aborted"));
        assertFalse(h.state().isAborting());
        assertFalse(h.state().isProcessing());
        assertNull(h.state().pendingApproval());
        assertEquals(0, h.client.queue().size(), "Queued commands discarded");
        assertEquals(SID, h.state().sessionId(), "Session stays bound");

        h.exec.advance(10_000);
        assertEquals(1, h.rec.count("aborted"), "Timer cancelled");
    }

    // -----------------------------------------------------------------------
    // Test 2: no confirmation within 3s forces the reset; late confirmation ignored
    // -----------------------------------------------------------------------
    @Test
    void timeoutForcesReset() {
        h.client.abortSession();
        h.exec.advance(2_999);
        assertTrue(h.state().isAborting());

        h.exec.advance(1);
        assertFalse(h.state().isAborting());
        assertEquals(1, h.rec.count("aborted"));

        h.deliver("{\"type\":\"session-aborted\"}");
        assertEquals(1, h.rec.count("aborted"));
    }

    // -----------------------------------------------------------------------
    // Test 3: a second abort while one is pending sends nothing
    // -----------------------------------------------------------------------
    @Test
    void repeatedAbortIgnored() {
        h.client.abortSession();
        int sent = c.sent.size();

        h.client.abortSession();

        assertEquals(sent, c.sent.size());
    }

    // -----------------------------------------------------------------------
    // Test 4: write failure resets immediately
    // -----------------------------------------------------------------------
    @Test
    void writeFailureResets() {
        c.failWrites = new IOException("broken pipe");

        h.client.abortSession();

        assertFalse(h.state().isAborting());
        assertEquals(1, h.rec.count("aborted"));
    }

    // -----------------------------------------------------------------------
    // Test 5: nothing to abort on the server without a bound session
    // -----------------------------------------------------------------------
    @Test
    void noSessionResetsLocally() {
        h.client.clearSession();
        int sent = c.sent.size();

        h.client.abortSession();

        assertEquals(sent, c.sent.size());
        assertFalse(h.state().isProcessing());
        assertEquals(1, h.rec.count("aborted"));
    }
}
