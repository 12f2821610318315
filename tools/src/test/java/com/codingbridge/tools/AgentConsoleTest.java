package com.codingbridge.tools;

import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/** Rendering of session events; the client itself is not needed for these. */
class AgentConsoleTest {

    private ByteArrayOutputStream buf;
    private AgentConsole console;

    @BeforeEach
    void setUp() {
        buf = new ByteArrayOutputStream();
        console = new AgentConsole(null, "/repo", new PrintStream(buf, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void cumulativeSnapshotsAreEchoedOnce() {
        console.onText("Hel");
        console.onText("Hello");
        console.onText("Hello, world");
        assertEquals("Hello, world", output());
    }

    @Test
    void commitStartsANewSegment() {
        console.onText("Reading");
        console.onTextCommit("Reading the file");
        console.onText("Done");
        assertEquals("Reading the file" + System.lineSeparator() + "Done", output());
    }

    @Test
    void errorResetsTheSegment() {
        console.onText("partial");
        console.onError(new SessionError(ErrorKind.SERVER, "boom"));
        console.onText("next");
        String out = output();
        assertTrue(out.contains("[error SERVER] boom"));
        assertTrue(out.endsWith("next"));
    }
}
