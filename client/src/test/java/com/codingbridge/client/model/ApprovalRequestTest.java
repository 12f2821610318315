package com.codingbridge.client.model;

import com.codingbridge.protocol.Frames;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalRequestTest {

    private static ApprovalRequest request(String json) throws Exception {
        JsonNode data = Frames.mapper().readTree(json);
        return ApprovalRequest.from(data, 42L);
    }

    @Test
    void requiresIdAndToolName() throws Exception {
        assertNull(request("{\"toolName\":\"Bash\"}"));
        assertNull(request("{\"requestId\":\"r1\"}"));
        assertNull(request("{\"requestId\":7,\"toolName\":\"Bash\"}"));

        ApprovalRequest r = request("{\"requestId\":\"r1\",\"toolName\":\"Bash\"}");
        assertEquals("r1", r.id());
        assertEquals(42L, r.receivedAt());
        assertEquals("Requesting permission...", r.description());
    }

    @Test
    void descriptionPrefersMostSpecificField() throws Exception {
        assertEquals("Review plan before execution",
                request("{\"requestId\":\"r\",\"toolName\":\"ExitPlanMode\",\"input\":{\"plan\":\"x\"}}").description());
        assertEquals("src/Main.java",
                request("{\"requestId\":\"r\",\"toolName\":\"Edit\",\"input\":{\"file_path\":\"src/Main.java\"}}").description());
        assertEquals("TODO",
                request("{\"requestId\":\"r\",\"toolName\":\"Grep\",\"input\":{\"pattern\":\"TODO\"}}").description());
    }

    @Test
    void longCommandsAreTruncated() throws Exception {
        String cmd = "x".repeat(100);
        String d = request("{\"requestId\":\"r\",\"toolName\":\"Bash\",\"input\":{\"command\":\"" + cmd + "\"}}")
                .description();

        assertEquals(83, d.length());
        assertTrue(d.endsWith("..."));
    }
}
