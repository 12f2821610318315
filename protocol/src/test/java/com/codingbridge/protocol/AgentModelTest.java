package com.codingbridge.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentModelTest {

    @Test
    void classifiesFullModelIds() {
        assertEquals(AgentModel.SONNET, AgentModel.fromModelId("claude-sonnet-4-5-20250929"));
        assertEquals(AgentModel.OPUS, AgentModel.fromModelId("CLAUDE-OPUS-4-5"));
        assertEquals(AgentModel.HAIKU, AgentModel.fromModelId("claude-haiku-4-5"));
        assertEquals(AgentModel.CUSTOM, AgentModel.fromModelId("gpt-something"));
        assertEquals(AgentModel.CUSTOM, AgentModel.fromModelId(null));
    }

    @Test
    void customHasNoAlias() {
        assertNull(AgentModel.CUSTOM.alias);
        assertEquals("haiku", AgentModel.fromName(" haiku ").alias);
    }

    @Test
    void permissionModeWireNames() {
        assertEquals(PermissionMode.BYPASS_PERMISSIONS, PermissionMode.fromWire("bypassPermissions"));
        assertThrows(IllegalArgumentException.class, () -> PermissionMode.fromWire("yolo"));
    }
}
