package com.codingbridge.client.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool call waiting for the user's allow/deny decision.
 *
 * @param receivedAt epoch millis on the session clock
 */
public record ApprovalRequest(String id, String toolName, JsonNode input, long receivedAt) {

    static final int MAX_COMMAND_PREVIEW = 80;

    /**
     * Parses {@code {requestId, toolName, input?}}.
     * @return null when either required field is missing
     */
    public static ApprovalRequest from(JsonNode data, long receivedAt) {
        if (data == null) return null;
        JsonNode id = data.get("requestId");
        JsonNode tool = data.get("toolName");
        if (id == null || !id.isTextual() || tool == null || !tool.isTextual()) return null;
        return new ApprovalRequest(id.asText(), tool.asText(), data.path("input"), receivedAt);
    }

    /** One-line human description of what is being approved. */
    public String description() {
        if ("ExitPlanMode".equals(toolName)) return "Review plan before execution";
        String command = textField("command");
        if (command != null) {
            return command.length() > MAX_COMMAND_PREVIEW
                    ? command.substring(0, MAX_COMMAND_PREVIEW) + "..."
                    : command;
        }
        for (String key : new String[] {"file_path", "pattern", "description"}) {
            String v = textField(key);
            if (v != null) return v;
        }
        return "Requesting permission...";
    }

    private String textField(String key) {
        JsonNode v = input == null ? null : input.get(key);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
