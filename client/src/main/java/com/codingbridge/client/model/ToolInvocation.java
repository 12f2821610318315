package com.codingbridge.client.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * A {@code tool_use} block from the assistant stream.
 *
 * @param id      tool-use block id, null when absent
 * @param name    tool name, "tool" when absent
 * @param input   raw input object (MissingNode when absent)
 * @param summary "key: value, ..." rendering of the input for one-line display
 */
public record ToolInvocation(String id, String name, JsonNode input, String summary) {

    public static ToolInvocation of(String id, String name, JsonNode input) {
        return new ToolInvocation(id, name, input, summarize(input));
    }

    public static String summarize(JsonNode input) {
        if (input == null || !input.isObject() || input.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        Iterator<Map.Entry<String, JsonNode>> it = input.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (sb.length() > 0) sb.append(", ");
            JsonNode v = e.getValue();
            sb.append(e.getKey()).append(": ").append(v.isValueNode() ? v.asText() : v.toString());
        }
        return sb.toString();
    }
}
