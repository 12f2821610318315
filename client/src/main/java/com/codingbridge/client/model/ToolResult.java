package com.codingbridge.client.model;

/** Output of a tool invocation; {@code toolUseId} may be null when the server omits it. */
public record ToolResult(String toolUseId, String content, boolean error) {}
