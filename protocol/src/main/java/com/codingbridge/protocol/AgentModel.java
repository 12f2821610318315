package com.codingbridge.protocol;

import java.util.Locale;

/** Model presets the agent can be switched between. */
public enum AgentModel {
    OPUS   ("opus"),
    SONNET ("sonnet"),
    HAIKU  ("haiku"),
    CUSTOM (null);

    /** Alias accepted by the server's {@code /model} command; null for CUSTOM. */
    public final String alias;

    AgentModel(String alias) { this.alias = alias; }

    /** Classifies a full model id, e.g. "claude-sonnet-4-5-20250929" -> SONNET. */
    public static AgentModel fromModelId(String modelId) {
        if (modelId == null) return CUSTOM;
        String lower = modelId.toLowerCase(Locale.ROOT);
        if (lower.contains("opus"))   return OPUS;
        if (lower.contains("sonnet")) return SONNET;
        if (lower.contains("haiku"))  return HAIKU;
        return CUSTOM;
    }

    public static AgentModel fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
