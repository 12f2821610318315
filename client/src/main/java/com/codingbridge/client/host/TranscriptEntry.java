package com.codingbridge.client.host;

/**
 * One line of the conversation as it should be persisted.
 *
 * @param sessionId bound session at the time of writing, may be null
 * @param timestamp epoch millis
 */
public record TranscriptEntry(Kind kind, String sessionId, String text, long timestamp) {

    public enum Kind {
        USER,
        ASSISTANT,
        TOOL_USE,
        TOOL_RESULT,
        THINKING,
        QUESTION,
        ERROR
    }
}
