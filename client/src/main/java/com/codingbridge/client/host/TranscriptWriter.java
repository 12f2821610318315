package com.codingbridge.client.host;

/**
 * Write-only persistence of the conversation. The core never reads back;
 * implementations may batch or drop entries as they see fit.
 */
@FunctionalInterface
public interface TranscriptWriter {

    TranscriptWriter NONE = e -> {};

    void append(TranscriptEntry entry);
}
