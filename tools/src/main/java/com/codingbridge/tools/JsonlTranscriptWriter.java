package com.codingbridge.tools;

import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.client.host.TranscriptWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends transcript entries to a file, one JSON object per line:
 * {@code {"ts":..., "kind":"ASSISTANT", "sessionId":"...", "text":"..."}}.
 */
public final class JsonlTranscriptWriter implements TranscriptWriter, AutoCloseable {

    private final ObjectMapper   mapper = new ObjectMapper();
    private final BufferedWriter out;

    public JsonlTranscriptWriter(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized void append(TranscriptEntry entry) {
        ObjectNode line = mapper.createObjectNode();
        line.put("ts", entry.timestamp());
        line.put("kind", entry.kind().name());
        if (entry.sessionId() != null) line.put("sessionId", entry.sessionId());
        line.put("text", entry.text());
        try {
            out.write(mapper.writeValueAsString(line));
            out.newLine();
            out.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize transcript entry", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        out.close();
    }
}
