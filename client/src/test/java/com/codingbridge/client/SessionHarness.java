package com.codingbridge.client;

import com.codingbridge.client.exec.ManualSerialExecutor;
import com.codingbridge.client.host.Notification;
import com.codingbridge.client.host.TranscriptEntry;
import com.codingbridge.common.BridgeConfig;
import com.codingbridge.protocol.Frames;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** A client wired to a virtual clock and a scripted transport. */
final class SessionHarness {

    static final String SID   = "3f2b8c1e-9a4d-4e7b-8c2a-1d5e6f7a8b9c";
    static final String SID_2 = "7c1d2e3f-4a5b-4c6d-8e9f-0a1b2c3d4e5f";
    static final String REPO  = "/home/dev/repo";

    final ManualSerialExecutor exec      = new ManualSerialExecutor();
    final FakeTransport        transport = new FakeTransport();
    final BridgeConfig         cfg       = new BridgeConfig();
    final RecordingListener    rec       = new RecordingListener();
    final List<Notification>   notifications = new ArrayList<>();
    final List<TranscriptEntry> transcript   = new ArrayList<>();
    boolean foreground = true;
    final AgentSessionClient   client;

    SessionHarness() {
        client = AgentSessionClient.builder(cfg, transport)
                .executor(exec)
                .reconnectPolicy(new ReconnectPolicy(() -> 0))
                .notifications(notifications::add)
                .presence(() -> foreground)
                .transcript(transcript::add)
                .build();
        client.addListener(rec);
    }

    /** Connects and answers the liveness probe. */
    FakeTransport.FakeConnection connect() {
        client.connect();
        FakeTransport.FakeConnection c = transport.last();
        c.pong();
        return c;
    }

    FakeTransport.FakeConnection conn() {
        return transport.last();
    }

    SessionState state() {
        return client.state();
    }

    void deliver(String json) {
        conn().deliver(json);
    }

    void sessionCreated(String sid) {
        deliver("{\"type\":\"session-created\",\"sessionId\":\"" + sid + "\"}");
    }

    void complete(String sid) {
        deliver(sid == null
                ? "{\"type\":\"claude-complete\"}"
                : "{\"type\":\"claude-complete\",\"sessionId\":\"" + sid + "\"}");
    }

    /** {@code claude-response} carrying an assistant message with the given content blocks (JSON array text). */
    void assistant(String contentArray) {
        deliver("{\"type\":\"claude-response\",\"data\":{\"type\":\"assistant\",\"message\":{\"content\":"
                + contentArray + "}}}");
    }

    void assistantText(String text) {
        assistant("[{\"type\":\"text\",\"text\":\"" + text + "\"}]");
    }

    static JsonNode json(String text) {
        try {
            return Frames.mapper().readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
