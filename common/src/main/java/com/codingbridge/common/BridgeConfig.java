package com.codingbridge.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from codingbridge.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 */
public final class BridgeConfig implements ClientSettings {

    private static final Logger log = LoggerFactory.getLogger(BridgeConfig.class);

    // Server
    public String serverUrl = "http://localhost:3100";
    public String authToken = null;
    public String webSocketUrl = null;    // explicit override, wins over serverUrl
    public String wsPath = "/ws";

    // Session
    public volatile int processingTimeoutSecs = 300;
    public long textFlushMillis = 50;

    // Transport
    public int connectTimeoutMillis = 10_000;
    public int maxFrameBytes = 4 * 1024 * 1024;
    public int ioThreads = 1;

    // Persistence
    public String transcriptFile = null;

    public static BridgeConfig load(String path) {
        BridgeConfig cfg = new BridgeConfig();
        try {
            InputStream is = path != null && Files.exists(Paths.get(path))
                    ? Files.newInputStream(Paths.get(path))
                    : BridgeConfig.class.getResourceAsStream("/codingbridge.yml");
            if (is == null) return cfg;
            try (is) {
                Map<String, Object> map = new Yaml().load(is);
                if (map == null) return cfg;
                applyMap(cfg, map);
            }
        } catch (Exception e) {
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
        }
        return cfg;
    }

    private static void applyMap(BridgeConfig cfg, Map<String, Object> map) {
        if (map.containsKey("serverUrl")) cfg.serverUrl = (String) map.get("serverUrl");
        if (map.containsKey("authToken")) cfg.authToken = (String) map.get("authToken");
        if (map.containsKey("webSocketUrl")) cfg.webSocketUrl = (String) map.get("webSocketUrl");
        if (map.containsKey("wsPath")) cfg.wsPath = (String) map.get("wsPath");
        if (map.containsKey("processingTimeoutSecs")) cfg.processingTimeoutSecs = (int) map.get("processingTimeoutSecs");
        if (map.containsKey("textFlushMillis")) cfg.textFlushMillis = ((Number) map.get("textFlushMillis")).longValue();
        if (map.containsKey("connectTimeoutMillis")) cfg.connectTimeoutMillis = (int) map.get("connectTimeoutMillis");
        if (map.containsKey("maxFrameBytes")) cfg.maxFrameBytes = (int) map.get("maxFrameBytes");
        if (map.containsKey("ioThreads")) cfg.ioThreads = (int) map.get("ioThreads");
        if (map.containsKey("transcriptFile")) cfg.transcriptFile = (String) map.get("transcriptFile");
    }

    // ── ClientSettings ───────────────────────────────────────────────────────

    /**
     * Derives the WebSocket endpoint: the explicit override if set, otherwise
     * serverUrl with http→ws / https→wss, path = wsPath and ?token= when configured.
     */
    @Override
    public URI webSocketUri() {
        try {
            if (webSocketUrl != null && !webSocketUrl.isBlank()) {
                return new URI(webSocketUrl);
            }
            if (serverUrl == null || serverUrl.isBlank()) return null;
            URI base = new URI(serverUrl.trim());
            String scheme = base.getScheme();
            if (scheme == null || base.getHost() == null) return null;
            String wsScheme = switch (scheme.toLowerCase()) {
                case "https", "wss" -> "wss";
                case "http", "ws"   -> "ws";
                default -> null;
            };
            if (wsScheme == null) return null;
            String query = authToken != null && !authToken.isEmpty()
                    ? "token=" + URLEncoder.encode(authToken, StandardCharsets.UTF_8)
                    : null;
            // Build the raw form so the already-encoded token is not encoded twice
            StringBuilder sb = new StringBuilder()
                    .append(wsScheme).append("://").append(base.getHost());
            if (base.getPort() != -1) sb.append(':').append(base.getPort());
            sb.append(wsPath.startsWith("/") ? wsPath : "/" + wsPath);
            if (query != null) sb.append('?').append(query);
            return new URI(sb.toString());
        } catch (Exception e) {
            log.warn("Invalid server URL '{}': {}", serverUrl, e.getMessage());
            return null;
        }
    }

    @Override
    public int processingTimeoutSecs() {
        return processingTimeoutSecs;
    }

    @Override
    public long textFlushMillis() {
        return textFlushMillis;
    }
}
