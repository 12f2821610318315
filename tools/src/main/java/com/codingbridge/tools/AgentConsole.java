package com.codingbridge.tools;

import com.codingbridge.client.AgentSessionClient;
import com.codingbridge.client.ConnectionState;
import com.codingbridge.client.SessionListener;
import com.codingbridge.client.host.NotificationSink;
import com.codingbridge.client.host.TranscriptWriter;
import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.QuestionRequest;
import com.codingbridge.client.model.SessionError;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.client.model.ToolInvocation;
import com.codingbridge.client.model.ToolResult;
import com.codingbridge.client.transport.NettyWebSocketTransport;
import com.codingbridge.common.BridgeConfig;
import com.codingbridge.protocol.AgentModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/**
 * Interactive terminal front end for an agent session.
 *
 * Usage: AgentConsole [config.yml] [projectPath]
 *
 * Type a prompt to send it. Control commands:
 *   /approve /always /deny   answer a pending tool approval
 *   /abort                   interrupt the running turn
 *   /clear                   start a fresh session on the next prompt
 *   /model opus|sonnet|haiku|&lt;model-id&gt;
 *   /attach &lt;sessionId&gt;       resume an existing session
 *   /status                  print connection and session state
 *   /quit
 */
public final class AgentConsole implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(AgentConsole.class);

    private final AgentSessionClient client;
    private final String             projectPath;
    private final PrintStream        out;

    private int printed;          // chars of the current text segment already echoed
    private int turns;
    private int errors;

    AgentConsole(AgentSessionClient client, String projectPath, PrintStream out) {
        this.client      = client;
        this.projectPath = projectPath;
        this.out         = out;
    }

    public static void main(String[] args) throws Exception {
        String configPath  = args.length > 0 ? args[0] : "codingbridge.yml";
        String projectPath = args.length > 1 ? args[1] : Paths.get("").toAbsolutePath().toString();

        BridgeConfig cfg = BridgeConfig.load(configPath);
        TranscriptWriter transcript = cfg.transcriptFile != null
                ? new JsonlTranscriptWriter(Paths.get(cfg.transcriptFile))
                : TranscriptWriter.NONE;

        try (NettyWebSocketTransport transport = new NettyWebSocketTransport(cfg)) {
            PrintStream out = System.out;
            NotificationSink sink = n -> out.printf("%n[%s] %s%n", n.title(), n.body());
            AgentSessionClient client = AgentSessionClient.builder(cfg, transport)
                    .transcript(transcript)
                    .notifications(sink)
                    .build();

            AgentConsole console = new AgentConsole(client, projectPath, out);
            client.addListener(console);
            log.info("Connecting to {} (project {})", cfg.webSocketUri(), projectPath);
            client.connect();

            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                console.run(in);
            }

            client.turnLatency().logAndReset(log);
            console.printResults();
            client.close();
        } finally {
            if (transcript instanceof AutoCloseable c) c.close();
        }
    }

    void run(BufferedReader in) throws IOException {
        String line;
        do {
            line = in.readLine();
        } while (dispatch(ConsoleCommand.parse(line)));
    }

    /** Applies one command; false once the console should exit. */
    boolean dispatch(ConsoleCommand cmd) {
        switch (cmd.kind()) {
            case EMPTY   -> { }
            case PROMPT  -> client.submit(cmd.arg(), projectPath);
            case APPROVE -> client.approvePending(false);
            case ALWAYS  -> client.approvePending(true);
            case DENY    -> client.denyPending();
            case ABORT   -> client.abortSession();
            case CLEAR   -> client.clearSession();
            case ATTACH  -> client.attachToSession(cmd.arg(), projectPath);
            case MODEL   -> switchModel(cmd.arg());
            case STATUS  -> out.printf("%s | %s%n", client.connectionState().displayText(), client.state());
            case QUIT    -> { return false; }
        }
        return true;
    }

    private void switchModel(String arg) {
        AgentModel model;
        try {
            model = AgentModel.fromName(arg);
        } catch (IllegalArgumentException e) {
            model = AgentModel.CUSTOM;
        }
        client.switchModel(model, model == AgentModel.CUSTOM ? arg : null, projectPath);
    }

    void printResults() {
        out.printf("%n=== Agent Console Results ===%n");
        out.printf("Turns:       %d%n", turns);
        out.printf("Errors:      %d%n", errors);
        out.printf("Turn p50:    %d ms%n", client.turnLatency().percentile(50));
        out.printf("Turn p99:    %d ms%n", client.turnLatency().percentile(99));
    }

    // ── SessionListener ──────────────────────────────────────────────────────

    @Override
    public void onConnectionStateChanged(ConnectionState state) {
        out.printf("%n[%s]%n", state.displayText());
    }

    @Override
    public void onSessionCreated(String sessionId) {
        log.debug("Session bound: {}", sessionId);
    }

    @Override
    public void onText(String text) {
        if (text.length() < printed) printed = 0;
        out.print(text.substring(printed));
        printed = text.length();
        out.flush();
    }

    @Override
    public void onTextCommit(String text) {
        if (text.length() > printed) out.print(text.substring(printed));
        out.println();
        printed = 0;
    }

    @Override
    public void onToolUse(ToolInvocation tool) {
        out.printf("  > %s(%s)%n", tool.name(), tool.summary());
    }

    @Override
    public void onToolResult(ToolResult result) {
        String content = result.content() == null ? "" : result.content();
        String head = content.length() > 200 ? content.substring(0, 200) + "..." : content;
        out.printf("  %s %s%n", result.error() ? "x" : "<", head.replace('\n', ' '));
    }

    @Override
    public void onThinking(String thinking) {
        log.debug("thinking: {}", thinking);
    }

    @Override
    public void onQuestion(QuestionRequest question) {
        for (QuestionRequest.Question q : question.questions()) {
            out.printf("%n? %s%n", q.question());
            for (QuestionRequest.Option o : q.options()) {
                out.printf("    - %s%s%n", o.label(), o.description() == null ? "" : ": " + o.description());
            }
        }
    }

    @Override
    public void onComplete(String sessionId) {
        turns++;
        out.println();
        out.printf("[done%s]%n", sessionId == null ? "" : " " + sessionId);
        printed = 0;
    }

    @Override
    public void onError(SessionError error) {
        errors++;
        printed = 0;
        out.printf("%n[error %s] %s%n", error.kind(), error.message());
    }

    @Override
    public void onSessionRecovered() {
        out.printf("%n[session expired, next prompt starts fresh]%n");
    }

    @Override
    public void onSessionAttached() {
        out.printf("[attached]%n");
    }

    @Override
    public void onAborted() {
        printed = 0;
        out.printf("%n[aborted]%n");
    }

    @Override
    public void onApprovalRequest(ApprovalRequest request) {
        out.printf("%n[approval] %s: %s  (/approve, /always, /deny)%n", request.toolName(), request.description());
    }

    @Override
    public void onModelChanged(AgentModel model, String modelId) {
        out.printf("[model %s%s]%n", model, modelId == null ? "" : " " + modelId);
    }

    @Override
    public void onTokenUsage(TokenUsage usage) {
        log.debug("Context {}/{} ({}%)", usage.used(), usage.total(), Math.round(usage.fraction() * 100));
    }
}
