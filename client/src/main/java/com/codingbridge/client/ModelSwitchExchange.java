package com.codingbridge.client;

import com.codingbridge.client.exec.ScheduledTask;
import com.codingbridge.client.exec.SerialExecutor;
import com.codingbridge.protocol.AgentModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Switches the agent model by queueing {@code /model <alias>} and watching the
 * reply for {@code Set model to <alias> (<model-id>)}. The switch starts when
 * the command is written, so turns still ahead of it in the queue are not read
 * as its reply. Without a confirmation within 5 s the switching flag is dropped.
 */
final class ModelSwitchExchange {

    private static final Logger log = LoggerFactory.getLogger(ModelSwitchExchange.class);

    static final long   SWITCH_TIMEOUT_MILLIS = 5_000;
    static final String CONFIRMATION_MARKER   = "Set model to";

    private final SerialExecutor executor;
    private final SessionState   state;
    private final SessionEvents  events;
    private final OutboundQueue  queue;

    private ScheduledTask  timeoutTask;
    private PendingCommand switchCommand;   // queued, not yet written

    ModelSwitchExchange(SerialExecutor executor, SessionState state, SessionEvents events, OutboundQueue queue) {
        this.executor = executor;
        this.state    = state;
        this.events   = events;
        this.queue    = queue;
    }

    boolean switchModel(AgentModel model, String customId, String projectPath) {
        String arg;
        if (model == AgentModel.CUSTOM) {
            arg = customId != null && !customId.isBlank() ? customId.trim() : null;
        } else {
            arg = model.alias;
        }
        if (arg == null) {
            log.error("Cannot switch to {} without a model id", model);
            return false;
        }

        log.info("Switching model to {}", arg);
        switchCommand = PendingCommand.builder("/model " + arg, projectPath).build();
        queue.submit(switchCommand);
        return true;
    }

    /** Called for every command the queue has written. */
    void onCommandSent(PendingCommand command) {
        if (command != switchCommand) return;
        switchCommand = null;
        String arg = command.command();
        state.setSwitchingModel(true);
        timeoutTask = ScheduledTask.cancel(timeoutTask);
        timeoutTask = executor.schedule(() -> {
            timeoutTask = null;
            if (state.isSwitchingModel()) {
                log.warn("{} not confirmed", arg);
                state.setSwitchingModel(false);
            }
        }, SWITCH_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    /** Streamed text block; may carry the confirmation. */
    void onText(String text) {
        if (state.isSwitchingModel() && text.contains(CONFIRMATION_MARKER)) confirm(text);
    }

    void onTurnCompleted(String finalText) {
        if (!state.isSwitchingModel()) return;
        if (finalText != null && finalText.contains(CONFIRMATION_MARKER)) {
            confirm(finalText);
        } else {
            log.warn("Model switch reply had no confirmation");
            cancel();
        }
    }

    void cancel() {
        timeoutTask = ScheduledTask.cancel(timeoutTask);
        state.setSwitchingModel(false);
    }

    private void confirm(String text) {
        cancel();
        int open = text.indexOf('(', text.indexOf(CONFIRMATION_MARKER));
        int close = open < 0 ? -1 : text.indexOf(')', open);
        if (close <= open + 1) {
            log.warn("Unparseable model confirmation: {}", text);
            return;
        }
        String modelId = text.substring(open + 1, close).trim();
        AgentModel model = AgentModel.fromModelId(modelId);
        log.info("Model is now {} ({})", model, modelId);
        state.setCurrentModel(model, modelId);
        events.onModelChanged(model, modelId);
    }
}
