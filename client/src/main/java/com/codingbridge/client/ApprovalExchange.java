package com.codingbridge.client;

import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.protocol.Frames;
import com.codingbridge.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Permission requests: at most one outstanding, answered once.
 *
 * A request arriving while another is pending is dropped. The pending request
 * is cleared as soon as the answer is issued, whether or not the write succeeds.
 */
final class ApprovalExchange {

    private static final Logger log = LoggerFactory.getLogger(ApprovalExchange.class);

    private final SessionState         state;
    private final SessionEvents        events;
    private final ConnectionSupervisor supervisor;
    private final BackgroundNotifier   notifier;

    ApprovalExchange(SessionState state, SessionEvents events,
                     ConnectionSupervisor supervisor, BackgroundNotifier notifier) {
        this.state      = state;
        this.events     = events;
        this.supervisor = supervisor;
        this.notifier   = notifier;
    }

    void offer(ApprovalRequest request) {
        ApprovalRequest pending = state.pendingApproval();
        if (pending != null) {
            log.warn("Dropping approval request {} for {}: {} still pending",
                    request.id(), request.toolName(), pending.id());
            return;
        }
        log.info("Approval requested for {} ({})", request.toolName(), request.id());
        state.setPendingApproval(request);
        notifier.approvalNeeded(request);
        events.onApprovalRequest(request);
    }

    void respond(String requestId, boolean allow, boolean alwaysAllow) {
        state.setPendingApproval(null);
        String json;
        try {
            json = Frames.approvalResponse(requestId, allow, alwaysAllow);
        } catch (ProtocolException e) {
            log.error("Cannot encode approval response for {}: {}", requestId, e.getMessage());
            state.setLastError("Failed to send permission response");
            return;
        }
        log.info("Answering approval {}: allow={} always={}", requestId, allow, alwaysAllow);
        supervisor.send(json, failure -> {
            if (failure != null) {
                log.error("Approval response for {} not delivered: {}", requestId, failure.toString());
                state.setLastError("Failed to send permission response");
            }
        });
    }

    boolean approvePending(boolean alwaysAllow) {
        return answerPending(true, alwaysAllow);
    }

    boolean denyPending() {
        return answerPending(false, false);
    }

    void clear() {
        state.setPendingApproval(null);
    }

    private boolean answerPending(boolean allow, boolean alwaysAllow) {
        ApprovalRequest pending = state.pendingApproval();
        if (pending == null) {
            log.warn("No approval request pending");
            return false;
        }
        respond(pending.id(), allow, alwaysAllow);
        return true;
    }
}
