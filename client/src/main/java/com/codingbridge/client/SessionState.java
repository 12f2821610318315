package com.codingbridge.client;

import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.TokenUsage;
import com.codingbridge.protocol.AgentModel;

/**
 * Observable session state.
 *
 * Fields are written only on the session executor by the components in this
 * package; readers on other threads (UI) see them through volatile reads.
 */
public final class SessionState {

    // Turn
    private volatile boolean processing;
    private volatile boolean aborting;
    private volatile boolean reattaching;
    private volatile String  currentText = "";
    private volatile String  lastActiveToolName;
    private volatile String  lastError;

    // Session binding
    private volatile String sessionId;

    // Interaction
    private volatile ApprovalRequest pendingApproval;
    private volatile boolean         switchingModel;
    private volatile AgentModel      currentModel;
    private volatile String          currentModelId;
    private volatile TokenUsage      tokenUsage;

    SessionState() {}

    public boolean isProcessing()          { return processing; }
    public boolean isAborting()            { return aborting; }
    public boolean isReattaching()         { return reattaching; }
    public String currentText()            { return currentText; }
    public String lastActiveToolName()     { return lastActiveToolName; }
    public String lastError()              { return lastError; }
    public String sessionId()              { return sessionId; }
    public ApprovalRequest pendingApproval() { return pendingApproval; }
    public boolean isSwitchingModel()      { return switchingModel; }
    public AgentModel currentModel()       { return currentModel; }
    public String currentModelId()         { return currentModelId; }
    public TokenUsage tokenUsage()         { return tokenUsage; }

    void setProcessing(boolean v)               { processing = v; }
    void setAborting(boolean v)                 { aborting = v; }
    void setReattaching(boolean v)              { reattaching = v; }
    void setCurrentText(String v)               { currentText = v == null ? "" : v; }
    void setLastActiveToolName(String v)        { lastActiveToolName = v; }
    void setLastError(String v)                 { lastError = v; }
    void setSessionId(String v)                 { sessionId = v; }
    void setPendingApproval(ApprovalRequest v)  { pendingApproval = v; }
    void setSwitchingModel(boolean v)           { switchingModel = v; }
    void setTokenUsage(TokenUsage v)            { tokenUsage = v; }

    void setCurrentModel(AgentModel model, String modelId) {
        currentModel   = model;
        currentModelId = modelId;
    }

    @Override
    public String toString() {
        return "SessionState{processing=" + processing
                + ", aborting=" + aborting
                + ", reattaching=" + reattaching
                + ", sessionId=" + sessionId
                + ", lastActiveTool=" + lastActiveToolName
                + ", lastError=" + lastError + '}';
    }
}
