package com.eainde.orchestrator.execution;

import com.eainde.orchestrator.state.ChatEntry;
import com.eainde.orchestrator.workflow.TerminationReason;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one workflow run.
 * <p>
 * {@code error} holds the error kind code (for example {@code ErrorBudgetExceeded}) and is
 * {@code null} for successful runs; {@code errorMessage} is the human readable explanation.
 */
@Value
@Builder
public class ExecutionReport {
    boolean success;
    String error;
    String errorMessage;
    TerminationReason terminationReason;

    String workflowType;
    String sessionId;
    Long userId;

    Instant startTime;
    Instant endTime;
    long durationMs;

    int errorCount;
    int stepCount;
    long totalTokensUsed;

    @Singular List<String> executedAgents;
    @Singular List<String> completedAgents;
    @Singular List<String> skippedAgents;

    /** Artifacts of each agent, keyed by agent name then artifact name. */
    @Singular Map<String, Map<String, JsonNode>> agentResults;

    @Singular("transcriptEntry") List<ChatEntry> transcript;
}
