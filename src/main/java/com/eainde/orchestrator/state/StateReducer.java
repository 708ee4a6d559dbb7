package com.eainde.orchestrator.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the outcome of one agent step into a state snapshot.
 * <p>
 * The reducer is a pure function of its inputs (plus the clock used to stamp the
 * entries it creates itself). It never mutates the snapshot; it returns the complete
 * new value of every key it touches, ready to be handed back to the graph runtime.
 */
public class StateReducer {

    private final Clock clock;

    public StateReducer(Clock clock) {
        this.clock = clock;
    }

    public StateReducer() {
        this(Clock.systemUTC());
    }

    /**
     * New values produced by one step.
     *
     * @param values   state keys to overwrite with their new complete values
     * @param appended transcript entries added by this step, in order
     */
    public record StateUpdate(Map<String, Object> values, List<ChatEntry> appended) {
        public StateUpdate {
            values = Map.copyOf(values);
            appended = List.copyOf(appended);
        }
    }

    public StateUpdate apply(WorkflowState snapshot, String agentName, StepOutcome outcome) {
        StateDelta delta = outcome.delta();
        List<ChatEntry> appended = new ArrayList<>(delta.messages());

        if (outcome instanceof StepOutcome.Fail fail && appended.isEmpty()) {
            appended.add(new ChatEntry(MessageRole.ASSISTANT, agentName,
                    failureMessage(agentName, fail.error()), clock.instant()));
        }
        if (outcome instanceof StepOutcome.Handoff handoff) {
            appended.add(new ChatEntry(MessageRole.TOOL, agentName,
                    handoffMarker(handoff.request()), clock.instant()));
        }

        List<ChatEntry> messages = new ArrayList<>(snapshot.getMessages());
        messages.addAll(appended);

        List<String> executed = new ArrayList<>(snapshot.getExecutedAgents());
        executed.add(agentName);

        List<String> completed = new ArrayList<>(snapshot.getCompletedAgents());
        if (outcome.succeeded() && !completed.contains(agentName)) {
            completed.add(agentName);
        }

        int errorCount = snapshot.getErrorCount();
        Map<String, Integer> failures = new LinkedHashMap<>(snapshot.getAgentFailures());
        if (!outcome.succeeded()) {
            errorCount++;
            failures.merge(agentName, 1, Integer::sum);
        }

        Map<String, Map<String, JsonNode>> scratch = new LinkedHashMap<>();
        snapshot.getScratch().forEach((agent, artifacts) -> scratch.put(agent, new LinkedHashMap<>(artifacts)));
        if (!delta.artifacts().isEmpty()) {
            scratch.computeIfAbsent(agentName, k -> new LinkedHashMap<>()).putAll(delta.artifacts());
        }

        String nextAgent = "";
        String handoffReason = "";
        if (outcome instanceof StepOutcome.Handoff handoff) {
            nextAgent = handoff.request().targetAgent();
            handoffReason = handoff.request().reason();
        }

        Map<String, Object> values = new HashMap<>();
        values.put(WorkflowState.MESSAGES, messages);
        values.put(WorkflowState.CURRENT_AGENT, agentName);
        values.put(WorkflowState.NEXT_AGENT, nextAgent);
        values.put(WorkflowState.HANDOFF_REASON, handoffReason);
        values.put(WorkflowState.EXECUTED_AGENTS, executed);
        values.put(WorkflowState.COMPLETED_AGENTS, completed);
        values.put(WorkflowState.ERROR_COUNT, errorCount);
        values.put(WorkflowState.AGENT_FAILURES, failures);
        values.put(WorkflowState.STEP_COUNT, snapshot.getStepCount() + 1);
        values.put(WorkflowState.TOKENS_USED, snapshot.getTokensUsed() + Math.max(0L, delta.tokensUsed()));
        values.put(WorkflowState.SCRATCH, scratch);
        return new StateUpdate(values, appended);
    }

    /**
     * User-visible text recorded when an agent step fails.
     */
    public static String failureMessage(String agentName, String error) {
        return "Sorry, " + agentName + " encountered an error: " + error;
    }

    static String handoffMarker(HandoffRequest request) {
        return request.reason().isEmpty()
                ? request.toolName()
                : request.toolName() + ": " + request.reason();
    }
}
