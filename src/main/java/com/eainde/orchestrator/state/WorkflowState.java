package com.eainde.orchestrator.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared state threaded through every agent step of one run.
 * <p>
 * Backed by the langgraph4j state map; every value stored here is
 * {@link java.io.Serializable} because the graph runtime clones the map between steps.
 * Nodes never write to this object: they return an update computed by {@link StateReducer}.
 */
public class WorkflowState extends AgentState {

    // Identity, set once
    public static final String SESSION_ID = "sessionId";
    public static final String USER_ID = "userId";
    public static final String WORKFLOW_TYPE = "workflowType";
    public static final String USER_INPUT = "userInput";
    public static final String STARTED_AT = "startedAt";

    // Transcript
    public static final String MESSAGES = "messages";

    // Routing
    public static final String CURRENT_AGENT = "currentAgent";
    public static final String NEXT_AGENT = "nextAgent";
    public static final String HANDOFF_REASON = "handoffReason";
    public static final String COMPLETED_AGENTS = "completedAgents";
    public static final String EXECUTED_AGENTS = "executedAgents";

    // Budgets
    public static final String ERROR_COUNT = "errorCount";
    public static final String AGENT_FAILURES = "agentFailures";
    public static final String STEP_COUNT = "stepCount";
    public static final String TOKENS_USED = "tokensUsed";

    // Agent artifacts
    public static final String SCRATCH = "scratch";

    public WorkflowState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Builds the initial data map of a run: identity fields plus empty collections.
     */
    public static Map<String, Object> initialData(String sessionId,
                                                  Long userId,
                                                  String workflowType,
                                                  ObjectNode userInput,
                                                  Instant startedAt) {
        Map<String, Object> data = new HashMap<>();
        data.put(SESSION_ID, sessionId);
        data.put(USER_ID, userId);
        data.put(WORKFLOW_TYPE, workflowType);
        data.put(USER_INPUT, userInput);
        data.put(STARTED_AT, startedAt);
        data.put(MESSAGES, new ArrayList<ChatEntry>());
        data.put(CURRENT_AGENT, "");
        data.put(NEXT_AGENT, "");
        data.put(HANDOFF_REASON, "");
        data.put(COMPLETED_AGENTS, new ArrayList<String>());
        data.put(EXECUTED_AGENTS, new ArrayList<String>());
        data.put(ERROR_COUNT, 0);
        data.put(AGENT_FAILURES, new LinkedHashMap<String, Integer>());
        data.put(STEP_COUNT, 0);
        data.put(TOKENS_USED, 0L);
        data.put(SCRATCH, new LinkedHashMap<String, Map<String, JsonNode>>());
        return data;
    }

    public String getSessionId() {
        return (String) data().get(SESSION_ID);
    }

    public Long getUserId() {
        return (Long) data().get(USER_ID);
    }

    public String getWorkflowType() {
        return (String) data().get(WORKFLOW_TYPE);
    }

    public ObjectNode getUserInput() {
        return (ObjectNode) data().get(USER_INPUT);
    }

    public Instant getStartedAt() {
        return (Instant) data().get(STARTED_AT);
    }

    @SuppressWarnings("unchecked")
    public List<ChatEntry> getMessages() {
        List<ChatEntry> messages = (List<ChatEntry>) data().get(MESSAGES);
        return messages != null ? Collections.unmodifiableList(messages) : List.of();
    }

    public Optional<String> getCurrentAgent() {
        return nonEmpty(CURRENT_AGENT);
    }

    public Optional<String> getNextAgent() {
        return nonEmpty(NEXT_AGENT);
    }

    /**
     * The handoff declared by the last executed step, if any.
     */
    public Optional<HandoffRequest> pendingHandoff() {
        return getNextAgent().map(target -> new HandoffRequest(target, (String) data().get(HANDOFF_REASON)));
    }

    @SuppressWarnings("unchecked")
    public List<String> getCompletedAgents() {
        List<String> completed = (List<String>) data().get(COMPLETED_AGENTS);
        return completed != null ? Collections.unmodifiableList(completed) : List.of();
    }

    public boolean hasCompleted(String agentName) {
        return getCompletedAgents().contains(agentName);
    }

    @SuppressWarnings("unchecked")
    public List<String> getExecutedAgents() {
        List<String> executed = (List<String>) data().get(EXECUTED_AGENTS);
        return executed != null ? Collections.unmodifiableList(executed) : List.of();
    }

    public int getErrorCount() {
        return intValue(ERROR_COUNT);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Integer> getAgentFailures() {
        Map<String, Integer> failures = (Map<String, Integer>) data().get(AGENT_FAILURES);
        return failures != null ? Collections.unmodifiableMap(failures) : Map.of();
    }

    public int getFailureCount(String agentName) {
        return getAgentFailures().getOrDefault(agentName, 0);
    }

    public int getStepCount() {
        return intValue(STEP_COUNT);
    }

    public long getTokensUsed() {
        Object value = data().get(TOKENS_USED);
        return value instanceof Number number ? number.longValue() : 0L;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Map<String, JsonNode>> getScratch() {
        Map<String, Map<String, JsonNode>> scratch = (Map<String, Map<String, JsonNode>>) data().get(SCRATCH);
        return scratch != null ? Collections.unmodifiableMap(scratch) : Map.of();
    }

    /**
     * Artifacts written by one agent, empty when it produced none.
     */
    public Map<String, JsonNode> getArtifacts(String agentName) {
        return getScratch().getOrDefault(agentName, Map.of());
    }

    private int intValue(String key) {
        Object value = data().get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }

    private Optional<String> nonEmpty(String key) {
        Object value = data().get(key);
        return value instanceof String s && !s.isEmpty() ? Optional.of(s) : Optional.empty();
    }
}
