package com.eainde.orchestrator.nodes;

import com.eainde.orchestrator.agent.Agent;
import com.eainde.orchestrator.execution.ChatHistoryRecord;
import com.eainde.orchestrator.execution.ChatHistorySink;
import com.eainde.orchestrator.state.ChatEntry;
import com.eainde.orchestrator.state.StateDelta;
import com.eainde.orchestrator.state.StateReducer;
import com.eainde.orchestrator.state.StepOutcome;
import com.eainde.orchestrator.state.WorkflowState;
import com.eainde.orchestrator.workflow.RunHandle;
import com.eainde.orchestrator.workflow.RunRegistry;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Graph node executing one agent step.
 * <p>
 * The agent runs on the step executor with an upper time bound. A timeout or an exception
 * escaping the agent becomes a failed outcome, so the node always completes normally and
 * the run carries on to the next routing decision.
 */
@Log4j2
public class AgentNode implements AsyncNodeAction<WorkflowState> {

    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_AGENT = "agent";

    private final Agent agent;
    private final StateReducer reducer;
    private final Executor stepExecutor;
    private final Duration stepTimeout;
    private final RunRegistry runs;
    private final ChatHistorySink historySink;

    public AgentNode(Agent agent,
                     StateReducer reducer,
                     Executor stepExecutor,
                     Duration stepTimeout,
                     RunRegistry runs,
                     ChatHistorySink historySink) {
        this.agent = agent;
        this.reducer = reducer;
        this.stepExecutor = stepExecutor;
        this.stepTimeout = stepTimeout;
        this.runs = runs;
        this.historySink = historySink;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(WorkflowState state) {
        String agentName = agent.name();
        Optional<RunHandle> handle = runs.find(state.getSessionId());
        handle.ifPresent(h -> h.recordStep(agentName, h.definition().progress(state)));

        try (MDC.MDCCloseable session = MDC.putCloseable(MDC_SESSION_ID, state.getSessionId());
             MDC.MDCCloseable agentCtx = MDC.putCloseable(MDC_AGENT, agentName)) {
            log.info("Executing step {} with agent {}", state.getStepCount() + 1, agentName);

            return CompletableFuture
                    .supplyAsync(() -> agent.process(state), stepExecutor)
                    .orTimeout(stepTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(this::toFailure)
                    .thenApply(outcome -> merge(state, outcome, handle));
        }
    }

    private StepOutcome toFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.warn("Agent {} timed out after {}", agent.name(), stepTimeout);
            return StepOutcome.fail(StateDelta.empty(), "timed out after " + stepTimeout.toMillis() + "ms");
        }
        log.error("Agent {} threw instead of reporting a failure", agent.name(), cause);
        return StepOutcome.fail(StateDelta.empty(), cause);
    }

    private Map<String, Object> merge(WorkflowState state, StepOutcome outcome, Optional<RunHandle> handle) {
        StateReducer.StateUpdate update = reducer.apply(state, agent.name(), outcome);
        if (outcome instanceof StepOutcome.Fail fail) {
            log.warn("Agent {} failed: {}", agent.name(), fail.error());
        }

        for (ChatEntry entry : update.appended()) {
            emit(ChatHistoryRecord.of(state.getSessionId(), state.getUserId(), entry));
        }

        handle.ifPresent(h -> {
            Map<String, Object> merged = new HashMap<>(state.data());
            merged.putAll(update.values());
            h.recordState(merged);
            h.recordStep(agent.name(), h.definition().progress(new WorkflowState(merged)));
        });
        return update.values();
    }

    private void emit(ChatHistoryRecord record) {
        try {
            historySink.append(record);
        } catch (RuntimeException e) {
            log.error("Failed to store chat history for session {}", record.sessionId(), e);
        }
    }
}
