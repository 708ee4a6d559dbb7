package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.agent.AgentDescriptor;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.error.SubmissionException;
import com.eainde.orchestrator.execution.ChatHistoryRecord;
import com.eainde.orchestrator.execution.ChatHistorySink;
import com.eainde.orchestrator.execution.ExecutionReport;
import com.eainde.orchestrator.nodes.AgentNode;
import com.eainde.orchestrator.state.ChatEntry;
import com.eainde.orchestrator.state.MessageRole;
import com.eainde.orchestrator.state.WorkflowState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The entry point for running workflows.
 * <p>
 * Acts as a facade over the compiled langgraph4j graph: it validates submissions, builds the
 * initial state, tracks each run so it can be cancelled or polled, and turns the final state
 * into an {@link ExecutionReport}.
 *
 * <h3>Errors</h3>
 * <ul>
 * <li>Invalid submissions are rejected with {@link SubmissionException} before any state exists.</li>
 * <li>Agent failures never escape; they show up in the transcript and the error count.</li>
 * <li>Budget, handoff and cancellation stops, as well as unexpected engine errors, produce a failed report.</li>
 * </ul>
 */
@Log4j2
public class WorkflowCoordinator {

    public static final String COORDINATOR = "coordinator";

    private final CompiledGraph<WorkflowState> graph;
    private final WorkflowCatalog catalog;
    private final AgentRegistry registry;
    private final RunRegistry runs;
    private final ChatHistorySink historySink;
    private final ObjectMapper objectMapper;
    private final Executor submitExecutor;
    private final Clock clock;

    public WorkflowCoordinator(CompiledGraph<WorkflowState> graph,
                               WorkflowCatalog catalog,
                               AgentRegistry registry,
                               RunRegistry runs,
                               ChatHistorySink historySink,
                               ObjectMapper objectMapper,
                               Executor submitExecutor,
                               Clock clock) {
        this.graph = graph;
        this.catalog = catalog;
        this.registry = registry;
        this.runs = runs;
        this.historySink = historySink;
        this.objectMapper = objectMapper;
        this.submitExecutor = submitExecutor;
        this.clock = clock;
    }

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param workflowType workflow type value or name, e.g. {@code job_search}
     * @param userInput    caller payload, must be a non-empty object
     * @param userId       owner of the run
     * @param sessionId    correlation id, generated when {@code null} or blank
     * @return the report of the finished run, successful or not
     * @throws SubmissionException if the submission is invalid or the session is already running
     */
    public ExecutionReport execute(String workflowType, ObjectNode userInput, Long userId, String sessionId) {
        return run(prepare(workflowType, userInput, userId, sessionId));
    }

    public ExecutionReport execute(String workflowType, Map<String, Object> userInput, Long userId, String sessionId) {
        return execute(workflowType, toObjectNode(userInput), userId, sessionId);
    }

    /**
     * Validates the submission synchronously, then runs the workflow in the background.
     *
     * @throws SubmissionException if the submission is invalid or the session is already running
     */
    public CompletableFuture<ExecutionReport> submit(String workflowType, ObjectNode userInput, Long userId, String sessionId) {
        PreparedRun prepared = prepare(workflowType, userInput, userId, sessionId);
        return CompletableFuture.supplyAsync(() -> run(prepared), submitExecutor);
    }

    /**
     * Requests cooperative cancellation; the run stops at its next routing decision.
     *
     * @return {@code true} if a running workflow was found for the session
     */
    public boolean cancel(String sessionId) {
        boolean cancelled = runs.find(sessionId).map(RunHandle::requestCancel).orElse(false);
        log.info("Cancel requested for session {}: {}", sessionId, cancelled ? "accepted" : "no running workflow");
        return cancelled;
    }

    public WorkflowStatus status(String sessionId) {
        return runs.find(sessionId)
                .map(RunHandle::snapshot)
                .orElseGet(() -> WorkflowStatus.notFound(sessionId, clock.instant()));
    }

    public List<WorkflowDefinition> availableWorkflows() {
        return catalog.definitions();
    }

    public List<AgentDescriptor> agentCapabilities() {
        return registry.descriptors();
    }

    private PreparedRun prepare(String workflowType, ObjectNode userInput, Long userId, String sessionId) {
        WorkflowType type = WorkflowType.fromValue(workflowType);
        WorkflowDefinition definition = catalog.get(type);
        if (userInput == null || userInput.isEmpty()) {
            throw new SubmissionException("User input must be a non-empty object");
        }
        if (userId == null) {
            throw new SubmissionException("User id is required");
        }
        String resolvedSession = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;

        RunHandle handle = runs.register(new RunHandle(resolvedSession, definition, clock));
        Instant startedAt = clock.instant();
        Map<String, Object> initialData = WorkflowState.initialData(
                resolvedSession, userId, type.value(), userInput.deepCopy(), startedAt);
        return new PreparedRun(handle, definition, initialData, startedAt);
    }

    private ExecutionReport run(PreparedRun prepared) {
        RunHandle handle = prepared.handle();
        try (MDC.MDCCloseable session = MDC.putCloseable(AgentNode.MDC_SESSION_ID, handle.sessionId())) {
            log.info("Starting workflow {} for session {}", prepared.definition().type(), handle.sessionId());

            WorkflowState finalState;
            RouteDecision decision;
            try {
                RunnableConfig config = RunnableConfig.builder()
                        .threadId(handle.sessionId())
                        .build();
                finalState = graph.invoke(prepared.initialData(), config)
                        .orElseThrow(() -> new IllegalStateException("Graph returned no final state"));
                decision = handle.lastDecision();
                if (decision == null || !decision.isTerminal()) {
                    throw new IllegalStateException("Graph ended without a terminal routing decision");
                }
            } catch (Exception e) {
                log.error("Workflow engine failure for session {}", handle.sessionId(), e);
                finalState = new WorkflowState(handle.lastState().orElse(prepared.initialData()));
                decision = RouteDecision.terminate(TerminationReason.INTERNAL_ERROR,
                        "Internal workflow error: " + e.getClass().getSimpleName());
            }

            runs.finished(handle, decision.reason());
            ExecutionReport report = report(prepared, finalState, decision);
            log.info("Workflow {} for session {} finished: success={}, steps={}, errors={}",
                    report.getWorkflowType(), report.getSessionId(), report.isSuccess(),
                    report.getStepCount(), report.getErrorCount());
            return report;
        }
    }

    private ExecutionReport report(PreparedRun prepared, WorkflowState state, RouteDecision decision) {
        Instant endTime = clock.instant();
        TerminationReason reason = decision.reason();

        List<ChatEntry> transcript = new ArrayList<>(state.getMessages());
        if (!reason.succeeded()) {
            ChatEntry notice = new ChatEntry(MessageRole.SYSTEM, COORDINATOR, decision.message(), endTime);
            transcript.add(notice);
            emit(ChatHistoryRecord.of(state.getSessionId(), state.getUserId(), notice));
        }

        return ExecutionReport.builder()
                .success(reason.succeeded())
                .error(reason.succeeded() ? null : reason.errorKind().code())
                .errorMessage(reason.succeeded() ? null : decision.message())
                .terminationReason(reason)
                .workflowType(state.getWorkflowType())
                .sessionId(state.getSessionId())
                .userId(state.getUserId())
                .startTime(prepared.startedAt())
                .endTime(endTime)
                .durationMs(Duration.between(prepared.startedAt(), endTime).toMillis())
                .errorCount(state.getErrorCount())
                .stepCount(state.getStepCount())
                .totalTokensUsed(state.getTokensUsed())
                .executedAgents(state.getExecutedAgents())
                .completedAgents(state.getCompletedAgents())
                .skippedAgents(prepared.definition().skippedAgents(state))
                .agentResults(state.getScratch())
                .transcript(transcript)
                .build();
    }

    private void emit(ChatHistoryRecord record) {
        try {
            historySink.append(record);
        } catch (RuntimeException e) {
            log.error("Failed to store chat history for session {}", record.sessionId(), e);
        }
    }

    private ObjectNode toObjectNode(Map<String, Object> userInput) {
        if (userInput == null) {
            return null;
        }
        try {
            return objectMapper.valueToTree(userInput);
        } catch (IllegalArgumentException e) {
            throw new SubmissionException("User input is not serializable: " + e.getMessage());
        }
    }

    private record PreparedRun(RunHandle handle,
                               WorkflowDefinition definition,
                               Map<String, Object> initialData,
                               Instant startedAt) {
    }
}
