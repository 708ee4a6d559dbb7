package com.eainde.orchestrator.edges;

import com.eainde.orchestrator.state.WorkflowState;
import com.eainde.orchestrator.workflow.RouteDecision;
import com.eainde.orchestrator.workflow.RunHandle;
import com.eainde.orchestrator.workflow.RunRegistry;
import com.eainde.orchestrator.workflow.WorkflowRouter;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Conditional edge leaving the start node and every agent node.
 * Returns the next agent's node name, or {@link RouteDecision#END}.
 */
@Log4j2
public class RoutingEdge implements AsyncEdgeAction<WorkflowState> {

    private final WorkflowRouter router;
    private final RunRegistry runs;

    public RoutingEdge(WorkflowRouter router, RunRegistry runs) {
        this.router = router;
        this.runs = runs;
    }

    @Override
    public CompletableFuture<String> apply(WorkflowState state) {
        Optional<RunHandle> handle = runs.find(state.getSessionId());
        boolean cancelRequested = handle.map(RunHandle::isCancelRequested).orElse(false);

        RouteDecision decision = router.decide(state, cancelRequested);
        handle.ifPresent(h -> h.recordDecision(decision));

        if (decision.isTerminal()) {
            log.info("Session {} ends after {} steps: {} {}", state.getSessionId(), state.getStepCount(),
                    decision.reason(), decision.message());
        } else {
            log.debug("Session {} routes to {}", state.getSessionId(), decision.nextAgent());
        }

        return CompletableFuture.completedFuture(decision.edgeKey());
    }
}
