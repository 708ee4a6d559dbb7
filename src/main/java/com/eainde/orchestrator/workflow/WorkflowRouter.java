package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.state.HandoffRequest;
import com.eainde.orchestrator.state.WorkflowState;

import java.util.Optional;

/**
 * Chooses what happens after each step.
 * <p>
 * {@link #decide} is a pure function of the state snapshot and the cancellation flag,
 * evaluated in this order, first match wins:
 * <ol>
 *   <li>cancellation requested: stop, cancelled</li>
 *   <li>error count above the ceiling: stop, error budget exceeded</li>
 *   <li>pending handoff to an unregistered agent: stop, unknown handoff target</li>
 *   <li>pending handoff: run its target</li>
 *   <li>workflow complete, or no agent left on the static route: stop, completed</li>
 *   <li>otherwise the static route</li>
 * </ol>
 * Whenever an agent is selected but the step count already reached the ceiling,
 * the run stops with step budget exceeded instead.
 */
public class WorkflowRouter {

    private final WorkflowCatalog catalog;
    private final AgentRegistry registry;
    private final int maxErrors;
    private final int maxSteps;

    public WorkflowRouter(WorkflowCatalog catalog, AgentRegistry registry, int maxErrors, int maxSteps) {
        this.catalog = catalog;
        this.registry = registry;
        this.maxErrors = maxErrors;
        this.maxSteps = maxSteps;
    }

    public RouteDecision decide(WorkflowState state, boolean cancelRequested) {
        if (cancelRequested) {
            return RouteDecision.terminate(TerminationReason.CANCELLED, "Workflow was cancelled");
        }
        if (state.getErrorCount() > maxErrors) {
            return RouteDecision.terminate(TerminationReason.ERROR_BUDGET_EXCEEDED,
                    "Too many errors: " + state.getErrorCount() + " (ceiling " + maxErrors + ")");
        }

        Optional<HandoffRequest> handoff = state.pendingHandoff();
        if (handoff.isPresent()) {
            String target = handoff.get().targetAgent();
            if (!registry.contains(target)) {
                return RouteDecision.terminate(TerminationReason.UNKNOWN_HANDOFF_TARGET,
                        "Handoff to unknown agent: " + target);
            }
            return withinStepBudget(state, target);
        }

        WorkflowDefinition definition = catalog.get(WorkflowType.fromValue(state.getWorkflowType()));
        if (definition.isComplete(state)) {
            return RouteDecision.complete("Workflow " + definition.type() + " completed");
        }
        return definition.nextAgent(state)
                .map(agent -> withinStepBudget(state, agent))
                .orElseGet(() -> RouteDecision.complete("No agent left to run for workflow " + definition.type()));
    }

    private RouteDecision withinStepBudget(WorkflowState state, String agent) {
        if (state.getStepCount() >= maxSteps) {
            return RouteDecision.terminate(TerminationReason.STEP_BUDGET_EXCEEDED,
                    "Step limit of " + maxSteps + " reached before running " + agent);
        }
        return RouteDecision.goTo(agent);
    }

    public int maxSteps() {
        return maxSteps;
    }

    public int maxErrors() {
        return maxErrors;
    }
}
