package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.state.WorkflowState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One catalog entry: the agents a workflow needs, in order, and when it counts as complete.
 * <p>
 * The static route is "first required agent that has neither completed nor been skipped";
 * the entry agent is the first required agent.
 *
 * @param type                workflow type this entry governs
 * @param displayName         name shown to users
 * @param description         what the workflow does
 * @param estimatedDuration   rough duration shown to users
 * @param requiredAgents      agents that must finish, in execution order
 * @param completionPolicy    treatment of agents that keep failing
 * @param maxAttemptsPerAgent failures after which {@link CompletionPolicy#BEST_EFFORT} skips an agent
 */
public record WorkflowDefinition(
        WorkflowType type,
        String displayName,
        String description,
        String estimatedDuration,
        List<String> requiredAgents,
        CompletionPolicy completionPolicy,
        int maxAttemptsPerAgent
) {

    public WorkflowDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(completionPolicy, "completionPolicy");
        if (requiredAgents == null || requiredAgents.isEmpty()) {
            throw new IllegalArgumentException("Workflow " + type + " needs at least one agent");
        }
        requiredAgents = List.copyOf(requiredAgents);
        if (maxAttemptsPerAgent < 1) {
            throw new IllegalArgumentException("maxAttemptsPerAgent must be positive for workflow " + type);
        }
    }

    public String entryAgent() {
        return requiredAgents.get(0);
    }

    public boolean isSkipped(WorkflowState state, String agentName) {
        return completionPolicy == CompletionPolicy.BEST_EFFORT
                && !state.hasCompleted(agentName)
                && state.getFailureCount(agentName) >= maxAttemptsPerAgent;
    }

    public List<String> skippedAgents(WorkflowState state) {
        return requiredAgents.stream().filter(agent -> isSkipped(state, agent)).toList();
    }

    public boolean isComplete(WorkflowState state) {
        return requiredAgents.stream().allMatch(agent -> state.hasCompleted(agent) || isSkipped(state, agent));
    }

    /**
     * Static route: the next required agent still to run, empty when there is none.
     */
    public Optional<String> nextAgent(WorkflowState state) {
        return requiredAgents.stream()
                .filter(agent -> !state.hasCompleted(agent) && !isSkipped(state, agent))
                .findFirst();
    }

    /** Percentage of required agents that are done (completed or skipped). */
    public int progress(WorkflowState state) {
        long done = requiredAgents.stream()
                .filter(agent -> state.hasCompleted(agent) || isSkipped(state, agent))
                .count();
        return (int) (done * 100 / requiredAgents.size());
    }
}
