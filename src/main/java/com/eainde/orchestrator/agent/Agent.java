package com.eainde.orchestrator.agent;

import com.eainde.orchestrator.state.StepOutcome;
import com.eainde.orchestrator.state.WorkflowState;

import java.util.List;

/**
 * A named processing node of the workflow graph.
 * <p>
 * The name is the routing key and the handoff target. {@link #process} receives a
 * snapshot of the shared state and reports everything it did through the returned
 * outcome; failures of its collaborators are returned as {@link StepOutcome.Fail}
 * rather than thrown.
 */
public interface Agent {

    String name();

    String description();

    StepOutcome process(WorkflowState state);

    default AgentDescriptor describe() {
        return new AgentDescriptor(name(), description(), List.of(), List.of());
    }
}
