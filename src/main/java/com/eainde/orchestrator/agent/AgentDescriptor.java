package com.eainde.orchestrator.agent;

import java.util.List;

/**
 * Capability listing of one registered agent.
 *
 * @param name           routing key
 * @param description    what the agent is for
 * @param tools          names of the tools it may call
 * @param handoffTargets agents it may transfer control to
 */
public record AgentDescriptor(String name, String description, List<String> tools, List<String> handoffTargets) {

    public AgentDescriptor {
        tools = tools != null ? List.copyOf(tools) : List.of();
        handoffTargets = handoffTargets != null ? List.copyOf(handoffTargets) : List.of();
    }
}
