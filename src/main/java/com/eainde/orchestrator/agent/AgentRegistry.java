package com.eainde.orchestrator.agent;

import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name to agent lookup table, built once at startup and shared by all runs.
 */
@Log4j2
public final class AgentRegistry {

    private final Map<String, Agent> agents;

    private AgentRegistry(Map<String, Agent> agents) {
        this.agents = agents;
    }

    public static AgentRegistry of(Agent... agents) {
        return of(List.of(agents));
    }

    public static AgentRegistry of(Collection<? extends Agent> agents) {
        Map<String, Agent> byName = new LinkedHashMap<>();
        for (Agent agent : agents) {
            String name = agent.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Agent name must not be blank: " + agent.getClass().getName());
            }
            if (byName.putIfAbsent(name, agent) != null) {
                throw new IllegalArgumentException("Duplicate agent name: " + name);
            }
        }
        log.info("Registered {} agents: {}", byName.size(), byName.keySet());
        return new AgentRegistry(Collections.unmodifiableMap(byName));
    }

    public boolean contains(String name) {
        return name != null && agents.containsKey(name);
    }

    public Optional<Agent> find(String name) {
        return Optional.ofNullable(name).map(agents::get);
    }

    public Agent get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("No agent registered with name: " + name));
    }

    /** Registered names in registration order. */
    public Set<String> names() {
        return agents.keySet();
    }

    public List<AgentDescriptor> descriptors() {
        return agents.values().stream().map(Agent::describe).toList();
    }
}
