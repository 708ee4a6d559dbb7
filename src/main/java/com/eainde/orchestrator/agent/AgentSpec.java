package com.eainde.orchestrator.agent;

import com.eainde.orchestrator.processor.Processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative specification of a processor-backed agent.
 * Turned into a {@link ProcessorAgent} by {@link AgentFactory}.
 *
 * <pre>
 * // Minimal
 * AgentSpec.of(AgentNames.JOB_SEARCH, "Searches job boards")
 *          .systemPrompt("You are a job search assistant")
 *          .build();
 *
 * // With tools, handoffs and a dedicated processor
 * AgentSpec.of(AgentNames.RESUME_CRITIC, "Reviews resumes")
 *          .systemPrompt(prompt)
 *          .tools(resumeParserTools)
 *          .handoffTo(AgentNames.RESUME_REWRITE, AgentNames.SKILL_HEATMAP)
 *          .processor(criticProcessor)
 *          .maxToolRounds(3)
 *          .build();
 * </pre>
 */
public class AgentSpec {

    // === Core identity ===
    private final String agentName;
    private final String description;
    private final String systemPrompt;

    // === Processor override (optional, defaults to the shared processor) ===
    private final Processor processor;

    // === Tools & handoffs ===
    private final List<Object> tools;
    private final List<String> handoffTargets;

    // === Tool loop behavior ===
    private final Integer maxToolRounds;

    private AgentSpec(Builder builder) {
        this.agentName = builder.agentName;
        this.description = builder.description;
        this.systemPrompt = builder.systemPrompt;
        this.processor = builder.processor;
        this.tools = List.copyOf(builder.tools);
        this.handoffTargets = List.copyOf(builder.handoffTargets);
        this.maxToolRounds = builder.maxToolRounds;
    }

    // === Factory ===

    public static Builder of(String agentName, String description) {
        return new Builder(agentName, description);
    }

    // === Getters ===

    public String getAgentName() { return agentName; }
    public String getDescription() { return description; }
    public String getSystemPrompt() { return systemPrompt; }

    public Processor getProcessor() { return processor; }
    public boolean hasProcessorOverride() { return processor != null; }

    public List<Object> getTools() { return tools; }
    public boolean hasTools() { return !tools.isEmpty(); }

    public List<String> getHandoffTargets() { return handoffTargets; }
    public boolean hasHandoffs() { return !handoffTargets.isEmpty(); }

    public Integer getMaxToolRounds() { return maxToolRounds; }
    public boolean hasMaxToolRounds() { return maxToolRounds != null; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(agentName);
        if (hasTools()) sb.append(" tools=").append(tools.size());
        if (hasHandoffs()) sb.append(" → ").append(String.join(",", handoffTargets));
        if (hasProcessorOverride()) sb.append(" +processor");
        if (hasMaxToolRounds()) sb.append(" maxToolRounds=").append(maxToolRounds);
        return sb.toString();
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final String agentName;
        private final String description;
        private String systemPrompt = "";

        private Processor processor;

        private final List<Object> tools = new ArrayList<>();
        private final List<String> handoffTargets = new ArrayList<>();

        private Integer maxToolRounds;

        private Builder(String agentName, String description) {
            this.agentName = agentName;
            this.description = description;
        }

        /** Instructions sent as the system message on every processor call. */
        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        /** Override the default processor for this specific agent. */
        public Builder processor(Processor processor) {
            this.processor = processor;
            return this;
        }

        /** Add @Tool-annotated instances this agent can invoke via function calling. */
        public Builder tools(Object... toolInstances) {
            Collections.addAll(this.tools, toolInstances);
            return this;
        }

        /** Agents this agent may transfer control to through {@code transfer_to_<name>}. */
        public Builder handoffTo(String... agentNames) {
            Collections.addAll(this.handoffTargets, agentNames);
            return this;
        }

        /**
         * Maximum number of tool round trips in one step.
         * The step fails when the processor still asks for tools after the last round.
         */
        public Builder maxToolRounds(int max) {
            this.maxToolRounds = max;
            return this;
        }

        public AgentSpec build() {
            if (agentName == null || agentName.isBlank()) {
                throw new IllegalArgumentException("agentName is required");
            }
            if (handoffTargets.stream().anyMatch(t -> t == null || t.isBlank())) {
                throw new IllegalArgumentException("Blank handoff target for agent: " + agentName);
            }
            if (maxToolRounds != null && maxToolRounds < 0) {
                throw new IllegalArgumentException("maxToolRounds must not be negative for agent: " + agentName);
            }
            return new AgentSpec(this);
        }
    }
}
