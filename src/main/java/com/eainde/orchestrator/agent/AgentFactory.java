package com.eainde.orchestrator.agent;

import com.eainde.orchestrator.handoff.HandoffTools;
import com.eainde.orchestrator.processor.Processor;
import com.eainde.orchestrator.processor.ToolFanOut;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds {@link ProcessorAgent}s from {@link AgentSpec} definitions.
 *
 * Centralizes agent construction:
 *   - Uses the shared Processor unless the spec overrides it
 *   - Collects @Tool methods and runs them on the shared tool executor
 *   - Exposes handoff tools for the spec's handoff targets
 *
 * Usage in config:
 *   Agent critic = agentFactory.create(criticSpec);
 *   AgentRegistry registry = agentFactory.registry(searchSpec, criticSpec);
 */
@Log4j2
public class AgentFactory {

    private final Processor defaultProcessor;
    private final HandoffTools handoffTools;
    private final ObjectMapper objectMapper;
    private final Executor toolExecutor;
    private final int defaultMaxToolRounds;

    public AgentFactory(Processor defaultProcessor,
                        HandoffTools handoffTools,
                        ObjectMapper objectMapper,
                        Executor toolExecutor,
                        int defaultMaxToolRounds) {
        this.defaultProcessor = defaultProcessor;
        this.handoffTools = handoffTools;
        this.objectMapper = objectMapper;
        this.toolExecutor = toolExecutor;
        this.defaultMaxToolRounds = defaultMaxToolRounds;
    }

    public ProcessorAgent create(AgentSpec spec) {
        log.debug("Building agent: {}", spec);

        Processor processor = spec.hasProcessorOverride() ? spec.getProcessor() : defaultProcessor;
        ToolFanOut tools = spec.hasTools()
                ? ToolFanOut.of(spec.getTools(), toolExecutor)
                : ToolFanOut.none(toolExecutor);
        int maxToolRounds = spec.hasMaxToolRounds() ? spec.getMaxToolRounds() : defaultMaxToolRounds;

        return new ProcessorAgent(
                spec.getAgentName(),
                spec.getDescription(),
                spec.getSystemPrompt(),
                processor,
                tools,
                spec.getHandoffTargets(),
                handoffTools,
                objectMapper,
                maxToolRounds);
    }

    public List<ProcessorAgent> createAll(AgentSpec... specs) {
        return Arrays.stream(specs)
                .map(this::create)
                .toList();
    }

    /**
     * Builds every spec and registers the agents.
     * Handoff targets must name agents of the same registry.
     */
    public AgentRegistry registry(AgentSpec... specs) {
        AgentRegistry registry = AgentRegistry.of(createAll(specs));
        for (AgentSpec spec : specs) {
            for (String target : spec.getHandoffTargets()) {
                if (!registry.contains(target)) {
                    throw new IllegalArgumentException(
                            "Agent " + spec.getAgentName() + " hands off to unregistered agent: " + target);
                }
            }
        }
        return registry;
    }
}
