package com.eainde.orchestrator.support;

import com.eainde.orchestrator.agent.Agent;
import com.eainde.orchestrator.agent.AgentNames;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.config.EngineSettings;
import com.eainde.orchestrator.execution.ChatHistorySink;
import com.eainde.orchestrator.execution.InMemoryChatHistorySink;
import com.eainde.orchestrator.state.StateReducer;
import com.eainde.orchestrator.state.WorkflowState;
import com.eainde.orchestrator.thread.MdcAwareExecutor;
import com.eainde.orchestrator.workflow.RunRegistry;
import com.eainde.orchestrator.workflow.WorkflowCatalog;
import com.eainde.orchestrator.workflow.WorkflowCoordinator;
import com.eainde.orchestrator.workflow.WorkflowGraphFactory;
import com.eainde.orchestrator.workflow.WorkflowRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires a coordinator the same way the Spring configuration does, with stub agents.
 * Agents not given explicitly are registered as always-succeeding stubs.
 */
public class TestEngine implements AutoCloseable {

    private final MdcAwareExecutor stepExecutor;
    private final MdcAwareExecutor submitExecutor;
    private final InMemoryChatHistorySink history = new InMemoryChatHistorySink();
    private final RunRegistry runs;
    private final AgentRegistry registry;
    private final CompiledGraph<WorkflowState> graph;
    private final WorkflowCoordinator coordinator;

    public TestEngine(EngineSettings settings, Agent... agents) throws GraphStateException {
        this(settings, null, null, agents);
    }

    public TestEngine(EngineSettings settings, WorkflowCatalog catalog, ChatHistorySink sink, Agent... agents)
            throws GraphStateException {
        Map<String, Agent> byName = new LinkedHashMap<>();
        for (String name : List.of(AgentNames.JOB_SEARCH, AgentNames.RESUME_CRITIC,
                AgentNames.SKILL_HEATMAP, AgentNames.RESUME_REWRITE)) {
            byName.put(name, StubAgent.succeeding(name));
        }
        for (Agent agent : agents) {
            byName.put(agent.name(), agent);
        }

        this.stepExecutor = new MdcAwareExecutor("test-step", settings.stepThreads());
        this.submitExecutor = new MdcAwareExecutor("test-run", settings.stepThreads());
        this.runs = new RunRegistry(settings.retainedRuns());
        this.registry = AgentRegistry.of(byName.values());

        WorkflowCatalog resolvedCatalog = catalog != null
                ? catalog
                : WorkflowCatalog.standard(settings.completionPolicy(), settings.maxAttemptsPerAgent());
        ChatHistorySink resolvedSink = sink != null ? sink : history;
        WorkflowRouter router = new WorkflowRouter(resolvedCatalog, registry, settings.maxErrors(), settings.maxSteps());
        this.graph = new WorkflowGraphFactory(registry, resolvedCatalog, router, runs,
                new StateReducer(), stepExecutor, settings.stepTimeout(), resolvedSink).build();

        this.coordinator = new WorkflowCoordinator(graph, resolvedCatalog, registry, runs, resolvedSink,
                new ObjectMapper(), submitExecutor, Clock.systemUTC());
    }

    public WorkflowCoordinator coordinator() {
        return coordinator;
    }

    public CompiledGraph<WorkflowState> graph() {
        return graph;
    }

    public InMemoryChatHistorySink history() {
        return history;
    }

    public RunRegistry runs() {
        return runs;
    }

    public AgentRegistry registry() {
        return registry;
    }

    @Override
    public void close() throws InterruptedException {
        stepExecutor.close();
        submitExecutor.close();
    }
}
