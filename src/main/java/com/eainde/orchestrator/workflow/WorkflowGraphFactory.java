package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.agent.Agent;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.edges.RoutingEdge;
import com.eainde.orchestrator.execution.ChatHistorySink;
import com.eainde.orchestrator.nodes.AgentNode;
import com.eainde.orchestrator.state.StateReducer;
import com.eainde.orchestrator.state.WorkflowState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Builds the single graph shared by every workflow type.
 * <p>
 * One node per registered agent; the start node and every agent node leave through the
 * same {@link RoutingEdge}, so which workflow runs is decided by the state, not the graph shape.
 * <pre>
 *   START ──route──▶ agent ──route──▶ agent ... ──route──▶ END
 * </pre>
 */
@Log4j2
public class WorkflowGraphFactory {

    private final AgentRegistry registry;
    private final WorkflowCatalog catalog;
    private final WorkflowRouter router;
    private final RunRegistry runs;
    private final StateReducer reducer;
    private final Executor stepExecutor;
    private final Duration stepTimeout;
    private final ChatHistorySink historySink;

    public WorkflowGraphFactory(AgentRegistry registry,
                                WorkflowCatalog catalog,
                                WorkflowRouter router,
                                RunRegistry runs,
                                StateReducer reducer,
                                Executor stepExecutor,
                                Duration stepTimeout,
                                ChatHistorySink historySink) {
        this.registry = registry;
        this.catalog = catalog;
        this.router = router;
        this.runs = runs;
        this.reducer = reducer;
        this.stepExecutor = stepExecutor;
        this.stepTimeout = stepTimeout;
        this.historySink = historySink;
    }

    public CompiledGraph<WorkflowState> build() throws GraphStateException {
        validateCatalog();

        StateGraph<WorkflowState> workflow = new StateGraph<>(WorkflowState::new);
        RoutingEdge routingEdge = new RoutingEdge(router, runs);

        Map<String, String> routes = new HashMap<>();
        for (String name : registry.names()) {
            if (RouteDecision.END.equals(name)) {
                throw new IllegalArgumentException("Agent name '" + name + "' is reserved");
            }
            Agent agent = registry.get(name);
            workflow.addNode(name, new AgentNode(agent, reducer, stepExecutor, stepTimeout, runs, historySink));
            routes.put(name, name);
        }
        routes.put(RouteDecision.END, END);

        workflow.addConditionalEdges(START, routingEdge, routes);
        for (String name : registry.names()) {
            workflow.addConditionalEdges(name, routingEdge, routes);
        }

        CompiledGraph<WorkflowState> graph = workflow.compile();
        // each step is one node execution; leave headroom so the step budget is what stops a run
        graph.setMaxIterations(router.maxSteps() * 2 + 10);
        log.info("Compiled workflow graph with {} agent nodes", registry.names().size());
        return graph;
    }

    private void validateCatalog() {
        for (WorkflowDefinition definition : catalog.definitions()) {
            for (String agent : definition.requiredAgents()) {
                if (!registry.contains(agent)) {
                    throw new IllegalStateException(
                            "Workflow " + definition.type() + " requires unregistered agent: " + agent);
                }
            }
        }
    }
}
