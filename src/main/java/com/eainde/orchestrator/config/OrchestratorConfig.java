package com.eainde.orchestrator.config;

import com.eainde.orchestrator.agent.AgentFactory;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.execution.ChatHistorySink;
import com.eainde.orchestrator.execution.InMemoryChatHistorySink;
import com.eainde.orchestrator.execution.LoggingChatHistorySink;
import com.eainde.orchestrator.handoff.HandoffTools;
import com.eainde.orchestrator.processor.ChatModelProcessor;
import com.eainde.orchestrator.processor.Processor;
import com.eainde.orchestrator.state.StateReducer;
import com.eainde.orchestrator.state.WorkflowState;
import com.eainde.orchestrator.thread.MdcAwareExecutor;
import com.eainde.orchestrator.workflow.CompletionPolicy;
import com.eainde.orchestrator.workflow.RunRegistry;
import com.eainde.orchestrator.workflow.WorkflowCatalog;
import com.eainde.orchestrator.workflow.WorkflowCoordinator;
import com.eainde.orchestrator.workflow.WorkflowGraphFactory;
import com.eainde.orchestrator.workflow.WorkflowRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the orchestration engine: settings, executors, routing, the compiled graph
 * and the coordinator facade. Agents are registered in {@link AgentConfig}.
 */
@Log4j2
@Configuration
public class OrchestratorConfig {

    @Bean
    public EngineSettings engineSettings(
            @Value("${orchestrator.max-errors:5}") int maxErrors,
            @Value("${orchestrator.max-steps:50}") int maxSteps,
            @Value("${orchestrator.step-timeout-seconds:120}") long stepTimeoutSeconds,
            @Value("${orchestrator.step-threads:16}") int stepThreads,
            @Value("${orchestrator.retained-runs:1000}") int retainedRuns,
            @Value("${orchestrator.completion-policy:ALL_REQUIRED}") CompletionPolicy completionPolicy,
            @Value("${orchestrator.max-attempts-per-agent:3}") int maxAttemptsPerAgent,
            @Value("${orchestrator.max-tool-rounds:5}") int maxToolRounds) {
        EngineSettings settings = new EngineSettings(maxErrors, maxSteps, Duration.ofSeconds(stepTimeoutSeconds),
                stepThreads, retainedRuns, completionPolicy, maxAttemptsPerAgent, maxToolRounds);
        log.info("Orchestrator settings: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // =========================================================================
    //  Executors
    // =========================================================================

    @Bean
    public MdcAwareExecutor stepExecutor(EngineSettings settings) {
        return new MdcAwareExecutor("agent-step", settings.stepThreads());
    }

    @Bean
    public MdcAwareExecutor toolExecutor(EngineSettings settings) {
        return new MdcAwareExecutor("agent-tool", settings.stepThreads());
    }

    @Bean
    public MdcAwareExecutor submitExecutor(EngineSettings settings) {
        return new MdcAwareExecutor("workflow-run", settings.stepThreads());
    }

    // =========================================================================
    //  Agent building blocks
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public Processor processor(ObjectProvider<ChatModel> chatModel) {
        return new ChatModelProcessor(chatModel);
    }

    @Bean
    public HandoffTools handoffTools(ObjectMapper objectMapper) {
        return new HandoffTools(objectMapper);
    }

    @Bean
    public AgentFactory agentFactory(Processor processor,
                                     HandoffTools handoffTools,
                                     ObjectMapper objectMapper,
                                     @Qualifier("toolExecutor") MdcAwareExecutor toolExecutor,
                                     EngineSettings settings) {
        return new AgentFactory(processor, handoffTools, objectMapper, toolExecutor, settings.maxToolRounds());
    }

    // =========================================================================
    //  Chat history
    // =========================================================================

    @Bean
    @ConditionalOnProperty(name = "orchestrator.history-sink", havingValue = "logging")
    public ChatHistorySink loggingChatHistorySink() {
        return new LoggingChatHistorySink();
    }

    @Bean
    @ConditionalOnMissingBean(ChatHistorySink.class)
    public ChatHistorySink inMemoryChatHistorySink() {
        return new InMemoryChatHistorySink();
    }

    // =========================================================================
    //  Routing & graph
    // =========================================================================

    @Bean
    public WorkflowCatalog workflowCatalog(EngineSettings settings) {
        return WorkflowCatalog.standard(settings.completionPolicy(), settings.maxAttemptsPerAgent());
    }

    @Bean
    public RunRegistry runRegistry(EngineSettings settings) {
        return new RunRegistry(settings.retainedRuns());
    }

    @Bean
    public StateReducer stateReducer(Clock clock) {
        return new StateReducer(clock);
    }

    @Bean
    public WorkflowRouter workflowRouter(WorkflowCatalog catalog, AgentRegistry registry, EngineSettings settings) {
        return new WorkflowRouter(catalog, registry, settings.maxErrors(), settings.maxSteps());
    }

    @Bean
    public CompiledGraph<WorkflowState> workflowGraph(AgentRegistry registry,
                                                      WorkflowCatalog catalog,
                                                      WorkflowRouter router,
                                                      RunRegistry runs,
                                                      StateReducer reducer,
                                                      @Qualifier("stepExecutor") MdcAwareExecutor stepExecutor,
                                                      ChatHistorySink historySink,
                                                      EngineSettings settings) throws GraphStateException {
        return new WorkflowGraphFactory(registry, catalog, router, runs, reducer,
                stepExecutor, settings.stepTimeout(), historySink).build();
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(CompiledGraph<WorkflowState> workflowGraph,
                                                   WorkflowCatalog catalog,
                                                   AgentRegistry registry,
                                                   RunRegistry runs,
                                                   ChatHistorySink historySink,
                                                   ObjectMapper objectMapper,
                                                   @Qualifier("submitExecutor") MdcAwareExecutor submitExecutor,
                                                   Clock clock) {
        return new WorkflowCoordinator(workflowGraph, catalog, registry, runs, historySink,
                objectMapper, submitExecutor, clock);
    }
}
