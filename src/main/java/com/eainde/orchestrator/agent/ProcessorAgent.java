package com.eainde.orchestrator.agent;

import com.eainde.orchestrator.handoff.HandoffTools;
import com.eainde.orchestrator.processor.Processor;
import com.eainde.orchestrator.processor.ToolFanOut;
import com.eainde.orchestrator.state.ChatEntry;
import com.eainde.orchestrator.state.HandoffRequest;
import com.eainde.orchestrator.state.StateDelta;
import com.eainde.orchestrator.state.StateReducer;
import com.eainde.orchestrator.state.StepOutcome;
import com.eainde.orchestrator.state.WorkflowState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Agent whose step is driven by a {@link Processor}.
 * <p>
 * One step runs a bounded tool loop: the processor either answers with text (the step
 * continues on the static route), asks for tools (they are executed concurrently and the
 * results fed back), or invokes a {@code transfer_to_<agent>} tool (the step ends with a handoff).
 */
@Log4j2
public class ProcessorAgent implements Agent {

    public static final String RESPONSE_ARTIFACT = "response";
    static final String USER_MESSAGE_FIELD = "message";

    private final String name;
    private final String description;
    private final String systemPrompt;
    private final Processor processor;
    private final ToolFanOut tools;
    private final List<String> handoffTargets;
    private final HandoffTools handoffTools;
    private final ObjectMapper objectMapper;
    private final int maxToolRounds;

    public ProcessorAgent(String name,
                          String description,
                          String systemPrompt,
                          Processor processor,
                          ToolFanOut tools,
                          List<String> handoffTargets,
                          HandoffTools handoffTools,
                          ObjectMapper objectMapper,
                          int maxToolRounds) {
        this.name = name;
        this.description = description;
        this.systemPrompt = systemPrompt;
        this.processor = processor;
        this.tools = tools;
        this.handoffTargets = List.copyOf(handoffTargets);
        this.handoffTools = handoffTools;
        this.objectMapper = objectMapper;
        this.maxToolRounds = maxToolRounds;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public AgentDescriptor describe() {
        List<String> toolNames = tools.specifications().stream().map(ToolSpecification::name).toList();
        return new AgentDescriptor(name, description, toolNames, handoffTargets);
    }

    @Override
    public StepOutcome process(WorkflowState state) {
        StateDelta.StateDeltaBuilder delta = StateDelta.builder();
        long tokens = 0;
        try {
            List<ChatMessage> history = buildHistory(state);
            List<ToolSpecification> specifications = new ArrayList<>(tools.specifications());
            specifications.addAll(handoffTools.specificationsFor(handoffTargets));

            for (int round = 0; round <= maxToolRounds; round++) {
                ChatResponse response = processor.generate(systemPrompt, history, specifications);
                tokens += tokensOf(response);
                AiMessage aiMessage = response.aiMessage();

                if (!aiMessage.hasToolExecutionRequests()) {
                    String text = aiMessage.text() != null ? aiMessage.text() : "";
                    delta.message(ChatEntry.assistant(name, text));
                    delta.artifact(RESPONSE_ARTIFACT, TextNode.valueOf(text));
                    return StepOutcome.proceed(delta.tokensUsed(tokens).build());
                }

                Optional<HandoffRequest> handoff = handoffTools.findHandoff(aiMessage.toolExecutionRequests());
                if (handoff.isPresent()) {
                    if (aiMessage.text() != null && !aiMessage.text().isBlank()) {
                        delta.message(ChatEntry.assistant(name, aiMessage.text()));
                    }
                    // tool calls issued next to the transfer still run; their results travel with the handoff
                    List<ToolExecutionRequest> sideCalls = aiMessage.toolExecutionRequests().stream()
                            .filter(request -> !HandoffTools.isHandoff(request))
                            .toList();
                    if (!sideCalls.isEmpty()) {
                        runTools(sideCalls, state, history, delta);
                    }
                    log.info("{} requested handoff to {}", name, handoff.get().targetAgent());
                    return new StepOutcome.Handoff(delta.tokensUsed(tokens).build(), handoff.get());
                }

                history.add(aiMessage);
                runTools(aiMessage.toolExecutionRequests(), state, history, delta);
            }

            String error = "exceeded " + maxToolRounds + " tool rounds without a final answer";
            delta.message(ChatEntry.assistant(name, StateReducer.failureMessage(name, error)));
            return StepOutcome.fail(delta.tokensUsed(tokens).build(), error);
        } catch (Exception e) {
            log.error("Agent {} failed", name, e);
            StateDelta failure = StateDelta.builder()
                    .message(ChatEntry.assistant(name, StateReducer.failureMessage(name, describe(e))))
                    .tokensUsed(tokens)
                    .build();
            return StepOutcome.fail(failure, e);
        }
    }

    private void runTools(List<ToolExecutionRequest> requests,
                          WorkflowState state,
                          List<ChatMessage> history,
                          StateDelta.StateDeltaBuilder delta) {
        for (ToolFanOut.ToolResult result : tools.executeAll(requests, state.getSessionId())) {
            history.add(ToolExecutionResultMessage.from(result.request(), result.text()));
            delta.message(ChatEntry.tool(name, result.request().name() + ": " + result.text()));
            if (!result.failed()) {
                delta.artifact(result.request().name(), toJson(result.text()));
            }
        }
    }

    private List<ChatMessage> buildHistory(WorkflowState state) {
        List<ChatMessage> history = new ArrayList<>();
        boolean hasUserMessage = false;
        for (ChatEntry entry : state.getMessages()) {
            if (entry.content().isBlank()) {
                continue;
            }
            switch (entry.role()) {
                case USER -> {
                    history.add(UserMessage.from(entry.content()));
                    hasUserMessage = true;
                }
                case ASSISTANT -> history.add(AiMessage.from(entry.content()));
                default -> {
                    // tool and system entries stay in the transcript only
                }
            }
        }
        if (!hasUserMessage) {
            history.add(0, UserMessage.from(renderUserInput(state.getUserInput())));
        }
        return history;
    }

    private String renderUserInput(ObjectNode userInput) {
        if (userInput == null) {
            return "";
        }
        JsonNode message = userInput.get(USER_MESSAGE_FIELD);
        if (message != null && message.isTextual() && userInput.size() == 1) {
            return message.asText();
        }
        return userInput.toString();
    }

    private JsonNode toJson(String text) {
        if (text.isBlank()) {
            return TextNode.valueOf(text);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private static long tokensOf(ChatResponse response) {
        if (response.tokenUsage() == null || response.tokenUsage().totalTokenCount() == null) {
            return 0;
        }
        return response.tokenUsage().totalTokenCount();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }
}
