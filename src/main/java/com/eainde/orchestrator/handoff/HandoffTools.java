package com.eainde.orchestrator.handoff;

import com.eainde.orchestrator.state.HandoffRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Handoff convention: an agent transfers control by invoking the pseudo tool
 * {@code transfer_to_<target>} with a single {@code reason} argument.
 * <p>
 * The invocation travels through the model's ordinary tool-calling channel, so it is
 * recorded in the transcript like any other tool call.
 */
@Log4j2
public class HandoffTools {

    public static final String REASON_PARAMETER = "reason";

    private final ObjectMapper objectMapper;

    public HandoffTools(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Tool specification offered to the model for one allowed target.
     */
    public ToolSpecification specificationFor(String targetAgent) {
        return ToolSpecification.builder()
                .name(HandoffRequest.TOOL_PREFIX + targetAgent)
                .description("Transfer the conversation to " + targetAgent
                        + " when its expertise is required to continue")
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty(REASON_PARAMETER, "Why control is being transferred")
                        .required(REASON_PARAMETER)
                        .build())
                .build();
    }

    public List<ToolSpecification> specificationsFor(Collection<String> targetAgents) {
        return targetAgents.stream().map(this::specificationFor).toList();
    }

    public static boolean isHandoff(ToolExecutionRequest request) {
        return request.name() != null
                && request.name().startsWith(HandoffRequest.TOOL_PREFIX)
                && request.name().length() > HandoffRequest.TOOL_PREFIX.length();
    }

    /**
     * Returns the first handoff invocation among the given tool calls, parsed into a request.
     * The target is not checked against the registry here; routing rejects unknown targets.
     */
    public Optional<HandoffRequest> findHandoff(List<ToolExecutionRequest> requests) {
        if (requests == null) {
            return Optional.empty();
        }
        return requests.stream()
                .filter(HandoffTools::isHandoff)
                .findFirst()
                .map(this::parse);
    }

    public HandoffRequest parse(ToolExecutionRequest request) {
        if (!isHandoff(request)) {
            throw new IllegalArgumentException("Not a handoff invocation: " + request.name());
        }
        String target = request.name().substring(HandoffRequest.TOOL_PREFIX.length());
        return new HandoffRequest(target, readReason(request.arguments()));
    }

    private String readReason(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(arguments);
            JsonNode reason = node.path(REASON_PARAMETER);
            return reason.isValueNode() ? reason.asText() : "";
        } catch (JsonProcessingException e) {
            log.warn("Unparseable handoff arguments, keeping raw text: {}", e.getOriginalMessage());
            return arguments;
        }
    }
}
