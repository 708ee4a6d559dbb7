package com.eainde.orchestrator.processor;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.List;

/**
 * Reasoning step used inside an agent: given a system prompt, the conversation so far
 * and the tools on offer, produce either text or tool invocations.
 */
public interface Processor {

    ChatResponse generate(String systemPrompt, List<ChatMessage> history, List<ToolSpecification> tools);
}
