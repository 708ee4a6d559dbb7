package com.eainde.orchestrator.processor;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link Processor} backed by a langchain4j {@link ChatModel}.
 * <p>
 * The model is resolved lazily so the engine can start without one; a step that needs
 * it then fails and is recorded as an agent failure.
 */
@Log4j2
public class ChatModelProcessor implements Processor {

    private final Supplier<ChatModel> modelSupplier;

    public ChatModelProcessor(ChatModel chatModel) {
        this.modelSupplier = () -> chatModel;
    }

    public ChatModelProcessor(ObjectProvider<ChatModel> chatModelProvider) {
        this.modelSupplier = chatModelProvider::getIfAvailable;
    }

    @Override
    public ChatResponse generate(String systemPrompt, List<ChatMessage> history, List<ToolSpecification> tools) {
        ChatModel model = modelSupplier.get();
        if (model == null) {
            throw new IllegalStateException("No ChatModel is configured");
        }

        List<ChatMessage> messages = new ArrayList<>(history.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.addAll(history);

        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (tools != null && !tools.isEmpty()) {
            request.toolSpecifications(tools);
        }

        log.debug("Sending {} messages with {} tools to the model", messages.size(), tools == null ? 0 : tools.size());
        ChatResponse response = model.chat(request.build());
        if (response.tokenUsage() != null) {
            log.debug("Model responded, tokens used: {}", response.tokenUsage().totalTokenCount());
        }
        return response;
    }
}
