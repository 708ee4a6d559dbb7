package com.eainde.orchestrator.execution;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps chat history per session in memory. Suitable for tests and single-node setups.
 */
public class InMemoryChatHistorySink implements ChatHistorySink {

    private final Map<String, List<ChatHistoryRecord>> storage = new ConcurrentHashMap<>();

    @Override
    public void append(ChatHistoryRecord record) {
        storage.computeIfAbsent(record.sessionId(), k -> new CopyOnWriteArrayList<>()).add(record);
    }

    public List<ChatHistoryRecord> history(String sessionId) {
        List<ChatHistoryRecord> records = storage.get(sessionId);
        return records != null ? List.copyOf(records) : List.of();
    }

    public void clear(String sessionId) {
        storage.remove(sessionId);
    }
}
