package com.eainde.orchestrator.execution;

import com.eainde.orchestrator.state.ChatEntry;
import com.eainde.orchestrator.state.MessageRole;

import java.time.Instant;

/**
 * One transcript entry as handed to chat-history storage, emitted once per appended message.
 */
public record ChatHistoryRecord(
        String sessionId,
        Long userId,
        String agent,
        MessageRole role,
        String content,
        Instant timestamp
) {
    public static ChatHistoryRecord of(String sessionId, Long userId, ChatEntry entry) {
        return new ChatHistoryRecord(
                sessionId,
                userId,
                entry.agent(),
                entry.role(),
                entry.content(),
                entry.timestamp()
        );
    }
}
