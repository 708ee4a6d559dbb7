package com.eainde.orchestrator.state;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One role-tagged entry of the run transcript.
 *
 * @param role      who produced the content
 * @param agent     agent that produced the entry, empty for caller-provided entries
 * @param content   text content
 * @param timestamp creation time
 */
public record ChatEntry(
        MessageRole role,
        String agent,
        String content,
        Instant timestamp
) implements Serializable {

    public ChatEntry {
        Objects.requireNonNull(role, "role");
        agent = agent != null ? agent : "";
        content = content != null ? content : "";
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ChatEntry user(String content) {
        return new ChatEntry(MessageRole.USER, "", content, Instant.now());
    }

    public static ChatEntry assistant(String agent, String content) {
        return new ChatEntry(MessageRole.ASSISTANT, agent, content, Instant.now());
    }

    public static ChatEntry tool(String agent, String content) {
        return new ChatEntry(MessageRole.TOOL, agent, content, Instant.now());
    }

    public static ChatEntry system(String agent, String content) {
        return new ChatEntry(MessageRole.SYSTEM, agent, content, Instant.now());
    }
}
