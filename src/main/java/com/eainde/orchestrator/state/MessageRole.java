package com.eainde.orchestrator.state;

/**
 * Role tag of a transcript entry. Mirrors the roles stored by the chat history.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL
}
