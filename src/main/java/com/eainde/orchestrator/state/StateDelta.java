package com.eainde.orchestrator.state;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Partial update produced by one agent step.
 *
 * @param messages   transcript entries to append, in order
 * @param artifacts  scratch artifacts for the producing agent, keyed by logical name
 * @param tokensUsed processor tokens consumed by the step
 */
@Builder(toBuilder = true)
public record StateDelta(
        @Singular List<ChatEntry> messages,
        @Singular Map<String, JsonNode> artifacts,
        long tokensUsed
) {

    public StateDelta {
        messages = messages != null ? List.copyOf(messages) : List.of();
        artifacts = artifacts != null ? Map.copyOf(artifacts) : Map.of();
    }

    public static StateDelta empty() {
        return new StateDelta(List.of(), Map.of(), 0);
    }

    public static StateDelta of(ChatEntry... messages) {
        return new StateDelta(List.of(messages), Map.of(), 0);
    }
}
