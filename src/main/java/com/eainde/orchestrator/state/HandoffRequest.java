package com.eainde.orchestrator.state;

import java.io.Serializable;

/**
 * Request, carried in a step outcome, to move control to a named agent
 * instead of following the static route.
 *
 * @param targetAgent registered name of the agent that should run next
 * @param reason      free-text justification, written to the transcript
 */
public record HandoffRequest(String targetAgent, String reason) implements Serializable {

    /** Name prefix of the pseudo tool through which a handoff is declared. */
    public static final String TOOL_PREFIX = "transfer_to_";

    public HandoffRequest {
        if (targetAgent == null || targetAgent.isBlank()) {
            throw new IllegalArgumentException("Handoff target must not be blank");
        }
        reason = reason != null ? reason : "";
    }

    public String toolName() {
        return TOOL_PREFIX + targetAgent;
    }
}
