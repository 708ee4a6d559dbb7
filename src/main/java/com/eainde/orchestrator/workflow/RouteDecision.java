package com.eainde.orchestrator.workflow;

import java.util.Objects;

/**
 * Outcome of one routing step: run {@code nextAgent}, or stop for {@code reason}.
 *
 * @param nextAgent agent to execute next, {@code null} when terminal
 * @param reason    why the run stops, {@code null} when not terminal
 * @param message   human readable explanation of a terminal decision
 */
public record RouteDecision(String nextAgent, TerminationReason reason, String message) {

    /** Edge key mapped to the graph's end node. */
    public static final String END = "end";

    public RouteDecision {
        if ((nextAgent == null) == (reason == null)) {
            throw new IllegalArgumentException("Exactly one of nextAgent and reason must be set");
        }
        message = message != null ? message : "";
    }

    public static RouteDecision goTo(String agentName) {
        return new RouteDecision(Objects.requireNonNull(agentName, "agentName"), null, "");
    }

    public static RouteDecision complete(String message) {
        return new RouteDecision(null, TerminationReason.COMPLETED, message);
    }

    public static RouteDecision terminate(TerminationReason reason, String message) {
        return new RouteDecision(null, Objects.requireNonNull(reason, "reason"), message);
    }

    public boolean isTerminal() {
        return reason != null;
    }

    public String edgeKey() {
        return isTerminal() ? END : nextAgent;
    }
}
