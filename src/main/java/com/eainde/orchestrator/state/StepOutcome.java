package com.eainde.orchestrator.state;

import java.util.Objects;

/**
 * Result of one agent step: continue on the static route, hand control to
 * another agent, or report a failure. Every variant carries the delta to merge.
 */
public sealed interface StepOutcome permits StepOutcome.Continue, StepOutcome.Handoff, StepOutcome.Fail {

    StateDelta delta();

    default boolean succeeded() {
        return !(this instanceof Fail);
    }

    static StepOutcome proceed(StateDelta delta) {
        return new Continue(delta);
    }

    static StepOutcome handoff(StateDelta delta, String targetAgent, String reason) {
        return new Handoff(delta, new HandoffRequest(targetAgent, reason));
    }

    static StepOutcome fail(StateDelta delta, String error) {
        return new Fail(delta, error, null);
    }

    static StepOutcome fail(StateDelta delta, Throwable cause) {
        return new Fail(delta, describe(cause), cause);
    }

    record Continue(StateDelta delta) implements StepOutcome {
        public Continue {
            delta = delta != null ? delta : StateDelta.empty();
        }
    }

    record Handoff(StateDelta delta, HandoffRequest request) implements StepOutcome {
        public Handoff {
            delta = delta != null ? delta : StateDelta.empty();
            Objects.requireNonNull(request, "request");
        }
    }

    /**
     * @param error human readable description of the failure
     * @param cause underlying exception, may be {@code null}
     */
    record Fail(StateDelta delta, String error, Throwable cause) implements StepOutcome {
        public Fail {
            delta = delta != null ? delta : StateDelta.empty();
            error = error != null ? error : "Unknown error";
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
