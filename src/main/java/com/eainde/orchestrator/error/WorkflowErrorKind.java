package com.eainde.orchestrator.error;

/**
 * Error taxonomy of the orchestration engine.
 * <p>
 * The {@link #code()} is what callers see in the {@code error} field of an
 * {@link com.eainde.orchestrator.execution.ExecutionReport}.
 */
public enum WorkflowErrorKind {

    /** Processor or tool failure inside one step. Absorbed, never ends a run on its own. */
    AGENT_FAILURE("AgentFailure"),

    /** A handoff marker named an agent that is not registered in the graph. */
    UNKNOWN_HANDOFF_TARGET("UnknownHandoffTarget"),

    /** The error counter went above the configured ceiling. */
    ERROR_BUDGET_EXCEEDED("ErrorBudgetExceeded"),

    /** The step ceiling was reached while another step was still requested. */
    STEP_BUDGET_EXCEEDED("StepBudgetExceeded"),

    /** Invalid request rejected before any state was created. */
    SUBMISSION_ERROR("SubmissionError"),

    /** The caller cancelled the run. */
    CANCELLED("Cancelled"),

    /** The graph runtime itself failed. */
    INTERNAL_ERROR("InternalError");

    private final String code;

    WorkflowErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
