package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.error.WorkflowErrorKind;

public enum TerminationReason {
    COMPLETED(null),
    CANCELLED(WorkflowErrorKind.CANCELLED),
    ERROR_BUDGET_EXCEEDED(WorkflowErrorKind.ERROR_BUDGET_EXCEEDED),
    STEP_BUDGET_EXCEEDED(WorkflowErrorKind.STEP_BUDGET_EXCEEDED),
    UNKNOWN_HANDOFF_TARGET(WorkflowErrorKind.UNKNOWN_HANDOFF_TARGET),
    INTERNAL_ERROR(WorkflowErrorKind.INTERNAL_ERROR);

    private final WorkflowErrorKind errorKind;

    TerminationReason(WorkflowErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    /** Error kind reported for this reason, {@code null} for a successful run. */
    public WorkflowErrorKind errorKind() {
        return errorKind;
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
