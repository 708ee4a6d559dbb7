package com.eainde.orchestrator.error;

/**
 * Thrown synchronously by the coordinator when a workflow request is rejected
 * before any state is created (unknown workflow type, malformed input, duplicate session).
 */
public class SubmissionException extends IllegalArgumentException {

    public SubmissionException(String message) {
        super(message);
    }

    public WorkflowErrorKind kind() {
        return WorkflowErrorKind.SUBMISSION_ERROR;
    }
}
