package com.eainde.orchestrator.workflow;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    NOT_FOUND
}
