package com.eainde.orchestrator.workflow;

import java.time.Instant;

/**
 * Snapshot of a run as seen by a caller polling for progress.
 *
 * @param currentAgent agent running or last run, {@code null} before the first step
 * @param progress     percentage of required agents done
 */
public record WorkflowStatus(
        String sessionId,
        RunStatus status,
        String currentAgent,
        int progress,
        Instant lastUpdated
) {

    public static WorkflowStatus notFound(String sessionId, Instant now) {
        return new WorkflowStatus(sessionId, RunStatus.NOT_FOUND, null, 0, now);
    }
}
