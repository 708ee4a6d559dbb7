package com.eainde.orchestrator.workflow;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping for one run, shared between the caller (cancel, status) and the
 * graph nodes and edges executing it. The workflow state itself is never stored here.
 */
public class RunHandle {

    private final String sessionId;
    private final WorkflowDefinition definition;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile String currentAgent;
    private volatile int progress;
    private volatile Instant lastUpdated;
    private volatile RouteDecision lastDecision;
    private volatile Map<String, Object> lastState;

    public RunHandle(String sessionId, WorkflowDefinition definition, Clock clock) {
        this.sessionId = sessionId;
        this.definition = definition;
        this.clock = clock;
        this.lastUpdated = clock.instant();
    }

    public String sessionId() {
        return sessionId;
    }

    public WorkflowDefinition definition() {
        return definition;
    }

    /**
     * Flags the run for cancellation; takes effect at the next routing decision.
     *
     * @return {@code true} if the run was still running
     */
    public boolean requestCancel() {
        if (status != RunStatus.RUNNING) {
            return false;
        }
        cancelRequested.set(true);
        lastUpdated = clock.instant();
        return true;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    public void recordStep(String agentName, int progress) {
        this.currentAgent = agentName;
        this.progress = progress;
        this.lastUpdated = clock.instant();
    }

    public void recordDecision(RouteDecision decision) {
        this.lastDecision = decision;
        this.lastUpdated = clock.instant();
    }

    /**
     * Stores the state data merged after the latest step. Reports of runs aborted by the
     * graph runtime are built from it.
     */
    public void recordState(Map<String, Object> stateData) {
        this.lastState = Collections.unmodifiableMap(new HashMap<>(stateData));
    }

    /** State data after the latest completed step, empty before the first one. */
    public Optional<Map<String, Object>> lastState() {
        return Optional.ofNullable(lastState);
    }

    /** Last decision taken by the router, {@code null} before the first one. */
    public RouteDecision lastDecision() {
        return lastDecision;
    }

    public void finish(TerminationReason reason) {
        if (reason == TerminationReason.COMPLETED) {
            this.status = RunStatus.COMPLETED;
            this.progress = 100;
        } else if (reason == TerminationReason.CANCELLED) {
            this.status = RunStatus.CANCELLED;
        } else {
            this.status = RunStatus.FAILED;
        }
        this.lastUpdated = clock.instant();
    }

    public WorkflowStatus snapshot() {
        return new WorkflowStatus(sessionId, status, currentAgent, progress, lastUpdated);
    }
}
