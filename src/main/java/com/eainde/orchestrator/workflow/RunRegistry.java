package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.error.SubmissionException;
import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Handles of active and recently finished runs, keyed by session id.
 * Finished runs are kept for status queries up to {@code retainedRuns}, oldest evicted first.
 */
@Log4j2
public class RunRegistry {

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final Queue<RunHandle> finishedOrder = new ConcurrentLinkedQueue<>();
    private final int retainedRuns;

    public RunRegistry(int retainedRuns) {
        this.retainedRuns = retainedRuns;
    }

    /**
     * Registers a new run.
     *
     * @throws SubmissionException if a run with the same session id is still running
     */
    public RunHandle register(RunHandle handle) {
        RunHandle[] replaced = new RunHandle[1];
        RunHandle current = runs.compute(handle.sessionId(), (id, existing) -> {
            if (existing != null && existing.isRunning()) {
                return existing;
            }
            replaced[0] = existing;
            return handle;
        });
        if (current != handle) {
            throw new SubmissionException("Session " + handle.sessionId() + " already has a running workflow");
        }
        if (replaced[0] != null) {
            finishedOrder.remove(replaced[0]);
        }
        return handle;
    }

    public Optional<RunHandle> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(runs.get(sessionId));
    }

    /**
     * Marks the run finished and evicts the oldest finished runs beyond the retention limit.
     */
    public void finished(RunHandle handle, TerminationReason reason) {
        handle.finish(reason);
        finishedOrder.add(handle);
        while (finishedOrder.size() > retainedRuns) {
            RunHandle evicted = finishedOrder.poll();
            if (evicted == null) {
                break;
            }
            // a reused session id maps to a newer handle that stays
            if (runs.remove(evicted.sessionId(), evicted)) {
                log.debug("Evicted finished run {}", evicted.sessionId());
            }
        }
    }

    public int size() {
        return runs.size();
    }
}
