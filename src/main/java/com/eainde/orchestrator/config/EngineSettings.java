package com.eainde.orchestrator.config;

import com.eainde.orchestrator.workflow.CompletionPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the orchestration engine, bound from {@code orchestrator.*} properties.
 *
 * @param maxErrors           a run stops once its error count goes above this ceiling
 * @param maxSteps            a run stops when another step is requested after this many steps
 * @param stepTimeout         upper bound of one agent step
 * @param stepThreads         size of the pool running agent steps
 * @param retainedRuns        finished runs kept for status queries
 * @param completionPolicy    treatment of required agents that keep failing
 * @param maxAttemptsPerAgent failures after which a best-effort workflow skips an agent
 * @param maxToolRounds       tool round trips allowed in one processor-backed step
 */
public record EngineSettings(
        int maxErrors,
        int maxSteps,
        Duration stepTimeout,
        int stepThreads,
        int retainedRuns,
        CompletionPolicy completionPolicy,
        int maxAttemptsPerAgent,
        int maxToolRounds
) {

    public EngineSettings {
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        Objects.requireNonNull(completionPolicy, "completionPolicy");
        requireAtLeast("maxErrors", maxErrors, 0);
        requireAtLeast("maxSteps", maxSteps, 1);
        requireAtLeast("stepThreads", stepThreads, 1);
        requireAtLeast("retainedRuns", retainedRuns, 0);
        requireAtLeast("maxAttemptsPerAgent", maxAttemptsPerAgent, 1);
        requireAtLeast("maxToolRounds", maxToolRounds, 0);
        if (stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("stepTimeout must be positive");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(5, 50, Duration.ofSeconds(120), 16, 1000,
                CompletionPolicy.ALL_REQUIRED, 3, 5);
    }

    public EngineSettings withMaxErrors(int value) {
        return new EngineSettings(value, maxSteps, stepTimeout, stepThreads, retainedRuns,
                completionPolicy, maxAttemptsPerAgent, maxToolRounds);
    }

    public EngineSettings withMaxSteps(int value) {
        return new EngineSettings(maxErrors, value, stepTimeout, stepThreads, retainedRuns,
                completionPolicy, maxAttemptsPerAgent, maxToolRounds);
    }

    public EngineSettings withStepTimeout(Duration value) {
        return new EngineSettings(maxErrors, maxSteps, value, stepThreads, retainedRuns,
                completionPolicy, maxAttemptsPerAgent, maxToolRounds);
    }

    public EngineSettings withCompletionPolicy(CompletionPolicy value, int attempts) {
        return new EngineSettings(maxErrors, maxSteps, stepTimeout, stepThreads, retainedRuns,
                value, attempts, maxToolRounds);
    }

    private static void requireAtLeast(String name, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(name + " must be at least " + min + " but was " + value);
        }
    }
}
