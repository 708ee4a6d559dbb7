package com.eainde.orchestrator.workflow;

/**
 * How a multi-agent workflow treats a required agent that keeps failing.
 */
public enum CompletionPolicy {

    /** Complete only once every required agent has succeeded. */
    ALL_REQUIRED,

    /**
     * An agent that failed the workflow's attempt limit is skipped;
     * complete once every required agent has succeeded or been skipped.
     */
    BEST_EFFORT
}
