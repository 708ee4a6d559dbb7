package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.error.SubmissionException;

import java.util.Arrays;
import java.util.Locale;

public enum WorkflowType {
    JOB_SEARCH("job_search"),
    RESUME_ANALYSIS("resume_analysis"),
    SKILL_ANALYSIS("skill_analysis"),
    RESUME_OPTIMIZATION("resume_optimization"),
    COMPREHENSIVE("comprehensive");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a submitted workflow type, accepting either the wire value ({@code job_search})
     * or the constant name ({@code JOB_SEARCH}), case-insensitively.
     *
     * @throws SubmissionException when the value names no workflow type
     */
    public static WorkflowType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SubmissionException("Workflow type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized) || t.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new SubmissionException("Unknown workflow type: " + raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
