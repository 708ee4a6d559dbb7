package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.error.SubmissionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunRegistryTest {

    private final WorkflowDefinition definition =
            WorkflowCatalog.standard(CompletionPolicy.ALL_REQUIRED, 3).get(WorkflowType.JOB_SEARCH);

    private RunHandle handle(String sessionId) {
        return new RunHandle(sessionId, definition, Clock.systemUTC());
    }

    @Test
    @DisplayName("should reject a second run for a session that is still running")
    void rejectsDuplicateRunningSession() {
        RunRegistry registry = new RunRegistry(10);
        registry.register(handle("s1"));

        assertThatThrownBy(() -> registry.register(handle("s1")))
                .isInstanceOf(SubmissionException.class)
                .hasMessageContaining("s1");
    }

    @Test
    @DisplayName("should accept a new run once the previous one finished")
    void reusesFinishedSession() {
        RunRegistry registry = new RunRegistry(10);
        RunHandle first = registry.register(handle("s1"));
        registry.finished(first, TerminationReason.COMPLETED);

        RunHandle second = registry.register(handle("s1"));

        assertThat(registry.find("s1")).containsSame(second);
    }

    @Test
    @DisplayName("should evict the oldest finished runs beyond the retention limit")
    void evictsOldestFinished() {
        RunRegistry registry = new RunRegistry(1);
        RunHandle first = registry.register(handle("s1"));
        RunHandle second = registry.register(handle("s2"));
        RunHandle running = registry.register(handle("s3"));

        registry.finished(first, TerminationReason.COMPLETED);
        registry.finished(second, TerminationReason.ERROR_BUDGET_EXCEEDED);

        assertThat(registry.find("s1")).isEmpty();
        assertThat(registry.find("s2")).containsSame(second);
        assertThat(registry.find("s3")).containsSame(running);
    }

    @Test
    @DisplayName("should keep the latest run of a reused session when its earlier run is evicted")
    void keepsLatestRunOfReusedSession() {
        RunRegistry registry = new RunRegistry(2);
        RunHandle firstA = registry.register(handle("A"));
        registry.finished(firstA, TerminationReason.COMPLETED);
        RunHandle secondA = registry.register(handle("A"));
        registry.finished(secondA, TerminationReason.COMPLETED);
        RunHandle b = registry.register(handle("B"));
        registry.finished(b, TerminationReason.COMPLETED);

        assertThat(registry.find("A")).containsSame(secondA);
        assertThat(registry.find("B")).containsSame(b);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should map termination reasons to run statuses")
    void statuses() {
        RunHandle completed = handle("a");
        RunHandle cancelled = handle("b");
        RunHandle failed = handle("c");

        completed.finish(TerminationReason.COMPLETED);
        cancelled.finish(TerminationReason.CANCELLED);
        failed.finish(TerminationReason.STEP_BUDGET_EXCEEDED);

        assertThat(completed.snapshot().status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(completed.snapshot().progress()).isEqualTo(100);
        assertThat(cancelled.snapshot().status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(failed.snapshot().status()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.requestCancel()).isFalse();
    }
}
