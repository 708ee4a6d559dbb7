package com.eainde.orchestrator.state;

import com.eainde.orchestrator.support.TestStates;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateReducerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private final StateReducer reducer = new StateReducer(Clock.fixed(NOW, ZoneOffset.UTC));

    private WorkflowState merge(WorkflowState state, String agent, StepOutcome outcome) {
        Map<String, Object> merged = new HashMap<>(state.data());
        merged.putAll(reducer.apply(state, agent, outcome).values());
        return new WorkflowState(merged);
    }

    @Nested
    @DisplayName("Continue outcome")
    class ContinueOutcome {

        @Test
        @DisplayName("should append messages, record the agent and count the step")
        void recordsSuccessfulStep() {
            WorkflowState initial = TestStates.initial("job_search");
            StepOutcome outcome = StepOutcome.proceed(StateDelta.builder()
                    .message(ChatEntry.assistant("job_search_agent", "found 3 jobs"))
                    .artifact("jobs", IntNode.valueOf(3))
                    .tokensUsed(42)
                    .build());

            WorkflowState next = merge(initial, "job_search_agent", outcome);

            assertThat(next.getMessages()).extracting(ChatEntry::content).containsExactly("found 3 jobs");
            assertThat(next.getCurrentAgent()).contains("job_search_agent");
            assertThat(next.getExecutedAgents()).containsExactly("job_search_agent");
            assertThat(next.getCompletedAgents()).containsExactly("job_search_agent");
            assertThat(next.getStepCount()).isEqualTo(1);
            assertThat(next.getErrorCount()).isZero();
            assertThat(next.getTokensUsed()).isEqualTo(42);
            assertThat(next.getArtifacts("job_search_agent")).containsEntry("jobs", IntNode.valueOf(3));
            assertThat(next.pendingHandoff()).isEmpty();
        }

        @Test
        @DisplayName("should record an agent as completed only once")
        void completedOnce() {
            WorkflowState state = TestStates.initial("job_search");
            state = merge(state, "a", StepOutcome.proceed(StateDelta.empty()));
            state = merge(state, "a", StepOutcome.proceed(StateDelta.empty()));

            assertThat(state.getCompletedAgents()).containsExactly("a");
            assertThat(state.getExecutedAgents()).containsExactly("a", "a");
        }

        @Test
        @DisplayName("should overwrite own artifacts and keep other agents' artifacts")
        void scratchIsolation() {
            WorkflowState state = TestStates.initial("comprehensive");
            state = merge(state, "a", StepOutcome.proceed(StateDelta.builder()
                    .artifact("k", TextNode.valueOf("a1")).build()));
            state = merge(state, "b", StepOutcome.proceed(StateDelta.builder()
                    .artifact("k", TextNode.valueOf("b1")).build()));
            state = merge(state, "a", StepOutcome.proceed(StateDelta.builder()
                    .artifact("k", TextNode.valueOf("a2"))
                    .artifact("extra", TextNode.valueOf("x")).build()));

            assertThat(state.getArtifacts("a")).containsEntry("k", TextNode.valueOf("a2"))
                    .containsEntry("extra", TextNode.valueOf("x"));
            assertThat(state.getArtifacts("b")).containsEntry("k", TextNode.valueOf("b1"));
        }
    }

    @Nested
    @DisplayName("Handoff outcome")
    class HandoffOutcome {

        @Test
        @DisplayName("should set the pending handoff and append a transfer marker")
        void setsPendingHandoff() {
            WorkflowState next = merge(TestStates.initial("resume_analysis"), "resume_critic_agent",
                    StepOutcome.handoff(StateDelta.empty(), "resume_rewrite_agent", "rewrite needed"));

            assertThat(next.pendingHandoff())
                    .contains(new HandoffRequest("resume_rewrite_agent", "rewrite needed"));
            ChatEntry marker = next.getMessages().get(next.getMessages().size() - 1);
            assertThat(marker.role()).isEqualTo(MessageRole.TOOL);
            assertThat(marker.content()).isEqualTo("transfer_to_resume_rewrite_agent: rewrite needed");
            assertThat(marker.timestamp()).isEqualTo(NOW);
            assertThat(next.getCompletedAgents()).containsExactly("resume_critic_agent");
        }

        @Test
        @DisplayName("should clear the pending handoff on the following step")
        void clearsHandoff() {
            WorkflowState state = merge(TestStates.initial("resume_analysis"), "a",
                    StepOutcome.handoff(StateDelta.empty(), "b", ""));
            state = merge(state, "b", StepOutcome.proceed(StateDelta.empty()));

            assertThat(state.pendingHandoff()).isEmpty();
            assertThat(state.getNextAgent()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fail outcome")
    class FailOutcome {

        @Test
        @DisplayName("should count the error and add a readable message when the agent gave none")
        void countsFailure() {
            WorkflowState next = merge(TestStates.initial("job_search"), "job_search_agent",
                    StepOutcome.fail(StateDelta.empty(), "boom"));

            assertThat(next.getErrorCount()).isEqualTo(1);
            assertThat(next.getFailureCount("job_search_agent")).isEqualTo(1);
            assertThat(next.getCompletedAgents()).isEmpty();
            assertThat(next.getStepCount()).isEqualTo(1);
            assertThat(next.getMessages()).extracting(ChatEntry::content)
                    .containsExactly("Sorry, job_search_agent encountered an error: boom");
        }

        @Test
        @DisplayName("should keep the agent's own error message")
        void keepsAgentMessage() {
            WorkflowState next = merge(TestStates.initial("job_search"), "a",
                    StepOutcome.fail(StateDelta.of(ChatEntry.assistant("a", "custom")), "boom"));

            assertThat(next.getMessages()).extracting(ChatEntry::content).containsExactly("custom");
        }
    }

    @Test
    @DisplayName("should not mutate the snapshot")
    void purity() {
        WorkflowState initial = TestStates.initial("job_search");
        List<ChatEntry> before = initial.getMessages();

        StepOutcome outcome = StepOutcome.proceed(StateDelta.of(ChatEntry.user("hi")));

        StateReducer.StateUpdate first = reducer.apply(initial, "a", outcome);
        StateReducer.StateUpdate second = reducer.apply(initial, "a", outcome);

        assertThat(initial.getMessages()).isEqualTo(before).isEmpty();
        assertThat(initial.getStepCount()).isZero();
        assertThat(first.values()).isEqualTo(second.values());
        assertThat(first.appended()).hasSize(1);
    }
}
