package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.agent.AgentNames;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.state.StateDelta;
import com.eainde.orchestrator.state.StepOutcome;
import com.eainde.orchestrator.state.WorkflowState;
import com.eainde.orchestrator.support.StubAgent;
import com.eainde.orchestrator.support.TestStates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowRouterTest {

    private final AgentRegistry registry = AgentRegistry.of(
            StubAgent.succeeding(AgentNames.JOB_SEARCH),
            StubAgent.succeeding(AgentNames.RESUME_CRITIC),
            StubAgent.succeeding(AgentNames.SKILL_HEATMAP),
            StubAgent.succeeding(AgentNames.RESUME_REWRITE));
    private final WorkflowCatalog catalog = WorkflowCatalog.standard(CompletionPolicy.ALL_REQUIRED, 3);
    private final WorkflowRouter router = new WorkflowRouter(catalog, registry, 5, 50);

    private static WorkflowState fail(WorkflowState state, String agent, int times) {
        for (int i = 0; i < times; i++) {
            state = TestStates.step(state, agent, StepOutcome.fail(StateDelta.empty(), "boom"));
        }
        return state;
    }

    @Nested
    @DisplayName("Static routing")
    class StaticRouting {

        @Test
        @DisplayName("should start at the workflow's entry agent")
        void entryAgent() {
            RouteDecision decision = router.decide(TestStates.initial("resume_optimization"), false);

            assertThat(decision.isTerminal()).isFalse();
            assertThat(decision.nextAgent()).isEqualTo(AgentNames.RESUME_REWRITE);
            assertThat(decision.edgeKey()).isEqualTo(AgentNames.RESUME_REWRITE);
        }

        @Test
        @DisplayName("should end successfully once the completion predicate holds")
        void endsWhenComplete() {
            WorkflowState state = TestStates.step(TestStates.initial("job_search"), AgentNames.JOB_SEARCH,
                    StepOutcome.proceed(StateDelta.empty()));

            RouteDecision decision = router.decide(state, false);

            assertThat(decision.reason()).isEqualTo(TerminationReason.COMPLETED);
            assertThat(decision.edgeKey()).isEqualTo(RouteDecision.END);
        }

        @Test
        @DisplayName("should be deterministic for the same snapshot")
        void deterministic() {
            WorkflowState state = TestStates.step(TestStates.initial("comprehensive"), AgentNames.JOB_SEARCH,
                    StepOutcome.proceed(StateDelta.empty()));

            assertThat(router.decide(state, false)).isEqualTo(router.decide(state, false));
        }
    }

    @Nested
    @DisplayName("Handoffs")
    class Handoffs {

        @Test
        @DisplayName("should prefer a pending handoff over completion and static route")
        void handoffWins() {
            WorkflowState state = TestStates.step(TestStates.initial("resume_analysis"), AgentNames.RESUME_CRITIC,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.SKILL_HEATMAP, "check skills"));

            assertThat(catalog.get(WorkflowType.RESUME_ANALYSIS).isComplete(state)).isTrue();
            assertThat(router.decide(state, false)).isEqualTo(RouteDecision.goTo(AgentNames.SKILL_HEATMAP));
        }

        @Test
        @DisplayName("should allow a handoff back to the same agent")
        void selfHandoff() {
            WorkflowState state = TestStates.step(TestStates.initial("job_search"), AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.JOB_SEARCH, "again"));

            assertThat(router.decide(state, false).nextAgent()).isEqualTo(AgentNames.JOB_SEARCH);
        }

        @Test
        @DisplayName("should stop on a handoff to an unregistered agent")
        void unknownTarget() {
            WorkflowState state = TestStates.step(TestStates.initial("job_search"), AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), "ghost_agent", "?"));

            RouteDecision decision = router.decide(state, false);

            assertThat(decision.reason()).isEqualTo(TerminationReason.UNKNOWN_HANDOFF_TARGET);
            assertThat(decision.message()).contains("ghost_agent");
        }
    }

    @Nested
    @DisplayName("Budgets and cancellation")
    class Budgets {

        @Test
        @DisplayName("should keep going at the error ceiling and stop just above it")
        void errorCeiling() {
            WorkflowState atCeiling = fail(TestStates.initial("resume_analysis"), AgentNames.RESUME_CRITIC, 5);
            WorkflowState aboveCeiling = fail(atCeiling, AgentNames.RESUME_CRITIC, 1);

            assertThat(router.decide(atCeiling, false).nextAgent()).isEqualTo(AgentNames.RESUME_CRITIC);
            assertThat(router.decide(aboveCeiling, false).reason()).isEqualTo(TerminationReason.ERROR_BUDGET_EXCEEDED);
        }

        @Test
        @DisplayName("should check the error ceiling before a pending handoff")
        void errorCeilingBeforeHandoff() {
            WorkflowState state = fail(TestStates.initial("job_search"), AgentNames.JOB_SEARCH, 6);
            state = TestStates.step(state, AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.RESUME_CRITIC, ""));

            assertThat(router.decide(state, false).reason()).isEqualTo(TerminationReason.ERROR_BUDGET_EXCEEDED);
        }

        @Test
        @DisplayName("should stop when another step is requested at the step ceiling")
        void stepCeiling() {
            WorkflowRouter tight = new WorkflowRouter(catalog, registry, 5, 2);
            WorkflowState state = TestStates.initial("job_search");
            state = TestStates.step(state, AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.JOB_SEARCH, ""));
            assertThat(tight.decide(state, false).nextAgent()).isEqualTo(AgentNames.JOB_SEARCH);

            state = TestStates.step(state, AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.JOB_SEARCH, ""));
            assertThat(tight.decide(state, false).reason()).isEqualTo(TerminationReason.STEP_BUDGET_EXCEEDED);
        }

        @Test
        @DisplayName("should still complete at the step ceiling when nothing is left to run")
        void completionAtStepCeiling() {
            WorkflowRouter tight = new WorkflowRouter(catalog, registry, 5, 1);
            WorkflowState state = TestStates.step(TestStates.initial("job_search"), AgentNames.JOB_SEARCH,
                    StepOutcome.proceed(StateDelta.empty()));

            assertThat(tight.decide(state, false).reason()).isEqualTo(TerminationReason.COMPLETED);
        }

        @Test
        @DisplayName("should stop a cancelled run before anything else")
        void cancellation() {
            WorkflowState state = TestStates.step(TestStates.initial("job_search"), AgentNames.JOB_SEARCH,
                    StepOutcome.handoff(StateDelta.empty(), AgentNames.RESUME_CRITIC, ""));

            assertThat(router.decide(state, true).reason()).isEqualTo(TerminationReason.CANCELLED);
        }
    }
}
