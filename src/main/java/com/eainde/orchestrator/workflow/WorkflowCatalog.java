package com.eainde.orchestrator.workflow;

import com.eainde.orchestrator.agent.AgentNames;
import com.eainde.orchestrator.error.SubmissionException;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of workflow definitions keyed by type.
 */
public final class WorkflowCatalog {

    private final Map<WorkflowType, WorkflowDefinition> definitions;

    public WorkflowCatalog(Collection<WorkflowDefinition> definitions) {
        Map<WorkflowType, WorkflowDefinition> byType = new EnumMap<>(WorkflowType.class);
        for (WorkflowDefinition definition : definitions) {
            if (byType.putIfAbsent(definition.type(), definition) != null) {
                throw new IllegalArgumentException("Duplicate workflow definition: " + definition.type());
            }
        }
        this.definitions = Map.copyOf(byType);
    }

    /**
     * The five standard job-hunting workflows.
     */
    public static WorkflowCatalog standard(CompletionPolicy policy, int maxAttemptsPerAgent) {
        return new WorkflowCatalog(List.of(
                new WorkflowDefinition(WorkflowType.JOB_SEARCH,
                        "Job Search",
                        "Search and aggregate job postings from multiple sources",
                        "2-5 minutes",
                        List.of(AgentNames.JOB_SEARCH),
                        policy, maxAttemptsPerAgent),
                new WorkflowDefinition(WorkflowType.RESUME_ANALYSIS,
                        "Resume Analysis",
                        "Analyze resume quality and how well it matches job postings",
                        "3-7 minutes",
                        List.of(AgentNames.RESUME_CRITIC),
                        policy, maxAttemptsPerAgent),
                new WorkflowDefinition(WorkflowType.SKILL_ANALYSIS,
                        "Skill Analysis",
                        "Analyze skill demand trends and build a skill heatmap",
                        "4-8 minutes",
                        List.of(AgentNames.SKILL_HEATMAP),
                        policy, maxAttemptsPerAgent),
                new WorkflowDefinition(WorkflowType.RESUME_OPTIMIZATION,
                        "Resume Optimization",
                        "Optimize and rewrite resume content",
                        "5-10 minutes",
                        List.of(AgentNames.RESUME_REWRITE),
                        policy, maxAttemptsPerAgent),
                new WorkflowDefinition(WorkflowType.COMPREHENSIVE,
                        "Comprehensive Analysis",
                        "Complete job hunting assistance covering every agent",
                        "15-30 minutes",
                        List.of(AgentNames.JOB_SEARCH, AgentNames.RESUME_CRITIC,
                                AgentNames.SKILL_HEATMAP, AgentNames.RESUME_REWRITE),
                        policy, maxAttemptsPerAgent)
        ));
    }

    public Optional<WorkflowDefinition> find(WorkflowType type) {
        return Optional.ofNullable(type).map(definitions::get);
    }

    public WorkflowDefinition get(WorkflowType type) {
        return find(type).orElseThrow(() -> new SubmissionException("No workflow definition for type: " + type));
    }

    /** All definitions, in workflow type order. */
    public List<WorkflowDefinition> definitions() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(WorkflowDefinition::type))
                .toList();
    }
}
