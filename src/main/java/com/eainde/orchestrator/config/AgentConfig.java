package com.eainde.orchestrator.config;

import com.eainde.orchestrator.agent.AgentFactory;
import com.eainde.orchestrator.agent.AgentNames;
import com.eainde.orchestrator.agent.AgentRegistry;
import com.eainde.orchestrator.agent.AgentSpec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The four job-hunting agents and how they may hand off to one another.
 *
 * <pre>
 *   job_search_agent
 *   resume_critic_agent ──handoff──▶ resume_rewrite_agent, skill_heatmap_agent
 *   skill_heatmap_agent ──handoff──▶ resume_rewrite_agent
 *   resume_rewrite_agent
 * </pre>
 */
@Configuration
public class AgentConfig {

    // =========================================================================
    //  Agent Specs
    // =========================================================================

    static final AgentSpec JOB_SEARCH = AgentSpec
            .of(AgentNames.JOB_SEARCH, "Searches and aggregates job postings from multiple sources")
            .systemPrompt("You find job postings that match the user's query and profile.")
            .build();

    static final AgentSpec RESUME_CRITIC = AgentSpec
            .of(AgentNames.RESUME_CRITIC, "Analyzes resume quality and job match")
            .systemPrompt("You review resumes and explain their strengths and gaps.")
            .handoffTo(AgentNames.RESUME_REWRITE, AgentNames.SKILL_HEATMAP)
            .build();

    static final AgentSpec SKILL_HEATMAP = AgentSpec
            .of(AgentNames.SKILL_HEATMAP, "Analyzes skill demand trends and builds skill heatmaps")
            .systemPrompt("You compare the user's skills with market demand.")
            .handoffTo(AgentNames.RESUME_REWRITE)
            .build();

    static final AgentSpec RESUME_REWRITE = AgentSpec
            .of(AgentNames.RESUME_REWRITE, "Optimizes and rewrites resume content")
            .systemPrompt("You rewrite resumes using the critique and skill analysis available.")
            .build();

    @Bean
    public AgentRegistry agentRegistry(AgentFactory agentFactory) {
        return agentFactory.registry(JOB_SEARCH, RESUME_CRITIC, SKILL_HEATMAP, RESUME_REWRITE);
    }
}
