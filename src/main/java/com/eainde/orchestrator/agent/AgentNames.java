package com.eainde.orchestrator.agent;

/**
 * Names of the agents registered by default. Each name is both the routing key
 * and the handoff target ({@code transfer_to_<name>}).
 *
 * <pre>
 * comprehensive:
 *   job_search_agent → resume_critic_agent → skill_heatmap_agent → resume_rewrite_agent
 *
 * handoffs:
 *   resume_critic_agent → resume_rewrite_agent, skill_heatmap_agent
 *   skill_heatmap_agent → resume_rewrite_agent
 * </pre>
 */
public final class AgentNames {

    private AgentNames() {}

    /** Finds job postings matching the user's query and profile. */
    public static final String JOB_SEARCH = "job_search_agent";

    /** Reviews a resume and scores its strengths and gaps. */
    public static final String RESUME_CRITIC = "resume_critic_agent";

    /** Maps the user's skills against market demand. */
    public static final String SKILL_HEATMAP = "skill_heatmap_agent";

    /** Rewrites the resume using the critique and skill analysis. */
    public static final String RESUME_REWRITE = "resume_rewrite_agent";
}
