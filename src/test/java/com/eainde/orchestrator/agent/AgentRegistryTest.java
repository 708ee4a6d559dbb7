package com.eainde.orchestrator.agent;

import com.eainde.orchestrator.support.StubAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    @Test
    @DisplayName("should look agents up by name")
    void lookup() {
        StubAgent search = StubAgent.succeeding(AgentNames.JOB_SEARCH);
        AgentRegistry registry = AgentRegistry.of(search, StubAgent.succeeding(AgentNames.RESUME_CRITIC));

        assertThat(registry.contains(AgentNames.JOB_SEARCH)).isTrue();
        assertThat(registry.contains("ghost")).isFalse();
        assertThat(registry.contains(null)).isFalse();
        assertThat(registry.get(AgentNames.JOB_SEARCH)).isSameAs(search);
        assertThat(registry.find("ghost")).isEmpty();
        assertThat(registry.names()).containsExactly(AgentNames.JOB_SEARCH, AgentNames.RESUME_CRITIC);
    }

    @Test
    @DisplayName("should reject duplicate names")
    void duplicateNames() {
        assertThatThrownBy(() -> AgentRegistry.of(StubAgent.succeeding("a"), StubAgent.succeeding("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate agent name: a");
    }

    @Test
    @DisplayName("should not expose a mutable view")
    void immutable() {
        AgentRegistry registry = AgentRegistry.of(StubAgent.succeeding("a"));

        assertThatThrownBy(() -> registry.names().add("b")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.get("b")).isInstanceOf(IllegalArgumentException.class);
    }
}
