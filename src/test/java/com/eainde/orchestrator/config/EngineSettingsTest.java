package com.eainde.orchestrator.config;

import com.eainde.orchestrator.workflow.CompletionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSettingsTest {

    @Test
    @DisplayName("defaults should match the documented budgets")
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertThat(settings.maxErrors()).isEqualTo(5);
        assertThat(settings.maxSteps()).isEqualTo(50);
        assertThat(settings.stepTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(settings.completionPolicy()).isEqualTo(CompletionPolicy.ALL_REQUIRED);
        assertThat(settings.maxToolRounds()).isEqualTo(5);
    }

    @Test
    @DisplayName("withers should only change the named setting")
    void withers() {
        EngineSettings settings = EngineSettings.defaults()
                .withMaxSteps(10)
                .withCompletionPolicy(CompletionPolicy.BEST_EFFORT, 2);

        assertThat(settings.maxSteps()).isEqualTo(10);
        assertThat(settings.completionPolicy()).isEqualTo(CompletionPolicy.BEST_EFFORT);
        assertThat(settings.maxAttemptsPerAgent()).isEqualTo(2);
        assertThat(settings.maxErrors()).isEqualTo(5);
    }

    @Test
    @DisplayName("should reject budgets out of range")
    void rejectsInvalidValues() {
        EngineSettings defaults = EngineSettings.defaults();

        assertThatThrownBy(() -> defaults.withMaxErrors(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxErrors");
        assertThatThrownBy(() -> defaults.withMaxSteps(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSteps");
        assertThatThrownBy(() -> defaults.withStepTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withCompletionPolicy(CompletionPolicy.BEST_EFFORT, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
