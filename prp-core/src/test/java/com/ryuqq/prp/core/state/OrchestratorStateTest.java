package com.ryuqq.prp.core.state;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorState 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorStateTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    void initial_IsEmpty() {
        // When
        OrchestratorState state = OrchestratorState.initial();

        // Then
        assertThat(state.lastSubmissionTime()).isNull();
        assertThat(state.submissionTimes()).isEmpty();
        assertThat(state.completedItems()).isEmpty();
        assertThat(state.currentItem()).isNull();
    }

    @Test
    void withSubmission_PrunesEntriesOlderThanOneHour() {
        // Given
        OrchestratorState state = OrchestratorState.initial()
            .withSubmission(T0)
            .withSubmission(T0.plus(Duration.ofMinutes(30)));

        // When
        Instant later = T0.plus(Duration.ofMinutes(75));
        OrchestratorState next = state.withSubmission(later);

        // Then
        assertThat(next.submissionTimes()).containsExactly(T0.plus(Duration.ofMinutes(30)), later);
        assertThat(next.lastSubmissionTime()).isEqualTo(later);
    }

    @Test
    void constructor_SortsSubmissionTimes() {
        // When
        OrchestratorState state = new OrchestratorState(null,
            List.of(T0.plusSeconds(60), T0), Set.of(), null);

        // Then
        assertThat(state.submissionTimes()).containsExactly(T0, T0.plusSeconds(60));
    }

    @Test
    void withCompleted_AddsNameAndClearsCurrent() {
        // Given
        OrchestratorState state = OrchestratorState.initial().withCurrentItem("a.md");

        // When
        OrchestratorState next = state.withCompleted("a.md").withCompleted("a.md");

        // Then
        assertThat(next.completedItems()).containsExactly("a.md");
        assertThat(next.currentItem()).isNull();
        assertThat(next.isCompleted("a.md")).isTrue();
        assertThat(state.isCompleted("a.md")).isFalse();
    }

    @Test
    void completedItems_KeepInsertionOrder() {
        // When
        OrchestratorState state = OrchestratorState.initial()
            .withCompleted("c.md")
            .withCompleted("a.md")
            .withCompleted("b.md");

        // Then
        assertThat(state.completedItems()).containsExactly("c.md", "a.md", "b.md");
    }

    @Test
    void completedItems_AreUnmodifiable() {
        // Given
        OrchestratorState state = OrchestratorState.initial().withCompleted("a.md");

        // When & Then
        assertThatThrownBy(() -> state.completedItems().add("b.md"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withCompleted_BlankName_ThrowsException() {
        assertThatThrownBy(() -> OrchestratorState.initial().withCompleted(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
