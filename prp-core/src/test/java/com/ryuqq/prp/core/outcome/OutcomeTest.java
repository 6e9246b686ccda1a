package com.ryuqq.prp.core.outcome;

import com.ryuqq.prp.core.pipeline.PipelinePhase;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome Sealed Interface 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_IsOk_ReturnsTrue() {
        // Given
        Outcome outcome = new Ok("a.md", List.of(), List.of(), false);

        // When & Then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isDeferred());
        assertFalse(outcome.isFail());
        assertEquals("a.md", outcome.itemName());
    }

    @Test
    void deferred_IsDeferred_ReturnsTrue() {
        // Given
        Outcome outcome = new Deferred("a.md", PipelinePhase.RATE_GATE_1, "Wait 5 minutes.", Duration.ofMinutes(5), List.of());

        // When & Then
        assertFalse(outcome.isOk());
        assertTrue(outcome.isDeferred());
        assertFalse(outcome.isFail());
    }

    @Test
    void deferred_NonGatePhase_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Deferred("a.md", PipelinePhase.SUBMIT_DRAFT, "reason", Duration.ZERO, List.of()));
    }

    @Test
    void fail_IsFail_ReturnsTrue() {
        // Given
        Outcome outcome = Fail.of("a.md", PipelinePhase.COLLECT_CONTEXT, "COLLABORATOR", "unreadable");

        // When & Then
        assertFalse(outcome.isOk());
        assertFalse(outcome.isDeferred());
        assertTrue(outcome.isFail());
    }

    @Test
    void fail_BlankMessage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Fail.of("a.md", PipelinePhase.COLLECT_CONTEXT, "COLLABORATOR", " "));
    }
}
