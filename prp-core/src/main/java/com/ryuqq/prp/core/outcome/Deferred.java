package com.ryuqq.prp.core.outcome;

import com.ryuqq.prp.core.pipeline.PhaseResult;
import com.ryuqq.prp.core.pipeline.PipelinePhase;

import java.time.Duration;
import java.util.List;

/**
 * Rate gate 거부로 인한 연기 (오류 아님).
 *
 * <p>아이템은 완료 집합에 추가되지 않으므로 Queue Scanner가 다음 사이클에 다시 제공합니다.
 * 이미 생성된 산출물은 그대로 남아 재시도 시 short-circuit으로 재사용됩니다.</p>
 *
 * @param itemName 아이템 이름
 * @param phase 거부된 rate gate 단계
 * @param reason 거부 사유 (로깅용)
 * @param waitEstimate 예상 대기 시간 (참고용)
 * @param phases 거부 전까지 수행한 단계 결과
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Deferred(
    String itemName,
    PipelinePhase phase,
    String reason,
    Duration waitEstimate,
    List<PhaseResult> phases
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Deferred {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        if (phase == null || !phase.isRateGate()) {
            throw new IllegalArgumentException("phase must be a rate gate (current: " + phase + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (waitEstimate == null || waitEstimate.isNegative()) {
            throw new IllegalArgumentException("waitEstimate must be non-negative (current: " + waitEstimate + ")");
        }
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
