package com.ryuqq.prp.core.pipeline;

/**
 * 아이템 하나가 거치는 파이프라인 단계.
 *
 * <p><strong>고정 순서:</strong></p>
 * <pre>
 * COLLECT_CONTEXT
 *    ▼
 * BUILD_DRAFT_REQUEST
 *    ▼
 * RATE_GATE_1          ── deny → (단계 유지, 아이템 연기)
 *    ▼
 * SUBMIT_DRAFT
 *    ▼
 * RELOCATE_DRAFT
 *    ▼
 * COLLECT_DRAFT_CONTEXT
 *    ▼
 * BUILD_FINAL_REQUEST
 *    ▼
 * RATE_GATE_2          ── deny → (단계 유지, 아이템 연기)
 *    ▼
 * SUBMIT_FINAL
 *    ▼
 * RELOCATE_FINAL
 *    ▼
 * DONE
 *
 * 모든 비종료 단계 ─► FAILED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PipelinePhase {

    COLLECT_CONTEXT,
    BUILD_DRAFT_REQUEST,
    RATE_GATE_1,
    SUBMIT_DRAFT,
    RELOCATE_DRAFT,
    COLLECT_DRAFT_CONTEXT,
    BUILD_FINAL_REQUEST,
    RATE_GATE_2,
    SUBMIT_FINAL,
    RELOCATE_FINAL,

    /**
     * 완료 (성공).
     */
    DONE,

    /**
     * 실패 (영구). 순서에 속하지 않으며 모든 비종료 단계에서 도달 가능.
     */
    FAILED;

    /**
     * 파이프라인 시작 단계.
     *
     * @return COLLECT_CONTEXT
     */
    public static PipelinePhase initial() {
        return COLLECT_CONTEXT;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Rate Limiter를 거치는 단계인지 확인.
     *
     * @return RATE_GATE_1 또는 RATE_GATE_2인 경우 true
     */
    public boolean isRateGate() {
        return this == RATE_GATE_1 || this == RATE_GATE_2;
    }

    /**
     * 고정 순서상 다음 단계.
     *
     * @return 다음 단계
     * @throws IllegalStateException 종료 상태에서 호출한 경우
     */
    public PipelinePhase next() {
        if (isTerminal()) {
            throw new IllegalStateException("Terminal phase has no successor: " + this);
        }
        return values()[ordinal() + 1];
    }

    /**
     * 고정 순서상 this가 other보다 앞서는지 확인.
     *
     * @param other 비교 대상 (FAILED 제외)
     * @return this가 먼저 실행되는 단계이면 true
     */
    public boolean precedes(PipelinePhase other) {
        return this != FAILED && other != FAILED && ordinal() < other.ordinal();
    }
}
