package com.ryuqq.prp.core.pipeline;

/**
 * 파이프라인 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>현재 단계 → 고정 순서상 다음 단계</li>
 *   <li>비종료 단계 → FAILED</li>
 *   <li>시작 단계(COLLECT_CONTEXT) → 이후의 임의 단계 (short-circuit)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(DONE, FAILED)에서는 어떤 단계로도 전이 불가</li>
 *   <li>역방향 전이 불가</li>
 *   <li>시작 단계 이외에서는 단계를 건너뛸 수 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PipelinePhase from, PipelinePhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = to == PipelinePhase.FAILED
            || to == from.next()
            || (from == PipelinePhase.initial() && from.precedes(to));

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PipelinePhase transition(PipelinePhase current, PipelinePhase next) {
        validate(current, next);
        return next;
    }
}
