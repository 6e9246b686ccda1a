package com.ryuqq.prp.core.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * 단일 단계의 실행 결과.
 *
 * <p>영속화되지 않습니다. 지속되는 것은 부수 효과(파일 이동, 상태 기록, 로그)뿐입니다.</p>
 *
 * @param phase 실행한 단계
 * @param success 성공 여부
 * @param artifacts 생성/이동된 산출물 경로 (실패 시 빈 목록)
 * @param errorDetail 실패 상세 (성공 시 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PhaseResult(
    PipelinePhase phase,
    boolean success,
    List<Path> artifacts,
    String errorDetail
) {

    public PhaseResult {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        if (!success && (errorDetail == null || errorDetail.isBlank())) {
            throw new IllegalArgumentException("errorDetail cannot be null or blank for a failed phase");
        }
    }

    public static PhaseResult success(PipelinePhase phase, List<Path> artifacts) {
        return new PhaseResult(phase, true, artifacts, null);
    }

    public static PhaseResult success(PipelinePhase phase, Path artifact) {
        return new PhaseResult(phase, true, List.of(artifact), null);
    }

    public static PhaseResult success(PipelinePhase phase) {
        return new PhaseResult(phase, true, List.of(), null);
    }

    public static PhaseResult failure(PipelinePhase phase, String errorDetail) {
        return new PhaseResult(phase, false, List.of(), errorDetail);
    }
}
