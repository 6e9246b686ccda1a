package com.ryuqq.prp.core.outcome;

import com.ryuqq.prp.core.pipeline.PhaseResult;

import java.nio.file.Path;
import java.util.List;

/**
 * 성공 결과.
 *
 * <p>아이템의 최종 산출물이 active 디렉토리에 위치하고 완료 집합에 기록되었음을 나타냅니다.</p>
 *
 * @param itemName 아이템 이름
 * @param artifacts 최종 산출물 경로
 * @param phases 이번 실행에서 수행한 단계 결과 (순서대로)
 * @param shortCircuited 이전 실행의 산출물로 인해 단계를 건너뛰었는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    String itemName,
    List<Path> artifacts,
    List<PhaseResult> phases,
    boolean shortCircuited
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException itemName이 null이거나 빈 문자열인 경우
     */
    public Ok {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
