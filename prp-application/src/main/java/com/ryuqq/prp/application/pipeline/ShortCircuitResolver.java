package com.ryuqq.prp.application.pipeline;

import com.ryuqq.prp.core.pipeline.PipelinePhase;

import java.nio.file.Files;

/**
 * 이전 실행의 산출물로부터 재개 단계를 결정.
 *
 * <p>Collaborator를 호출하기 전에 한 번만 평가하며, 가장 늦은 단계의 증거가 우선합니다.</p>
 *
 * <p><strong>우선순위:</strong></p>
 * <ol>
 *   <li>active/&lt;stem&gt;/*.md 존재 → DONE</li>
 *   <li>최종 결과(gen-results)에 .md 존재 → RELOCATE_FINAL</li>
 *   <li>최종 요청 + 재배치된 초안 존재 → RATE_GATE_2</li>
 *   <li>재배치된 초안 존재 → COLLECT_DRAFT_CONTEXT</li>
 *   <li>초안 결과(draft-results)에 초안 존재 → RELOCATE_DRAFT</li>
 *   <li>초안 요청 존재 → RATE_GATE_1</li>
 *   <li>그 외 → COLLECT_CONTEXT</li>
 * </ol>
 *
 * <p>반환값은 항상 {@link PipelinePhase#initial()}에서 유효한 전이 대상입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShortCircuitResolver {

    /**
     * 재개 단계 결정.
     *
     * @param artifacts 아이템 산출물 경로
     * @return 시작할 단계
     * @throws IllegalArgumentException artifacts가 null인 경우
     */
    public PipelinePhase resolve(ItemArtifacts artifacts) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }

        if (!artifacts.activeArtifacts().isEmpty()) {
            return PipelinePhase.DONE;
        }
        if (!artifacts.stagedFinals().isEmpty()) {
            return PipelinePhase.RELOCATE_FINAL;
        }

        boolean draftRelocated = !artifacts.relocatedDrafts().isEmpty();
        if (draftRelocated && Files.isRegularFile(artifacts.genRequestFile())) {
            return PipelinePhase.RATE_GATE_2;
        }
        if (draftRelocated) {
            return PipelinePhase.COLLECT_DRAFT_CONTEXT;
        }
        if (!artifacts.stagedDrafts().isEmpty()) {
            return PipelinePhase.RELOCATE_DRAFT;
        }
        if (Files.isRegularFile(artifacts.draftRequestFile())) {
            return PipelinePhase.RATE_GATE_1;
        }
        return PipelinePhase.initial();
    }
}
