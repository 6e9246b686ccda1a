package com.ryuqq.prp.core.outcome;

import com.ryuqq.prp.core.pipeline.PipelinePhase;

/**
 * 영구적 실패 (같은 실행 안에서 재시도하지 않음).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>컨텍스트 수집기가 정의 파일을 읽지 못함 (COLLABORATOR)</li>
 *   <li>배치 제출 원격 실패 또는 타임아웃 (SUBMISSION)</li>
 *   <li>배치 결과에 PRP 파일이 없음 (ARTIFACT_MISSING)</li>
 *   <li>산출물 이동 실패 (IO)</li>
 * </ul>
 *
 * @param itemName 아이템 이름
 * @param phase 실패한 단계
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    String itemName,
    PipelinePhase phase,
    String errorCode,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException itemName, errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // phase는 null 허용 (파이프라인 진입 전 실패)
    }

    public static Fail of(String itemName, PipelinePhase phase, String errorCode, String message) {
        return new Fail(itemName, phase, errorCode, message);
    }
}
