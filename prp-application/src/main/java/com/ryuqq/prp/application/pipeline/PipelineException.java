package com.ryuqq.prp.application.pipeline;

import com.ryuqq.prp.core.exception.ArtifactNotFoundException;
import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.exception.SubmissionException;
import com.ryuqq.prp.core.outcome.Fail;
import com.ryuqq.prp.core.pipeline.PipelinePhase;

import java.io.UncheckedIOException;

/**
 * 아이템 하나의 파이프라인 실패.
 *
 * <p>실패한 아이템은 이미 failed 디렉토리로 이동되고 오류 파일이 기록된 상태입니다.
 * Run Loop는 이 예외를 {@link Fail}로 변환하고 다음 아이템으로 진행합니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>SUBMISSION: 배치 제출 실패 또는 타임아웃</li>
 *   <li>ARTIFACT_MISSING: 배치 결과에 PRP 없음</li>
 *   <li>COLLABORATOR: 컨텍스트 수집 또는 요청 생성 실패</li>
 *   <li>IO: 파일 이동 실패</li>
 *   <li>INTERNAL: 그 외</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    public static final String INTERNAL = "INTERNAL";

    private final String itemName;
    private final PipelinePhase phase;
    private final String errorCode;

    public PipelineException(String itemName, PipelinePhase phase, Throwable cause) {
        super("Failed to process " + itemName + " at " + phase + ": " + describe(cause), cause);
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        this.itemName = itemName;
        this.phase = phase;
        this.errorCode = errorCodeOf(cause);
    }

    public String getItemName() {
        return itemName;
    }

    public PipelinePhase getPhase() {
        return phase;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Run Loop에 보고할 Fail Outcome으로 변환.
     *
     * @return Fail
     */
    public Fail toFail() {
        return Fail.of(itemName, phase, errorCode, describe(getCause()));
    }

    /**
     * 오류 보고서용 한 줄 설명 (메시지가 없으면 예외 클래스 이름).
     */
    public static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static String errorCodeOf(Throwable cause) {
        if (cause instanceof SubmissionException) {
            return "SUBMISSION";
        }
        if (cause instanceof ArtifactNotFoundException) {
            return "ARTIFACT_MISSING";
        }
        if (cause instanceof CollaboratorException) {
            return "COLLABORATOR";
        }
        if (cause instanceof UncheckedIOException) {
            return "IO";
        }
        return INTERNAL;
    }
}
