package com.ryuqq.prp.core.exception;

/**
 * 배치 제출 실패 (원격 측 오류 및 타임아웃 포함).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SubmissionException extends CollaboratorException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
