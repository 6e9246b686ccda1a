package com.ryuqq.prp.core.exception;

/**
 * 외부 협력자(컨텍스트 수집기, 요청 빌더, 배치 제출기) 실패.
 *
 * <p>아이템 단위 오류입니다. 파이프라인이 잡아서 정의 파일을 failed 디렉토리로 옮기고,
 * 실행 루프는 다음 아이템으로 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
