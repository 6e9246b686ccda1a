package com.ryuqq.prp.core.exception;

/**
 * 상태 저장소 I/O 실패.
 *
 * <p>정확성이 영속 상태에 의존하므로 치명적 오류로 취급합니다.
 * 파이프라인과 실행 루프는 이 예외를 잡지 않고 전파하여 루프를 중단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
