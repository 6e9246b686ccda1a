package com.ryuqq.prp.cli;

/**
 * 시작 전 설정 검증 실패.
 *
 * <p>Run Loop 진입 전에 발생하며 CLI는 종료 코드 1로 끝납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
