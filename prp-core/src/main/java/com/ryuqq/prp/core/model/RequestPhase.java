package com.ryuqq.prp.core.model;

/**
 * 배치 요청의 생성 단계.
 *
 * <p>{@link #cliValue()}는 요청 빌더 스크립트의 {@code --phase} 인자로 전달되는 값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RequestPhase {

    /**
     * 정의 파일로부터 초안(draft) PRP 생성.
     */
    DRAFT("draft"),

    /**
     * 초안으로부터 최종 PRP 생성.
     */
    FINAL("generate");

    private final String cliValue;

    RequestPhase(String cliValue) {
        this.cliValue = cliValue;
    }

    public String cliValue() {
        return cliValue;
    }
}
