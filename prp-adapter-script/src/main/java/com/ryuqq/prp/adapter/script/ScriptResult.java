package com.ryuqq.prp.adapter.script;

import java.util.List;

/**
 * 스크립트 실행 결과.
 *
 * @param exitCode 종료 코드
 * @param outputTail 마지막 출력 줄 (stdout + stderr, 민감 정보 마스킹됨)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScriptResult(int exitCode, List<String> outputTail) {

    public ScriptResult {
        outputTail = outputTail == null ? List.of() : List.copyOf(outputTail);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
