package com.ryuqq.prp.cli;

import com.ryuqq.prp.adapter.script.ScriptBatchSubmitter;
import com.ryuqq.prp.adapter.script.ScriptContextCollector;
import com.ryuqq.prp.adapter.script.ScriptRequestBuilder;
import com.ryuqq.prp.adapter.script.ScriptRunner;
import com.ryuqq.prp.core.spi.BatchSubmitter;
import com.ryuqq.prp.core.spi.ContextCollector;
import com.ryuqq.prp.core.spi.RequestBuilder;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

/**
 * 파이프라인 외부 협력자 묶음.
 *
 * @param collector 컨텍스트 수집기
 * @param requestBuilder 배치 요청 생성기
 * @param submitter 배치 제출기
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Collaborators(
    ContextCollector collector,
    RequestBuilder requestBuilder,
    BatchSubmitter submitter
) {

    /** 컨텍스트 수집과 요청 생성 스크립트의 최대 실행 시간. */
    public static final Duration SCRIPT_TIMEOUT = Duration.ofMinutes(10);

    public static final String SCRIPTS_DIR = "scripts";

    public Collaborators {
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }
        if (requestBuilder == null) {
            throw new IllegalArgumentException("requestBuilder cannot be null");
        }
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
    }

    /**
     * {@code <projectRoot>/scripts}의 셸 스크립트 기반 협력자.
     *
     * @param projectRoot 프로젝트 루트
     * @param settings 설정
     * @return 스크립트 기반 협력자
     */
    public static Collaborators scripts(Path projectRoot, OrchestratorSettings settings) {
        ScriptRunner runner = new ScriptRunner(projectRoot, projectRoot.resolve(SCRIPTS_DIR), Set.of(settings.apiKey()));
        return new Collaborators(
            new ScriptContextCollector(runner, SCRIPT_TIMEOUT),
            new ScriptRequestBuilder(runner, SCRIPT_TIMEOUT),
            new ScriptBatchSubmitter(runner, settings.apiKey(), settings.batchPollInterval())
        );
    }
}
