package com.ryuqq.prp.adapter.script;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.exception.SubmissionException;
import com.ryuqq.prp.core.spi.BatchSubmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@code submit-batch.sh} 기반 BatchSubmitter.
 *
 * <pre>
 * submit-batch.sh --request &lt;request&gt; --output-dir &lt;dir&gt; --api-key &lt;key&gt;
 *                 --poll-interval &lt;seconds&gt; --timeout &lt;seconds&gt;
 * </pre>
 *
 * <p>스크립트는 배치 완료까지 폴링하며 결과를 output-dir에 씁니다.
 * 프로세스 타임아웃은 제출 타임아웃에 {@link #PROCESS_GRACE}를 더한 값입니다.
 * 산출물은 output-dir의 {@code *.md} 파일 (이름순)입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptBatchSubmitter implements BatchSubmitter {

    public static final String SCRIPT = "submit-batch.sh";

    static final Duration PROCESS_GRACE = Duration.ofMinutes(5);

    private final ScriptRunner runner;
    private final String apiKey;
    private final Duration pollInterval;

    /**
     * 생성자.
     *
     * @param runner 스크립트 실행기 (apiKey가 secret으로 등록되어 있어야 함)
     * @param apiKey API key
     * @param pollInterval 배치 상태 폴링 간격
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public ScriptBatchSubmitter(ScriptRunner runner, String apiKey, Duration pollInterval) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or blank");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
        this.runner = runner;
        this.apiKey = apiKey;
        this.pollInterval = pollInterval;
    }

    @Override
    public List<Path> submit(Path requestFile, Path outputDirectory, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new SubmissionException("Cannot create output directory: " + outputDirectory, e);
        }

        try {
            runner.run(SCRIPT, List.of(
                "--request", requestFile.toString(),
                "--output-dir", outputDirectory.toString(),
                "--api-key", apiKey,
                "--poll-interval", String.valueOf(pollInterval.toSeconds()),
                "--timeout", String.valueOf(timeout.toSeconds())
            ), timeout.plus(PROCESS_GRACE));
        } catch (CollaboratorException e) {
            throw new SubmissionException("Batch submission failed: " + e.getMessage(), e);
        }

        try (Stream<Path> entries = Files.list(outputDirectory)) {
            return entries
                .filter(path -> path.getFileName().toString().endsWith(".md"))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SubmissionException("Cannot list batch results in " + outputDirectory, e);
        }
    }
}
