package com.ryuqq.prp.adapter.script;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.model.RequestPhase;
import com.ryuqq.prp.core.spi.RequestBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@code create-batch-request.sh} 기반 RequestBuilder.
 *
 * <pre>
 * create-batch-request.sh --context &lt;context&gt; --phase draft|generate --output &lt;request&gt;
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptRequestBuilder implements RequestBuilder {

    public static final String SCRIPT = "create-batch-request.sh";

    private final ScriptRunner runner;
    private final Duration timeout;

    public ScriptRequestBuilder(ScriptRunner runner, Duration timeout) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public Path build(Path contextFile, RequestPhase phase, Path requestFile) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        runner.run(SCRIPT, List.of(
            "--context", contextFile.toString(),
            "--phase", phase.cliValue(),
            "--output", requestFile.toString()
        ), timeout);
        if (!Files.isRegularFile(requestFile)) {
            throw new CollaboratorException("Batch request was not created: " + requestFile);
        }
        return requestFile;
    }
}
