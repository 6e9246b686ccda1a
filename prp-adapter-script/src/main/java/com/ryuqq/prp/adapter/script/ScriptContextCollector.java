package com.ryuqq.prp.adapter.script;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.spi.ContextCollector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@code collect-prp-context.sh} 기반 ContextCollector.
 *
 * <pre>
 * collect-prp-context.sh --prp-file &lt;source&gt; --output &lt;context&gt; --verbose
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptContextCollector implements ContextCollector {

    public static final String SCRIPT = "collect-prp-context.sh";

    private final ScriptRunner runner;
    private final Duration timeout;

    public ScriptContextCollector(ScriptRunner runner, Duration timeout) {
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
    public Path collect(Path sourceFile, Path contextFile) {
        runner.run(SCRIPT, List.of(
            "--prp-file", sourceFile.toString(),
            "--output", contextFile.toString(),
            "--verbose"
        ), timeout);
        if (!Files.isRegularFile(contextFile)) {
            throw new CollaboratorException("Context file was not created: " + contextFile);
        }
        return contextFile;
    }
}
