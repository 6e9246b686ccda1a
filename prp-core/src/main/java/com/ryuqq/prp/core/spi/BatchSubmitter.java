package com.ryuqq.prp.core.spi;

import com.ryuqq.prp.core.exception.SubmissionException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Submits a request payload to the remote batch execution service and waits for it.
 *
 * <p>This call is the expensive operation guarded by the rate limiter. It blocks until
 * the remote batch ends or the timeout expires; the timeout is owned here, not by the
 * pipeline.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BatchSubmitter {

    /**
     * Submits the request and collects the produced artifacts.
     *
     * @param requestFile the request payload
     * @param outputDirectory where produced artifacts are written
     * @param timeout how long to wait for the remote batch
     * @return produced artifact paths (may be empty)
     * @throws SubmissionException on remote failure or timeout
     */
    List<Path> submit(Path requestFile, Path outputDirectory, Duration timeout);
}
