package com.ryuqq.prp.core.spi;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.model.RequestPhase;

import java.nio.file.Path;

/**
 * Builds a model-ready batch request payload from a context artifact.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RequestBuilder {

    /**
     * Writes the request payload for the given phase.
     *
     * @param contextFile the context artifact
     * @param phase draft or final
     * @param requestFile where the request payload must be written
     * @return the written request payload
     * @throws CollaboratorException if the payload cannot be built
     */
    Path build(Path contextFile, RequestPhase phase, Path requestFile);
}
