package com.ryuqq.prp.core.spi;

import com.ryuqq.prp.core.exception.CollaboratorException;

import java.nio.file.Path;

/**
 * Collects project context for a definition or draft file.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ContextCollector {

    /**
     * Writes the context artifact for the given source file.
     *
     * @param sourceFile the definition (or relocated draft) to collect context for
     * @param contextFile where the context artifact must be written
     * @return the written context artifact
     * @throws CollaboratorException if the source is unreadable or collection fails
     */
    Path collect(Path sourceFile, Path contextFile);
}
