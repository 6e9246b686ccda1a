package com.ryuqq.prp.core.exception;

import java.nio.file.Path;

/**
 * 배치 결과 디렉토리에 기대한 산출물이 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ArtifactNotFoundException extends CollaboratorException {

    private final Path directory;

    public ArtifactNotFoundException(String message, Path directory) {
        super(message + ": " + directory);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
