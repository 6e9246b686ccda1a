package com.ryuqq.prp.application.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 산출물을 다음 단계 디렉토리로 이동.
 *
 * <p>항상 이동(move)하며 복사하지 않습니다. {@code ATOMIC_MOVE}를 먼저 시도하고,
 * 파일 시스템이 두 디렉토리 간 원자적 이동을 지원하지 않을 때만 일반 이동으로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ArtifactRelocator {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRelocator.class);

    /**
     * 파일을 대상 디렉토리로 이동 (대상 이름 지정).
     *
     * @param source 원본 파일
     * @param targetDirectory 대상 디렉토리 (없으면 생성)
     * @param targetName 대상 파일 이름
     * @return 이동된 경로
     * @throws UncheckedIOException 이동 실패 시
     */
    public Path relocate(Path source, Path targetDirectory, String targetName) {
        if (source == null || targetDirectory == null || targetName == null || targetName.isBlank()) {
            throw new IllegalArgumentException("source, targetDirectory and targetName are required");
        }
        Path target = targetDirectory.resolve(targetName);
        try {
            Files.createDirectories(targetDirectory);
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported, falling back to plain move: {} -> {}", source, target);
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot move " + source + " to " + target, e);
        }
        return target;
    }

    /**
     * 파일을 대상 디렉토리로 같은 이름으로 이동.
     *
     * @param source 원본 파일
     * @param targetDirectory 대상 디렉토리
     * @return 이동된 경로
     * @throws UncheckedIOException 이동 실패 시
     */
    public Path relocate(Path source, Path targetDirectory) {
        return relocate(source, targetDirectory, source.getFileName().toString());
    }
}
