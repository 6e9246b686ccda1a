package com.ryuqq.prp.core.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 큐 오케스트레이터가 사용하는 디렉토리 구성.
 *
 * <p><strong>기본 레이아웃 (프로젝트 루트 기준):</strong></p>
 * <pre>
 * prp/queue/              ← 입력 정의 파일 (*.md)
 * prp/queue/processed/    ← 예약
 * prp/queue/failed/       ← 실패한 정의 + &lt;stem&gt;-error.txt
 * prp/drafts/             ← 재배치된 초안 PRP
 * prp/active/             ← 재배치된 최종 PRP (실행 대기)
 * prp/completed/          ← 예약 (하위 실행 단계용)
 * batch/                  ← staging (context, request, results)
 * logs/                   ← 상태 파일 및 로그
 * </pre>
 *
 * @param root 프로젝트 루트
 * @param queueDir 큐 디렉토리
 * @param draftsDir 초안 디렉토리
 * @param activeDir 최종 산출물 디렉토리
 * @param completedDir 완료 디렉토리
 * @param processedDir 처리 완료 정의 디렉토리
 * @param failedDir 실패 디렉토리
 * @param batchDir staging 디렉토리
 * @param logsDir 로그 디렉토리
 * @param stateFile 상태 파일 경로
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueueLayout(
    Path root,
    Path queueDir,
    Path draftsDir,
    Path activeDir,
    Path completedDir,
    Path processedDir,
    Path failedDir,
    Path batchDir,
    Path logsDir,
    Path stateFile
) {

    public static final String STATE_FILE_NAME = "prp-orchestrator-state.json";

    public QueueLayout {
        if (root == null || queueDir == null || draftsDir == null || activeDir == null
            || completedDir == null || processedDir == null || failedDir == null
            || batchDir == null || logsDir == null || stateFile == null) {
            throw new IllegalArgumentException("layout paths cannot be null");
        }
    }

    /**
     * 프로젝트 루트 아래의 기본 레이아웃 생성.
     *
     * @param root 프로젝트 루트
     * @return 기본 레이아웃
     * @throws IllegalArgumentException root가 null인 경우
     */
    public static QueueLayout under(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        Path queue = root.resolve("prp").resolve("queue");
        Path logs = root.resolve("logs");
        return new QueueLayout(
            root,
            queue,
            root.resolve("prp").resolve("drafts"),
            root.resolve("prp").resolve("active"),
            root.resolve("prp").resolve("completed"),
            queue.resolve("processed"),
            queue.resolve("failed"),
            root.resolve("batch"),
            logs,
            logs.resolve(STATE_FILE_NAME)
        );
    }

    /**
     * 모든 디렉토리를 생성 (이미 존재하면 무시).
     *
     * @throws UncheckedIOException 디렉토리 생성 실패 시
     */
    public void ensureDirectories() {
        for (Path dir : directories()) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory: " + dir, e);
            }
        }
    }

    /**
     * 레이아웃의 모든 디렉토리.
     *
     * @return 디렉토리 목록 (생성 순서)
     */
    public List<Path> directories() {
        return List.of(queueDir, draftsDir, activeDir, completedDir, processedDir, failedDir, logsDir, batchDir);
    }
}
