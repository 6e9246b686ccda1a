package com.ryuqq.prp.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 큐에 들어온 정의(definition) 파일 하나.
 *
 * <p>WorkItem은 파이프라인을 통과하는 동안 변경되지 않습니다.
 * 파생 산출물이 다음 단계 디렉토리로 이동(promote)하거나,
 * 원본 파일이 failed 디렉토리로 이동(retire)할 뿐입니다.</p>
 *
 * <p><strong>식별:</strong></p>
 * <ul>
 *   <li>name: 파일의 base name (완료 집합의 중복 제거 키)</li>
 *   <li>path: 파일 시스템 위치</li>
 *   <li>lastModified: 정렬 키 (오래된 것부터 처리)</li>
 * </ul>
 *
 * @param name 파일 이름 (예: feature-a.md)
 * @param path 파일 경로
 * @param lastModified 마지막 수정 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem(String name, Path path, Instant lastModified) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 name이 비어있는 경우
     */
    public WorkItem {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (lastModified == null) {
            throw new IllegalArgumentException("lastModified cannot be null");
        }
    }

    /**
     * 확장자를 제외한 이름.
     *
     * <p>아이템별 산출물 파일명(context, request, results)의 접두사로 사용됩니다.</p>
     *
     * @return stem (예: feature-a.md → feature-a)
     */
    public String stem() {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
