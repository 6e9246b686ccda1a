package com.ryuqq.prp.application.scanner;

import com.ryuqq.prp.core.model.WorkItem;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 큐 디렉토리에서 처리 대기 중인 정의 파일을 찾는 Scanner.
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ul>
 *   <li>큐 디렉토리 바로 아래의 일반 파일만 (processed/, failed/ 등 하위 디렉토리 제외)</li>
 *   <li>확장자 {@code .md} (대소문자 구분)</li>
 *   <li>완료 집합에 이름이 없는 파일</li>
 * </ul>
 *
 * <p><strong>정렬:</strong> 수정 시각 오름차순, 같으면 이름 오름차순.
 * 디렉토리 나열 순서와 무관하게 결정적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueueScanner {

    /**
     * 정의 파일 확장자.
     */
    public static final String DEFINITION_EXTENSION = ".md";

    private static final Comparator<WorkItem> OLDEST_FIRST =
        Comparator.comparing(WorkItem::lastModified).thenComparing(WorkItem::name);

    /**
     * 처리 대기 중인 아이템 목록.
     *
     * @param directory 큐 디렉토리
     * @param completed 완료된 아이템 이름 집합
     * @return 오래된 순서로 정렬된 아이템 (디렉토리가 없으면 빈 목록)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws UncheckedIOException 디렉토리 나열 실패 시
     */
    public List<WorkItem> listPending(Path directory, Set<String> completed) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (completed == null) {
            throw new IllegalArgumentException("completed cannot be null");
        }
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<WorkItem> items = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path path : (Iterable<Path>) entries::iterator) {
                String name = path.getFileName().toString();
                if (!name.endsWith(DEFINITION_EXTENSION) || !Files.isRegularFile(path)) {
                    continue;
                }
                if (completed.contains(name)) {
                    continue;
                }
                items.add(new WorkItem(name, path, Files.getLastModifiedTime(path).toInstant()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list queue directory: " + directory, e);
        }

        items.sort(OLDEST_FIRST);
        return items;
    }
}
