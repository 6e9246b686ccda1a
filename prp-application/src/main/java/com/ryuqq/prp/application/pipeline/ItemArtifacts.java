package com.ryuqq.prp.application.pipeline;

import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.model.WorkItem;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 아이템 하나의 단계별 산출물 경로.
 *
 * <p>모든 이름은 아이템 stem에서 파생됩니다. 재배치된 산출물은 아이템별 하위 디렉토리
 * {@code <stem>/}에 놓이므로 stem이 다른 아이템의 stem으로 시작하더라도 섞이지 않습니다.</p>
 *
 * <pre>
 * batch/&lt;stem&gt;-context.json           COLLECT_CONTEXT
 * batch/&lt;stem&gt;-draft-request.jsonl    BUILD_DRAFT_REQUEST
 * batch/&lt;stem&gt;-draft-results/         SUBMIT_DRAFT
 * prp/drafts/&lt;stem&gt;/&lt;draft&gt;          RELOCATE_DRAFT
 * batch/&lt;stem&gt;-gen-context.json       COLLECT_DRAFT_CONTEXT
 * batch/&lt;stem&gt;-gen-request.jsonl      BUILD_FINAL_REQUEST
 * batch/&lt;stem&gt;-gen-results/           SUBMIT_FINAL
 * prp/active/&lt;stem&gt;/&lt;prp&gt;            RELOCATE_FINAL
 * </pre>
 *
 * @param item 아이템
 * @param layout 디렉토리 구성
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ItemArtifacts(WorkItem item, QueueLayout layout) {

    /**
     * 결과 산출물 확장자.
     */
    public static final String MARKDOWN = ".md";

    /**
     * 초안 결과 파일 이름에 포함되는 표식.
     */
    public static final String DRAFT_MARKER = "prp-";

    public ItemArtifacts {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
    }

    public Path contextFile() {
        return staged("-context.json");
    }

    public Path draftRequestFile() {
        return staged("-draft-request.jsonl");
    }

    public Path draftResultsDir() {
        return staged("-draft-results");
    }

    public Path genContextFile() {
        return staged("-gen-context.json");
    }

    public Path genRequestFile() {
        return staged("-gen-request.jsonl");
    }

    public Path genResultsDir() {
        return staged("-gen-results");
    }

    /**
     * 이 아이템의 초안이 재배치되는 디렉토리.
     *
     * @return {@code prp/drafts/<stem>}
     */
    public Path draftsDir() {
        return layout.draftsDir().resolve(item.stem());
    }

    /**
     * 이 아이템의 최종 PRP가 재배치되는 디렉토리.
     *
     * @return {@code prp/active/<stem>}
     */
    public Path activeDir() {
        return layout.activeDir().resolve(item.stem());
    }

    /**
     * 초안 결과 디렉토리의 초안 PRP (이름에 prp- 포함).
     *
     * @return 초안 PRP 목록, 이름순 (없으면 빈 목록)
     */
    public List<Path> stagedDrafts() {
        return markdownFiles(draftResultsDir(), name -> name.contains(DRAFT_MARKER));
    }

    /**
     * 최종 결과 디렉토리의 모든 PRP (이름순).
     *
     * @return 최종 PRP 목록 (없으면 빈 목록)
     */
    public List<Path> stagedFinals() {
        return markdownFiles(genResultsDir(), name -> true);
    }

    /**
     * drafts 디렉토리로 재배치된 이 아이템의 초안.
     *
     * @return 재배치된 초안 목록 (이름순)
     */
    public List<Path> relocatedDrafts() {
        return markdownFiles(draftsDir(), name -> true);
    }

    /**
     * active 디렉토리로 재배치된 이 아이템의 최종 PRP.
     *
     * @return 최종 PRP 목록 (이름순)
     */
    public List<Path> activeArtifacts() {
        return markdownFiles(activeDir(), name -> true);
    }

    public Path errorFile() {
        return layout.failedDir().resolve(item.stem() + "-error.txt");
    }

    private Path staged(String suffix) {
        return layout.batchDir().resolve(item.stem() + suffix);
    }

    private static List<Path> markdownFiles(Path directory, Predicate<String> nameFilter) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.endsWith(MARKDOWN) && nameFilter.test(name);
                })
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list directory: " + directory, e);
        }
    }
}
